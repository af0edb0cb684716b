package com.codeheadsystems.warden.security.store;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed {@link SecureStorage} that keeps every entry in one AES-256-GCM encrypted file.
 * <p>
 * The file key is stretched from a caller-supplied passphrase with Argon2id and a random per-file
 * salt; the Argon2 parameters are stored alongside the salt so a file is always read back with the
 * cost it was written with. Each write re-encrypts the whole entry map under a fresh IV and
 * atomically replaces the file. A wrong passphrase or a modified file fails the GCM tag check and
 * is reported as {@link ErrorKind#STORAGE_FAILURE}.
 */
public class EncryptedFileSecureStorage implements SecureStorage {

  private static final Logger log = LoggerFactory.getLogger(EncryptedFileSecureStorage.class);

  private static final int FORMAT_VERSION = 1;
  private static final int KEY_LENGTH = 32;
  private static final int SALT_LENGTH = 16;
  private static final int IV_LENGTH = 12;
  private static final int TAG_BITS = 128;
  private static final byte[] AAD = "warden-secure-storage-v1".getBytes(StandardCharsets.US_ASCII);
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();
  private static final TypeReference<Map<String, String>> ENTRIES = new TypeReference<>() {
  };

  private final Path path;
  private final ObjectMapper objectMapper;
  private final SecureRandom random;
  private final KdfParameters kdf;
  private final byte[] salt;
  private final byte[] key;
  private final Map<String, byte[]> entries = new HashMap<>();

  /**
   * Opens (or prepares to create) the storage file with production Argon2id parameters.
   *
   * @param path       the storage file
   * @param passphrase the passphrase protecting the file
   */
  public EncryptedFileSecureStorage(final Path path, final char[] passphrase) {
    this(path, passphrase, KdfParameters.DEFAULT, new ObjectMapper(), new SecureRandom());
  }

  /**
   * Opens (or prepares to create) the storage file.
   *
   * @param path         the storage file
   * @param passphrase   the passphrase protecting the file
   * @param kdf          Argon2id parameters used when a new file is created
   * @param objectMapper the object mapper
   * @param random       the random source for salts and IVs
   */
  public EncryptedFileSecureStorage(final Path path,
                                    final char[] passphrase,
                                    final KdfParameters kdf,
                                    final ObjectMapper objectMapper,
                                    final SecureRandom random) {
    log.info("EncryptedFileSecureStorage({})", path);
    this.path = path;
    this.objectMapper = objectMapper;
    this.random = random;
    if (Files.exists(path)) {
      StorageFile file = readFile();
      this.kdf = new KdfParameters(file.memoryKib(), file.iterations(), file.parallelism());
      this.salt = B64D.decode(file.salt());
      this.key = deriveKey(passphrase, salt, this.kdf);
      this.entries.putAll(decryptEntries(file));
      log.debug("Loaded {} entries from {}", entries.size(), path);
    } else {
      this.kdf = kdf;
      this.salt = randomBytes(SALT_LENGTH);
      this.key = deriveKey(passphrase, salt, kdf);
    }
  }

  @Override
  public synchronized Optional<byte[]> read(final String name) {
    byte[] value = entries.get(name);
    return value == null ? Optional.empty() : Optional.of(value.clone());
  }

  @Override
  public synchronized void write(final String name, final byte[] value) {
    byte[] previous = entries.put(name, value.clone());
    try {
      persist();
    } catch (WardenException e) {
      if (previous == null) {
        entries.remove(name);
      } else {
        entries.put(name, previous);
      }
      throw e;
    }
  }

  @Override
  public synchronized void delete(final String name) {
    if (entries.remove(name) != null) {
      persist();
    }
  }

  // ── File format ───────────────────────────────────────────────────────────

  private StorageFile readFile() {
    try {
      StorageFile file = objectMapper.readValue(path.toFile(), StorageFile.class);
      if (file.version() != FORMAT_VERSION) {
        throw new WardenException(ErrorKind.STORAGE_FAILURE,
            "Unsupported storage format version " + file.version() + " in " + path);
      }
      return file;
    } catch (IOException e) {
      throw new WardenException(ErrorKind.STORAGE_FAILURE, "Cannot read " + path, e);
    }
  }

  private Map<String, byte[]> decryptEntries(final StorageFile file) {
    byte[] plaintext = crypt(false, B64D.decode(file.iv()), B64D.decode(file.ciphertext()));
    try {
      Map<String, String> encoded = objectMapper.readValue(plaintext, ENTRIES);
      Map<String, byte[]> decoded = new HashMap<>();
      encoded.forEach((name, value) -> decoded.put(name, B64D.decode(value)));
      return decoded;
    } catch (IOException e) {
      throw new WardenException(ErrorKind.STORAGE_FAILURE, "Corrupt entry table in " + path, e);
    } finally {
      Arrays.fill(plaintext, (byte) 0);
    }
  }

  private void persist() {
    Map<String, String> encoded = new HashMap<>();
    entries.forEach((name, value) -> encoded.put(name, B64.encodeToString(value)));
    byte[] iv = randomBytes(IV_LENGTH);
    try {
      byte[] plaintext = objectMapper.writeValueAsBytes(encoded);
      byte[] ciphertext = crypt(true, iv, plaintext);
      Arrays.fill(plaintext, (byte) 0);
      StorageFile file = new StorageFile(FORMAT_VERSION, B64.encodeToString(salt),
          kdf.memoryKib(), kdf.iterations(), kdf.parallelism(),
          B64.encodeToString(iv), B64.encodeToString(ciphertext));
      replaceFile(objectMapper.writeValueAsBytes(file));
    } catch (IOException e) {
      throw new WardenException(ErrorKind.STORAGE_FAILURE, "Cannot write " + path, e);
    }
  }

  private void replaceFile(final byte[] content) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
    try {
      if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
        Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rw-------"));
      }
      Files.write(tmp, content);
      try {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", path);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  // ── Crypto ────────────────────────────────────────────────────────────────

  private byte[] crypt(final boolean encrypt, final byte[] iv, final byte[] input) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(encrypt, new AEADParameters(new KeyParameter(key), TAG_BITS, iv, AAD));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int len = cipher.processBytes(input, 0, input.length, out, 0);
    try {
      len += cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new WardenException(ErrorKind.STORAGE_FAILURE,
          "Wrong passphrase or tampered storage file: " + path, e);
    }
    return len == out.length ? out : Arrays.copyOf(out, len);
  }

  private static byte[] deriveKey(final char[] passphrase, final byte[] salt, final KdfParameters kdf) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withMemoryAsKB(kdf.memoryKib())
        .withIterations(kdf.iterations())
        .withParallelism(kdf.parallelism())
        .withSalt(salt)
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] out = new byte[KEY_LENGTH];
    generator.generateBytes(passphrase, out);
    return out;
  }

  private byte[] randomBytes(final int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Argon2id cost parameters for the file key.
   *
   * @param memoryKib   memory cost in KiB
   * @param iterations  iteration count
   * @param parallelism lanes
   */
  public record KdfParameters(int memoryKib, int iterations, int parallelism) {

    /**
     * Production defaults (64 MiB, 3 passes, 1 lane).
     */
    public static final KdfParameters DEFAULT = new KdfParameters(65536, 3, 1);

    /**
     * Cheap parameters for tests. Do not use in production.
     *
     * @return the kdf parameters
     */
    public static KdfParameters forTesting() {
      return new KdfParameters(64, 1, 1);
    }
  }

  /**
   * On-disk layout. Everything except the cost parameters is base64.
   */
  record StorageFile(
      @JsonProperty("version") int version,
      @JsonProperty("salt") String salt,
      @JsonProperty("memoryKib") int memoryKib,
      @JsonProperty("iterations") int iterations,
      @JsonProperty("parallelism") int parallelism,
      @JsonProperty("iv") String iv,
      @JsonProperty("ciphertext") String ciphertext) {
  }
}
