package com.codeheadsystems.warden.security.signing;

import java.util.Objects;

/**
 * The API key and the application identity it is bound to. Immutable for the life of a client.
 *
 * @param apiKey      the secret API key
 * @param appIdentity the application identity
 */
public record Credential(String apiKey, AppIdentity appIdentity) {

  public Credential {
    Objects.requireNonNull(apiKey, "apiKey");
    Objects.requireNonNull(appIdentity, "appIdentity");
  }

  @Override
  public String toString() {
    return "Credential[apiKey=****, appIdentity=" + appIdentity + "]";
  }
}
