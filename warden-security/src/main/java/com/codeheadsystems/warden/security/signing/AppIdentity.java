package com.codeheadsystems.warden.security.signing;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity of the calling application, bound into every request signature.
 * <p>
 * The application identifier is compared case-insensitively by the server, so the signer always
 * uses {@link #normalizedAppId()}. The team identifier is optional; platform-style prefixes such as
 * {@code "ABCDE12345."} are accepted and the surrounding dots dropped.
 *
 * @param appId  the application (bundle) identifier, sent as-is in headers
 * @param teamId the organizational team identifier, or null
 */
public record AppIdentity(String appId, String teamId) {

  public AppIdentity {
    Objects.requireNonNull(appId, "appId");
    teamId = cleanTeamId(teamId);
  }

  /**
   * Identity without a team identifier.
   *
   * @param appId the application identifier
   */
  public AppIdentity(String appId) {
    this(appId, null);
  }

  private static String cleanTeamId(String teamId) {
    if (teamId == null) {
      return null;
    }
    String trimmed = teamId.strip();
    int start = 0;
    int end = trimmed.length();
    while (start < end && trimmed.charAt(start) == '.') {
      start++;
    }
    while (end > start && trimmed.charAt(end - 1) == '.') {
      end--;
    }
    return start == end ? null : trimmed.substring(start, end);
  }

  /**
   * Normalized app id.
   *
   * @return the lowercase form used for key derivation
   */
  public String normalizedAppId() {
    return appId.toLowerCase(Locale.ROOT);
  }

  /**
   * Team.
   *
   * @return the team identifier, if any
   */
  public Optional<String> team() {
    return Optional.ofNullable(teamId);
  }
}
