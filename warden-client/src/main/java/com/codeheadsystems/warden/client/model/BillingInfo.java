package com.codeheadsystems.warden.client.model;

import java.net.http.HttpHeaders;
import java.util.Locale;
import java.util.Optional;

/**
 * Credit accounting reported by the server on each response.
 *
 * @param creditsUsed      credits charged for this request
 * @param creditsRemaining credits left on the account
 * @param overage          true if the request went over the included quota
 */
public record BillingInfo(long creditsUsed, long creditsRemaining, boolean overage) {

  static final String CREDITS_USED = "X-Credits-Used";
  static final String CREDITS_REMAINING = "X-Credits-Remaining";
  static final String CREDITS_OVERAGE = "X-Credits-Overage";

  /**
   * Parses the billing headers. All three must be present and the counts integral.
   *
   * @param headers the response headers
   * @return the billing info, or empty
   */
  public static Optional<BillingInfo> from(HttpHeaders headers) {
    Optional<String> used = headers.firstValue(CREDITS_USED);
    Optional<String> remaining = headers.firstValue(CREDITS_REMAINING);
    Optional<String> overage = headers.firstValue(CREDITS_OVERAGE);
    if (used.isEmpty() || remaining.isEmpty() || overage.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new BillingInfo(
          Long.parseLong(used.get().strip()),
          Long.parseLong(remaining.get().strip()),
          isTrue(overage.get())));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static boolean isTrue(String value) {
    String v = value.strip().toLowerCase(Locale.ROOT);
    return v.equals("1") || v.equals("true");
  }
}
