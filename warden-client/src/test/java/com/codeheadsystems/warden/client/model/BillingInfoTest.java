package com.codeheadsystems.warden.client.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * The type Billing info test.
 */
class BillingInfoTest {

  @Test
  void from_allHeaders_parses() {
    assertThat(BillingInfo.from(headers("5", "95", "TRUE"))).contains(new BillingInfo(5, 95, true));
    assertThat(BillingInfo.from(headers("5", "0", "1"))).contains(new BillingInfo(5, 0, true));
    assertThat(BillingInfo.from(headers("5", "95", "no"))).contains(new BillingInfo(5, 95, false));
  }

  @Test
  void from_missingHeader_isEmpty() {
    HttpHeaders partial = HttpHeaders.of(Map.of(
        BillingInfo.CREDITS_USED, List.of("5"),
        BillingInfo.CREDITS_REMAINING, List.of("95")), (n, v) -> true);

    assertThat(BillingInfo.from(partial)).isEmpty();
  }

  @Test
  void from_nonIntegralCount_isEmpty() {
    assertThat(BillingInfo.from(headers("5.5", "95", "false"))).isEmpty();
  }

  private static HttpHeaders headers(String used, String remaining, String overage) {
    return HttpHeaders.of(Map.of(
        BillingInfo.CREDITS_USED, List.of(used),
        BillingInfo.CREDITS_REMAINING, List.of(remaining),
        BillingInfo.CREDITS_OVERAGE, List.of(overage)), (n, v) -> true);
  }
}
