package ca.gc.cra.eventstream.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("api.pubsub.salesforce.com:7443", Net.validateHostPort("api.pubsub.salesforce.com:7443"));
  }

  @Test
  void validateHostPortHandlesIpv4AndIpv6() {
    assertEquals("10.0.0.1:80", Net.validateHostPort("10.0.0.1:80"));
    assertEquals("[2001:db8::1]:8443", Net.validateHostPort("[2001:db8::1]:8443"));
  }

  @Test
  void validateHostPortRejectsMissingOrInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
  }

  @Test
  void validateHostPortListNormalizesEntries() {
    assertEquals("a:9092,b:9093", Net.validateHostPortList(" a:9092 , ,b:9093"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList(" , "));
  }

  @Test
  void validateHttpUrlRequiresHttpSchemeAndHost() {
    assertEquals("https://login.example.com/services/oauth2/token",
        Net.validateHttpUrl("token_url", "https://login.example.com/services/oauth2/token"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("token_url", "ftp://example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("token_url", "https:///path"));
  }
}
