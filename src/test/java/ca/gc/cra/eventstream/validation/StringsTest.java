package ca.gc.cra.eventstream.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void sanitizeKafkaTopicAllowsSafeCharacters() {
    assertEquals("event-stream.events.v1", Strings.sanitizeKafkaTopic("topic", "event-stream.events.v1"));
  }

  @Test
  void sanitizeKafkaTopicRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeKafkaTopic("topic", "event stream"));
  }

  @Test
  void requireStreamTopicAcceptsEventAndDataChannels() {
    assertEquals("/event/LoginEventStream", Strings.requireStreamTopic("topics", " /event/LoginEventStream "));
    assertEquals("/data/AccountChangeEvent", Strings.requireStreamTopic("topics", "/data/AccountChangeEvent"));
    assertEquals("/event/Order_Shipped__e", Strings.requireStreamTopic("topics", "/event/Order_Shipped__e"));
  }

  @Test
  void requireStreamTopicRejectsOtherShapes() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireStreamTopic("topics", "LoginEventStream"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireStreamTopic("topics", "/topic/Login"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireStreamTopic("topics", "/event/Login/Extra"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
