package relay.util;

import org.junit.jupiter.api.Test;
import relay.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentsTest {

  @Test
  void projectIdIsTrimmedAndBounded() {
    assertEquals("acme", Arguments.projectId("  acme "));
    assertEquals("project_id", assertThrows(ValidationException.class, () -> Arguments.projectId(" ")).field());
    assertThrows(ValidationException.class, () -> Arguments.projectId(null));
    assertThrows(ValidationException.class,
        () -> Arguments.projectId("p".repeat(Arguments.MAX_PROJECT_ID_LENGTH + 1)));
  }

  @Test
  void connectorTypeResolvesAliases() {
    assertEquals("slack", Arguments.connectorType(" Slack_Webhook "));
    assertEquals("sqs", Arguments.connectorType("aws_sqs"));
    assertEquals("db", Arguments.connectorType("DATABASE"));
    assertEquals("custom-sink", Arguments.connectorType("custom-sink"));
  }

  @Test
  void malformedConnectorTypeIsValidationError() {
    ValidationException e = assertThrows(ValidationException.class, () -> Arguments.connectorType("no spaces"));
    assertEquals("connector_type", e.field());
    assertThrows(ValidationException.class, () -> Arguments.connectorType(null));
    assertThrows(ValidationException.class, () -> Arguments.connectorType("x".repeat(65)));
  }

  @Test
  void idempotencyKeyBlankMeansAbsent() {
    assertNull(Arguments.idempotencyKey(null));
    assertNull(Arguments.idempotencyKey("   "));
    assertEquals("k-1", Arguments.idempotencyKey(" k-1 "));
    assertThrows(ValidationException.class,
        () -> Arguments.idempotencyKey("k".repeat(Arguments.MAX_IDEMPOTENCY_KEY_LENGTH + 1)));
  }

  @Test
  void rangeIsInclusive() {
    assertEquals(1, Arguments.range("limit", 1, 1, 100));
    assertEquals(100, Arguments.range("limit", 100, 1, 100));
    ValidationException e = assertThrows(ValidationException.class, () -> Arguments.range("limit", 101, 1, 100));
    assertEquals("limit", e.field());
  }

  @Test
  void sha256IsLowerHex() {
    assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", Hashing.sha256Hex(""));
    assertEquals(64, Hashing.sha256Hex("{\"a\":1}").length());
  }
}
