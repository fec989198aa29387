package relay.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyAndNullMapsEncodeAsEmptyObject() {
    assertEquals("{}", codec.toJson(Map.of()));
    assertEquals("{}", codec.toJson(null));
  }

  @Test
  void keepsInsertionOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("policy_version", "3");
    map.put("applied.max_due_now", "10");

    assertEquals("{\"policy_version\":\"3\",\"applied.max_due_now\":\"10\"}", codec.toJson(map));
  }

  @Test
  void escapesSpecialCharacters() {
    String json = codec.toJson(Map.of("error", "HTTP \"503\"\nbusy\\retry\u0001"));

    assertEquals("{\"error\":\"HTTP \\\"503\\\"\\nbusy\\\\retry\\u0001\"}", json);
  }

  @Test
  void nullValueIsWrittenAndDroppedOnRead() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("status_code", null);
    map.put("error", "timeout");

    String json = codec.toJson(map);

    assertEquals("{\"status_code\":null,\"error\":\"timeout\"}", json);
    assertEquals(Map.of("error", "timeout"), codec.parseObject(json));
  }

  @Test
  void nullKeyIsRejected() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(null, "value");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
    assertTrue(ex.getMessage().contains("null keys"));
  }

  @Test
  void parsesEscapesAndWhitespace() {
    Map<String, String> parsed = codec.parseObject(" { \"text\" : \"a\\\"b\\u0041\\/c\" , \"n\":\"1\" } ");

    assertEquals("a\"bA/c", parsed.get("text"));
    assertEquals("1", parsed.get("n"));
  }

  @Test
  void blankAndNullLiteralParseAsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void rejectsNonStringValuesAndTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"count\":3}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\"} x"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[\"a\"]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"unterminated"));
  }
}
