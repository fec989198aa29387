package relay.backpressure;

import org.junit.jupiter.api.Test;
import relay.ControlPlaneConfig;
import relay.model.DeliverySummary;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TuningAdvisorTest {
  private final TuningAdvisor advisor = new TuningAdvisor(new ControlPlaneConfig());

  private static DeliverySummary summary(String type, int retrying, int dueNow) {
    return new DeliverySummary(type, retrying + dueNow, dueNow, retrying, 0, 0, dueNow, null);
  }

  @Test
  void emptyInputReturnsDefault() {
    TuningSuggestion suggestion = advisor.suggest(List.of());

    assertEquals(new BackpressureSettings(true, 50, 100, 1), suggestion.recommendation());
    assertTrue(suggestion.byConnector().isEmpty());
  }

  @Test
  void tiersByPressure() {
    TuningSuggestion suggestion = advisor.suggest(List.of(
        summary("quiet", 0, 1),
        summary("busy", 20, 0),
        summary("flooded", 80, 10)));

    List<ConnectorTuning> rows = suggestion.byConnector();
    assertEquals("flooded", rows.get(0).connectorType());
    assertEquals(PressureTier.HIGH, rows.get(0).tier());
    assertEquals(PressureTier.MEDIUM, rows.get(1).tier());
    assertEquals(PressureTier.LOW, rows.get(2).tier());

    assertEquals(160, rows.get(0).suggested().maxRetrying());
    assertEquals(100, rows.get(0).suggested().maxDueNow());
    assertEquals(1, rows.get(0).suggested().minLimit());
    assertEquals(3, rows.get(2).suggested().minLimit());
  }

  @Test
  void recommendationTakesLargestCapsAndSmallestFloor() {
    TuningSuggestion suggestion = advisor.suggest(List.of(
        summary("a", 0, 300),
        summary("b", 70, 0),
        summary("c", 0, 0)));

    BackpressureSettings rec = suggestion.recommendation();
    assertEquals(140, rec.maxRetrying());
    assertEquals(600, rec.maxDueNow());
    assertEquals(1, rec.minLimit());
  }

  @Test
  void capsNeverExceedMaximum() {
    TuningSuggestion suggestion = advisor.suggest(List.of(summary("a", 9_000, 9_000)));

    assertEquals(BackpressureSettings.MAX_CAP, suggestion.recommendation().maxRetrying());
  }
}
