package ca.gc.cra.rinex.application.port.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.application.port.context.DecodeContext.Admission;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DecodeContextTest {
  private static final Instant BASE = Instant.parse("2018-01-01T00:00:00Z");

  @Test
  void timeLimitsSkipBeforeAndStopAfter() {
    DecodeOptions options = DecodeOptions.all().withTimeLimits(BASE.plusSeconds(30), BASE.plusSeconds(60));
    DecodeContext context = new DecodeContext("t", options, new RecordingMetricsPort());

    assertEquals(Admission.SKIP, context.admit(BASE));
    assertEquals(Admission.ADMIT, context.admit(BASE.plusSeconds(30)));
    assertEquals(Admission.ADMIT, context.admit(BASE.plusSeconds(60)));
    assertEquals(Admission.STOP, context.admit(BASE.plusSeconds(61)));
  }

  @Test
  void intervalDecimationAdvancesByWholeIntervals() {
    DecodeOptions options = DecodeOptions.all().withInterval(Duration.ofSeconds(30));
    DecodeContext context = new DecodeContext("t", options, new RecordingMetricsPort());

    List<Long> admitted = new ArrayList<>();
    for (long s = 0; s <= 90; s += 10) {
      if (context.admit(BASE.plusSeconds(s)) == Admission.ADMIT) {
        admitted.add(s);
      }
    }

    assertEquals(List.of(0L, 30L, 60L, 90L), admitted);
  }

  @Test
  void warningsAreRecordedAndCounted() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    DecodeContext context = new DecodeContext("t", DecodeOptions.all(), metrics);

    context.warn(WarningKind.SKIPPED_LINE, 12, "stray");
    assertTrue(context.warnOnce(WarningKind.UNKNOWN_CONSTELLATION, "X", 14, "unknown X"));
    assertFalse(context.warnOnce(WarningKind.UNKNOWN_CONSTELLATION, "X", 20, "unknown X"));
    assertTrue(context.warnOnce(WarningKind.UNKNOWN_CONSTELLATION, "Y", 21, "unknown Y"));

    assertEquals(3, context.warnings().size());
    assertEquals(12, context.warnings().get(0).lineNumber());
    assertEquals(3, metrics.count("decode.warnings"));
  }
}
