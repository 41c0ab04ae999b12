package ca.gc.cra.rinex.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("rinex.metric.key");

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }

  @Test
  void countersAndHistogramsReachReader() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader))) {
      assertFalse(adapter.isNoop());
      adapter.increment("decode.files");
      adapter.increment("decode.files");
      adapter.observe("decode.latencyNanos", 1_500);
      adapter.observe("decode.latencyNanos", 500);

      Collection<MetricData> metrics = reader.collectAllMetrics();

      MetricData files = find(metrics, "decode.files");
      LongPointData point = files.getLongSumData().getPoints().iterator().next();
      assertEquals(2, point.getValue());
      assertEquals("decode.files", point.getAttributes().get(METRIC_KEY));
      assertEquals("rinex-decoder",
          files.getResource().getAttribute(AttributeKey.stringKey("service.name")));
      assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, files.getInstrumentationScopeInfo().getName());

      HistogramPointData latency =
          find(metrics, "decode.latencynanos").getHistogramData().getPoints().iterator().next();
      assertEquals(2, latency.getCount());
      assertEquals(2_000.0, latency.getSum());
      assertEquals("decode.latencyNanos", latency.getAttributes().get(METRIC_KEY));
    }
  }

  @Test
  void noneExporterGivesNoopAdapter() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none")) {
      assertTrue(adapter.isNoop());
      adapter.increment("decode.files");
      adapter.observe("decode.epochs", 3);
      adapter.forceFlush();
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("prometheus")) {
      assertTrue(adapter.isNoop());
    }
  }

  @Test
  void sanitizeKeepsInstrumentNamesValid() {
    assertEquals("decode.files", OpenTelemetryMetricsAdapter.sanitize("decode.files"));
    assertEquals("decode.latencynanos", OpenTelemetryMetricsAdapter.sanitize(" decode.latencyNanos "));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitize("9 lives"));
    assertEquals("rinex.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
    assertEquals("rinex.metric", OpenTelemetryMetricsAdapter.sanitize(null));
  }
}
