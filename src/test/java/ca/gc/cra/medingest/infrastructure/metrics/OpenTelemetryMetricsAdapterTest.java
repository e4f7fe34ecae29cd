package ca.gc.cra.medingest.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("ingest.extract.pdf");
    adapter.increment("ingest.extract.pdf");
    adapter.flush();

    MetricData counter = metric(reader.collectAllMetrics(), "ingest.extract.pdf");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("ingest.extract.pdf", point.getAttributes().get(AttributeKey.stringKey("medingest.metric.key")));
    assertEquals("medingest", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertTrue(adapter.isExporting());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("ingest.extract.latencyMillis", 40);
    adapter.observe("ingest.extract.latencyMillis", 60);

    MetricData histogram = metric(reader.collectAllMetrics(), "ingest.extract.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2, point.getCount());
    assertEquals(100.0, point.getSum());
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("ingest.files.success", OpenTelemetryMetricsAdapter.instrumentName(" Ingest.Files.Success "));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.instrumentName("9 lives"));
    assertEquals("medingest.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  @Test
  void noopTelemetryIsNotExporting() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Telemetry.noop())) {
      noop.increment("ingest.files.failed");
      assertFalse(noop.isExporting());
    }
  }

  @Test
  void resourceAttributesAreParsedLeniently() {
    Attributes attributes = OpenTelemetryBootstrap.parseAttributes("env=dev, team = ops ,broken,=x");

    assertEquals(2, attributes.size());
    assertEquals("ops", attributes.get(AttributeKey.stringKey("team")));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("missing metric " + name));
  }
}
