package ca.gc.cra.medingest.infrastructure.metrics;

import ca.gc.cra.medingest.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link MetricsPort} forwarding ingestion counters and latency observations to OpenTelemetry.
 * <p>Instruments are created lazily, one per key. Keys such as {@code ingest.extract.pdf} are used as instrument
 * names after sanitizing and are also attached as the {@code medingest.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("medingest.metric.key");

  private final OpenTelemetryBootstrap.Telemetry telemetry;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and the environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Telemetry telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.meter = telemetry.meter();
  }

  /**
   * Indicates whether metrics are actually exported.
   *
   * @return {@code false} when running without an exporter
   */
  public boolean isExporting() {
    return !telemetry.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, k -> meter.counterBuilder(instrumentName(k))
            .setUnit("1")
            .setDescription("Ingestion counter " + k)
            .build())
        .add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, k -> meter.histogramBuilder(instrumentName(k))
            .ofLongs()
            .setDescription("Ingestion observation " + k)
            .build())
        .record(value, Attributes.of(METRIC_KEY, key));
  }

  /** Exports pending measurements. */
  public void flush() {
    telemetry.flush();
  }

  @Override
  public void close() {
    telemetry.close();
  }

  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "medingest.metric";
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }
}
