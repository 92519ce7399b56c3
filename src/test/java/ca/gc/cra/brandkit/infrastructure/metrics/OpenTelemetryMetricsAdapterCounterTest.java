package ca.gc.cra.brandkit.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("brand.update.success");
    adapter.increment("brand.update.success");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("brand.update.success"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "Expected counter metric to be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("brand.update.success",
        point.getAttributes().get(AttributeKey.stringKey("brandkit.metric.key")));
    assertEquals("brandkit", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void sanitizeNameNormalizesUnsupportedCharacters() {
    assertEquals("asset.upload.bytes", OpenTelemetryMetricsAdapter.sanitizeName("asset.upload.bytes"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("brand_protection_warned", OpenTelemetryMetricsAdapter.sanitizeName("Brand protection/warned"));
    assertEquals("brandkit.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
