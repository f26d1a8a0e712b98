package com.expediagroup.adaptivealerting.detector.build.client;

import com.expediagroup.adaptivealerting.detector.build.datamodel.ConstantThresholdConfig;
import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorResource;
import com.expediagroup.adaptivealerting.detector.build.datamodel.Metric;
import com.expediagroup.adaptivealerting.detector.build.datamodel.Strategy;
import com.expediagroup.adaptivealerting.detector.build.threshold.ConstantThresholdDetectorBuilder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the constant threshold detectors of a metric in line with a fresh sample: creates and maps
 * a detector when the metric has none, and refits the thresholds of every mapped detector
 * otherwise.
 */
public class MetricDetectorSynchronizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricDetectorSynchronizer.class);

  private final DetectorClient detectorClient;
  private final ConstantThresholdDetectorBuilder detectorBuilder;

  public MetricDetectorSynchronizer(
      DetectorClient detectorClient, ConstantThresholdDetectorBuilder detectorBuilder) {
    this.detectorClient = detectorClient;
    this.detectorBuilder = detectorBuilder;
  }

  public List<DetectorResource> sync(
      Metric metric,
      List<Double> sample,
      Strategy strategy,
      double weakMultiplier,
      double strongMultiplier) {
    List<DetectorResource> existing = detectorClient.listDetectorsForMetric(metric.getTags());
    if (existing.isEmpty()) {
      LOGGER.info("No detector mapped to metric {}, creating one", metric.getTags());
      DetectorResource detector =
          detectorBuilder.buildDetector(strategy, sample, weakMultiplier, strongMultiplier);
      return List.of(detectorClient.createMetricDetector(detector, metric));
    }

    ConstantThresholdConfig config =
        detectorBuilder.build(strategy, sample, weakMultiplier, strongMultiplier);
    List<DetectorResource> updated = new ArrayList<>();
    for (DetectorResource detector : existing) {
      LOGGER.info("Updating thresholds of detector {} for metric {}", detector.getUuid(), metric);
      updated.add(
          detectorClient.updateDetector(detector.toBuilder().detectorConfig(config).build()));
    }
    return updated;
  }
}
