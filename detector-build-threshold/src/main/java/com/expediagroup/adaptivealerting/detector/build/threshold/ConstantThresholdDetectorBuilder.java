package com.expediagroup.adaptivealerting.detector.build.threshold;

import com.expediagroup.adaptivealerting.detector.build.datamodel.ConstantThresholdConfig;
import com.expediagroup.adaptivealerting.detector.build.datamodel.ConstantThresholdConfig.Hyperparams;
import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorResource;
import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorType;
import com.expediagroup.adaptivealerting.detector.build.datamodel.Strategy;
import com.expediagroup.adaptivealerting.detector.build.datamodel.ThresholdSet;
import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.UnknownStrategyException;
import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits constant threshold detectors to a sample of metric values.
 *
 * <p>Supported strategies:
 *
 * <ul>
 *   <li>{@link Strategy#SIGMA}: mean plus or minus a multiple of the sample standard deviation
 *   <li>{@link Strategy#QUARTILE}: Q3 plus, and Q1 minus, a multiple of the inter-quartile range
 * </ul>
 *
 * The weak bounds use {@code weakMultiplier} and the strong bounds {@code strongMultiplier}. A
 * strong multiplier below the weak one yields strong bounds inside the weak ones; callers own that
 * choice.
 */
public class ConstantThresholdDetectorBuilder {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(ConstantThresholdDetectorBuilder.class);

  private final ThresholdCalculator calculator;

  public ConstantThresholdDetectorBuilder() {
    this(new ThresholdCalculator());
  }

  public ConstantThresholdDetectorBuilder(ThresholdCalculator calculator) {
    this.calculator = calculator;
  }

  public ConstantThresholdConfig build(
      String strategyName, List<Double> sample, double weakMultiplier, double strongMultiplier) {
    return build(Strategy.fromName(strategyName), sample, weakMultiplier, strongMultiplier);
  }

  public ConstantThresholdConfig build(
      Strategy strategy, List<Double> sample, double weakMultiplier, double strongMultiplier) {
    if (strategy == null) {
      throw new UnknownStrategyException(null);
    }
    if (sample == null || sample.isEmpty()) {
      throw new InsufficientDataException("Cannot build a detector from an empty sample");
    }

    ThresholdSet thresholds;
    switch (strategy) {
      case SIGMA:
        thresholds = sigmaThresholds(sample, weakMultiplier, strongMultiplier);
        break;
      case QUARTILE:
        thresholds = quartileThresholds(sample, weakMultiplier, strongMultiplier);
        break;
      default:
        throw new UnknownStrategyException(strategy.getStrategyName());
    }

    ConstantThresholdConfig config =
        ConstantThresholdConfig.builder()
            .thresholds(thresholds)
            .hyperparams(
                Hyperparams.builder()
                    .strategy(strategy)
                    .weakMultiplier(weakMultiplier)
                    .strongMultiplier(strongMultiplier)
                    .build())
            .build();
    LOGGER.info("Detector created -- {}", config);
    return config;
  }

  /** Builds an enabled, not yet trusted detector resource ready to be created remotely. */
  public DetectorResource buildDetector(
      Strategy strategy, List<Double> sample, double weakMultiplier, double strongMultiplier) {
    return DetectorResource.builder()
        .type(DetectorType.CONSTANT_THRESHOLD)
        .detectorConfig(build(strategy, sample, weakMultiplier, strongMultiplier))
        .enabled(true)
        .trusted(false)
        .build();
  }

  private ThresholdSet sigmaThresholds(
      List<Double> sample, double weakMultiplier, double strongMultiplier) {
    double sigma = calculator.sampleStandardDeviation(sample);
    double mean = calculator.mean(sample);
    Pair<Double, Double> weak = calculator.sigmaThresholds(sigma, mean, weakMultiplier);
    Pair<Double, Double> strong = calculator.sigmaThresholds(sigma, mean, strongMultiplier);
    return toThresholdSet(weak, strong);
  }

  private ThresholdSet quartileThresholds(
      List<Double> sample, double weakMultiplier, double strongMultiplier) {
    Triple<Double, Double, Double> quartiles = calculator.quartiles(sample);
    double q1 = quartiles.getLeft();
    double q3 = quartiles.getRight();
    Pair<Double, Double> weak = calculator.quartileThresholds(q1, q3, weakMultiplier);
    Pair<Double, Double> strong = calculator.quartileThresholds(q1, q3, strongMultiplier);
    return toThresholdSet(weak, strong);
  }

  private static ThresholdSet toThresholdSet(
      Pair<Double, Double> weak, Pair<Double, Double> strong) {
    return ThresholdSet.builder()
        .upperWeak(weak.getLeft())
        .lowerWeak(weak.getRight())
        .upperStrong(strong.getLeft())
        .lowerStrong(strong.getRight())
        .build();
  }
}
