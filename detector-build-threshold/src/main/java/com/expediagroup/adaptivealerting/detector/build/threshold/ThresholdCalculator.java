package com.expediagroup.adaptivealerting.detector.build.threshold;

import com.google.common.base.Preconditions;
import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;

/** Sample statistics and the bounds derived from them. Bounds are returned as (upper, lower). */
public class ThresholdCalculator {

  private static final int MIN_SIGMA_SAMPLE_SIZE = 2;

  public double mean(List<Double> sample) {
    Preconditions.checkArgument(!sample.isEmpty(), "Cannot take the mean of an empty sample");
    return sample.stream().mapToDouble(Double::doubleValue).average().getAsDouble();
  }

  /** Standard deviation with Bessel's correction (n - 1 denominator). */
  public double sampleStandardDeviation(List<Double> sample) {
    if (sample.size() < MIN_SIGMA_SAMPLE_SIZE) {
      throw new InsufficientDataException(
          String.format(
              "Sample must have at least %d elements, received %d",
              MIN_SIGMA_SAMPLE_SIZE, sample.size()));
    }
    double mean = mean(sample);
    double sumOfSquares = 0;
    for (Double value : sample) {
      double deviation = value - mean;
      sumOfSquares += deviation * deviation;
    }
    return Math.sqrt(sumOfSquares / (sample.size() - 1));
  }

  /**
   * Returns the 25th, 50th and 75th percentiles as (Q1, median, Q3). A rank falling between two
   * order statistics takes their midpoint, never a linear interpolation.
   */
  public Triple<Double, Double, Double> quartiles(List<Double> sample) {
    if (sample.isEmpty()) {
      throw new InsufficientDataException("Cannot compute quartiles of an empty sample");
    }
    double[] sorted = sample.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    return Triple.of(
        midpointPercentile(sorted, 25),
        midpointPercentile(sorted, 50),
        midpointPercentile(sorted, 75));
  }

  public Pair<Double, Double> sigmaThresholds(double sigma, double mean, double multiplier) {
    return Pair.of(mean + sigma * multiplier, mean - sigma * multiplier);
  }

  public Pair<Double, Double> quartileThresholds(double q1, double q3, double multiplier) {
    double iqr = q3 - q1;
    return Pair.of(q3 + iqr * multiplier, q1 - iqr * multiplier);
  }

  private static double midpointPercentile(double[] sorted, int percentile) {
    double rank = (sorted.length - 1) * percentile / 100.0;
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    return (sorted[lower] + sorted[upper]) / 2;
  }
}
