package com.expediagroup.adaptivealerting.detector.build.threshold;

import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ThresholdCalculatorTest {

  private final ThresholdCalculator calculator = new ThresholdCalculator();

  @Test
  void testMean() {
    Assertions.assertEquals(5.0, calculator.mean(List.of(2d, 4d, 4d, 4d, 5d, 5d, 7d, 9d)));
    Assertions.assertEquals(3.5, calculator.mean(List.of(3.5)));
  }

  @Test
  void testSampleStandardDeviationUsesBesselCorrection() {
    Assertions.assertEquals(
        2.138, calculator.sampleStandardDeviation(List.of(2d, 4d, 4d, 4d, 5d, 5d, 7d, 9d)), 0.001);
  }

  @Test
  void testSampleStandardDeviationNeedsTwoValues() {
    Assertions.assertThrows(
        InsufficientDataException.class, () -> calculator.sampleStandardDeviation(List.of(1d)));
    Assertions.assertThrows(
        InsufficientDataException.class, () -> calculator.sampleStandardDeviation(List.of()));
  }

  @Test
  void testQuartilesUseMidpoint() {
    Triple<Double, Double, Double> quartiles = calculator.quartiles(List.of(4d, 2d, 3d, 1d));

    Assertions.assertEquals(1.5, quartiles.getLeft());
    Assertions.assertEquals(2.5, quartiles.getMiddle());
    Assertions.assertEquals(3.5, quartiles.getRight());
  }

  @Test
  void testQuartilesOnExactRanks() {
    // ranks 1, 2 and 3 fall on order statistics
    Triple<Double, Double, Double> quartiles = calculator.quartiles(List.of(1d, 2d, 3d, 4d, 5d));

    Assertions.assertEquals(2.0, quartiles.getLeft());
    Assertions.assertEquals(3.0, quartiles.getMiddle());
    Assertions.assertEquals(4.0, quartiles.getRight());
  }

  @Test
  void testQuartilesOfSingleValueAreDegenerate() {
    Triple<Double, Double, Double> quartiles = calculator.quartiles(List.of(7d));

    Assertions.assertEquals(7.0, quartiles.getLeft());
    Assertions.assertEquals(7.0, quartiles.getMiddle());
    Assertions.assertEquals(7.0, quartiles.getRight());
  }

  @Test
  void testSigmaThresholdsAreSymmetric() {
    List<Double> sample = List.of(10d, 12d, 9d, 11d, 10d);
    double mean = calculator.mean(sample);
    double sigma = calculator.sampleStandardDeviation(sample);

    for (double multiplier : new double[] {0.5, 1, 2, 3.7}) {
      Pair<Double, Double> bounds = calculator.sigmaThresholds(sigma, mean, multiplier);
      Assertions.assertTrue(bounds.getLeft() > mean);
      Assertions.assertTrue(bounds.getRight() < mean);
      Assertions.assertEquals(bounds.getLeft() - mean, mean - bounds.getRight(), 1e-9);
    }
  }

  @Test
  void testQuartileThresholdsContainQuartiles() {
    for (double multiplier : new double[] {0, 0.5, 1.5}) {
      Pair<Double, Double> bounds = calculator.quartileThresholds(1.5, 3.5, multiplier);
      Assertions.assertTrue(bounds.getLeft() >= 3.5);
      Assertions.assertTrue(bounds.getRight() <= 1.5);
    }
    Pair<Double, Double> bounds = calculator.quartileThresholds(1.5, 3.5, 1.5);
    Assertions.assertEquals(6.5, bounds.getLeft());
    Assertions.assertEquals(-1.5, bounds.getRight());
  }
}
