package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.InvalidDetectorConfigException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Jacksonized
@Getter
@ToString
@EqualsAndHashCode
public class ConstantThresholdConfig implements DetectorConfig {
  public static final String TWO_TAILED = "TWO_TAILED";

  @JsonProperty("type")
  @Builder.Default
  private final String thresholdType = TWO_TAILED;

  private final ThresholdSet thresholds;
  private final Hyperparams hyperparams;

  @Override
  public void validate() {
    if (thresholds == null) {
      throw new InvalidDetectorConfigException("Constant threshold config is missing thresholds");
    }
    if (!Double.isFinite(thresholds.getUpperStrong())
        || !Double.isFinite(thresholds.getUpperWeak())
        || !Double.isFinite(thresholds.getLowerWeak())
        || !Double.isFinite(thresholds.getLowerStrong())) {
      throw new InvalidDetectorConfigException(
          String.format("Constant threshold config has non finite thresholds: %s", thresholds));
    }
  }

  /** Inputs the thresholds were fitted with. */
  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class Hyperparams {
    private final Strategy strategy;
    private final Double weakMultiplier;
    private final Double strongMultiplier;
  }
}
