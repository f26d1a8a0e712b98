package com.expediagroup.adaptivealerting.detector.build.datamodel;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Weak and strong bounds of a constant threshold detector.
 *
 * <p>The usual ordering {@code upperStrong >= upperWeak >= lowerWeak >= lowerStrong} only holds
 * when the strong multiplier is at least the weak one. Keeping the multipliers in that order is
 * up to the caller; nothing here enforces it.
 */
@Builder(toBuilder = true)
@Jacksonized
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdSet {
  private final double upperStrong;
  private final double upperWeak;
  private final double lowerWeak;
  private final double lowerStrong;
}
