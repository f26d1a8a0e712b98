package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * A detector as stored by the model service. Instances are client side copies: {@code uuid},
 * {@code lastUpdateTimestamp} and {@code meta} are only populated on resources read back from the
 * service.
 *
 * <p>Read with {@link DetectorResourceReader}, which resolves {@code detectorConfig} to the class
 * registered for {@link #getType()}.
 */
@Builder(toBuilder = true)
@Jacksonized
@Getter
@ToString
@EqualsAndHashCode
public class DetectorResource {
  public static final String UUID = "uuid";
  public static final String TYPE = "type";
  public static final String DETECTOR_CONFIG = "detectorConfig";
  public static final String TRAINING_INTERVAL = "training_interval";
  public static final String LAST_UPDATE_TIMESTAMP = "lastUpdateTimestamp";
  public static final String CREATED_BY = "createdBy";
  public static final String META = "meta";

  private final String uuid;
  private final DetectorType type;
  private final DetectorConfig detectorConfig;
  private final Boolean enabled;
  private final Boolean trusted;
  private final String createdBy;
  private final String lastUpdateTimestamp;

  @JsonProperty(TRAINING_INTERVAL)
  private final String trainingInterval;

  private final DetectorMeta meta;

  public <T extends DetectorConfig> T getDetectorConfig(Class<T> configClass) {
    if (!configClass.isInstance(detectorConfig)) {
      throw new IllegalStateException(
          String.format(
              "Detector %s has %s config, not %s",
              uuid,
              detectorConfig == null ? "no" : detectorConfig.getClass().getSimpleName(),
              configClass.getSimpleName()));
    }
    return configClass.cast(detectorConfig);
  }
}
