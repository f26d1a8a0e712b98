package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.UnknownDetectorTypeException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Detector types known to this library, keyed by the model service's type tag. */
public enum DetectorType {
  CONSTANT_THRESHOLD("constant-detector", ConstantThresholdConfig.class);

  private final String tag;
  private final Class<? extends DetectorConfig> configClass;

  DetectorType(String tag, Class<? extends DetectorConfig> configClass) {
    this.tag = tag;
    this.configClass = configClass;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }

  public Class<? extends DetectorConfig> getConfigClass() {
    return configClass;
  }

  @JsonCreator
  public static DetectorType fromTag(String tag) {
    for (DetectorType type : values()) {
      if (type.tag.equals(tag)) {
        return type;
      }
    }
    throw new UnknownDetectorTypeException(tag);
  }
}
