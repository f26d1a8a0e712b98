package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.InvalidDetectorConfigException;

/** Type specific configuration carried in a detector's {@code detectorConfig} block. */
public interface DetectorConfig {

  /**
   * Checks that the configuration can be sent to the model service.
   *
   * @throws InvalidDetectorConfigException if it cannot
   */
  void validate();
}
