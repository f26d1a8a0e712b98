package com.expediagroup.adaptivealerting.detector.build.client;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.DetectorBuildException;

public class ConfigurationException extends DetectorBuildException {

  public ConfigurationException(String message) {
    super(message);
  }
}
