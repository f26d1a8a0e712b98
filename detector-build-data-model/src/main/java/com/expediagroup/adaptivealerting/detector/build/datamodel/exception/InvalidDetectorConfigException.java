package com.expediagroup.adaptivealerting.detector.build.datamodel.exception;

public class InvalidDetectorConfigException extends DetectorBuildException {

  public InvalidDetectorConfigException(String message) {
    super(message);
  }

  public InvalidDetectorConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
