package com.expediagroup.adaptivealerting.detector.build.datamodel.exception;

public class UnknownDetectorTypeException extends DetectorBuildException {

  public UnknownDetectorTypeException(String type) {
    super(String.format("No detector type registered for tag: %s", type));
  }
}
