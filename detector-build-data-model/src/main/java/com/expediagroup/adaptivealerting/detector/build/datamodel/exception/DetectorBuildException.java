package com.expediagroup.adaptivealerting.detector.build.datamodel.exception;

/** Root of every error raised while building detectors or talking to the model service. */
public class DetectorBuildException extends RuntimeException {

  public DetectorBuildException(String message) {
    super(message);
  }

  public DetectorBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
