package com.expediagroup.adaptivealerting.detector.build.client;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.DetectorBuildException;

public class DetectorClientException extends DetectorBuildException {

  public DetectorClientException(String message) {
    super(message);
  }

  public DetectorClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
