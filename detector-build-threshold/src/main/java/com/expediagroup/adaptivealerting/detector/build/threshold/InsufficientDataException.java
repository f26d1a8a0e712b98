package com.expediagroup.adaptivealerting.detector.build.threshold;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.DetectorBuildException;

public class InsufficientDataException extends DetectorBuildException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
