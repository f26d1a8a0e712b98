package com.expediagroup.adaptivealerting.detector.build.datamodel.exception;

public class UnknownStrategyException extends DetectorBuildException {

  public UnknownStrategyException(String strategy) {
    super(String.format("Unknown build strategy: %s", strategy));
  }
}
