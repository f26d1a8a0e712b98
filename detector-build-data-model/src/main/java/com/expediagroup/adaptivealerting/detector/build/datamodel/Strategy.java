package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.UnknownStrategyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Constant threshold fitting strategies. */
public enum Strategy {
  SIGMA("sigma"),
  QUARTILE("quartile");

  private final String strategyName;

  Strategy(String strategyName) {
    this.strategyName = strategyName;
  }

  @JsonValue
  public String getStrategyName() {
    return strategyName;
  }

  @JsonCreator
  public static Strategy fromName(String name) {
    if (name != null) {
      for (Strategy strategy : values()) {
        if (strategy.strategyName.equalsIgnoreCase(name.trim())) {
          return strategy;
        }
      }
    }
    throw new UnknownStrategyException(name);
  }
}
