package com.expediagroup.adaptivealerting.detector.build.datamodel;

import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** Identity of a metric, as far as detector mappings are concerned. */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class Metric {
  @Singular private final Map<String, String> tags;
  private final String description;
}
