package com.expediagroup.adaptivealerting.detector.build.datamodel;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** Audit block maintained by the model service. */
@Builder
@Jacksonized
@Getter
@ToString
@EqualsAndHashCode
public class DetectorMeta {
  private final String dateCreated;
  private final String dateUpdated;
}
