package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Links a metric, identified by an AND of tag matches, to a detector. Mappings live and die by
 * explicit save and delete calls; deleting a detector leaves its mappings in place.
 */
@Builder(toBuilder = true)
@Jacksonized
@Getter
@ToString
@EqualsAndHashCode
public class DetectorMapping {
  public static final String OPERATOR_AND = "AND";

  private final String id;
  private final DetectorRef detector;
  private final Expression expression;
  private final User user;
  private final Boolean enabled;
  private final Long createdTimeInMillis;
  private final Long lastModifiedTimeInMillis;

  public static DetectorMapping forMetric(String detectorUuid, Metric metric, String userId) {
    List<Operand> operands =
        metric.getTags().entrySet().stream()
            .map(
                tag ->
                    Operand.builder()
                        .field(Field.builder().key(tag.getKey()).value(tag.getValue()).build())
                        .build())
            .collect(Collectors.toList());
    return DetectorMapping.builder()
        .detector(DetectorRef.builder().uuid(detectorUuid).build())
        .expression(Expression.builder().operator(OPERATOR_AND).operands(operands).build())
        .user(User.builder().id(userId).build())
        .build();
  }

  @JsonIgnore
  public String getDetectorUuid() {
    return detector == null ? null : detector.getUuid();
  }

  /** Tags matched by this mapping's expression, in expression order. */
  @JsonIgnore
  public Map<String, String> getMetricTags() {
    Map<String, String> tags = new LinkedHashMap<>();
    if (expression == null || expression.getOperands() == null) {
      return tags;
    }
    for (Operand operand : expression.getOperands()) {
      if (operand.getField() != null) {
        tags.put(operand.getField().getKey(), operand.getField().getValue());
      }
    }
    return tags;
  }

  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class DetectorRef {
    private final String uuid;
  }

  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class Expression {
    private final String operator;
    private final List<Operand> operands;
  }

  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class Operand {
    private final Field field;
  }

  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class Field {
    private final String key;
    private final String value;
  }

  @Builder
  @Jacksonized
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class User {
    private final String id;
  }
}
