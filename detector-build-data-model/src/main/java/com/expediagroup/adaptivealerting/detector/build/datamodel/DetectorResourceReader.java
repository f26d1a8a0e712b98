package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.expediagroup.adaptivealerting.detector.build.datamodel.exception.InvalidDetectorConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads detectors returned by the model service. The {@code type} tag is resolved through {@link
 * DetectorType} first, and {@code detectorConfig} is then bound to that type's config class and
 * validated.
 */
public class DetectorResourceReader {

  private DetectorResourceReader() {}

  public static DetectorResource fromJson(String json) {
    JsonNode node;
    try {
      node = ObjectMapperProvider.get().readTree(json);
    } catch (JsonProcessingException e) {
      throw new InvalidDetectorConfigException("Unable to parse detector json", e);
    }
    return fromJsonNode(node);
  }

  public static DetectorResource fromJsonNode(JsonNode jsonNode) {
    if (jsonNode == null || !jsonNode.isObject()) {
      throw new InvalidDetectorConfigException(
          String.format("Expecting a detector object, received: %s", jsonNode));
    }
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    ObjectNode detectorNode = ((ObjectNode) jsonNode).deepCopy();
    DetectorType type = DetectorType.fromTag(detectorNode.path(DetectorResource.TYPE).asText(null));
    JsonNode configNode = detectorNode.remove(DetectorResource.DETECTOR_CONFIG);

    try {
      DetectorResource detector = objectMapper.treeToValue(detectorNode, DetectorResource.class);
      if (configNode == null || configNode.isNull()) {
        return detector;
      }
      DetectorConfig config = objectMapper.treeToValue(configNode, type.getConfigClass());
      config.validate();
      return detector.toBuilder().detectorConfig(config).build();
    } catch (JsonProcessingException e) {
      throw new InvalidDetectorConfigException(
          String.format("Unable to read %s detector %s", type.getTag(), detectorNode.get("uuid")),
          e);
    }
  }
}
