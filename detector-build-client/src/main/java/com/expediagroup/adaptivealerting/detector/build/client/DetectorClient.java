package com.expediagroup.adaptivealerting.detector.build.client;

import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorMapping;
import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorResource;
import com.expediagroup.adaptivealerting.detector.build.datamodel.DetectorResourceReader;
import com.expediagroup.adaptivealerting.detector.build.datamodel.Metric;
import com.expediagroup.adaptivealerting.detector.build.datamodel.ObjectMapperProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the detector and detector mapping endpoints of the model service.
 *
 * <p>Every call blocks until the service answers or the request timeout expires. Failures of
 * mutating calls always propagate. The model service creates detectors asynchronously, so {@link
 * #createDetector(DetectorResource)} polls until the new detector can be read back.
 *
 * <p>The client keeps no state besides its configuration and can be shared between threads. It
 * does not lock or deduplicate: concurrent writers for the same metric are arbitrated by the
 * service.
 */
public class DetectorClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorClient.class);
  private static final String CREATE_CONFIRM_TIMER =
      "adaptive.alerting.detector.create.confirm.latency";

  static final String DETECTORS_PATH = "api/v2/detectors";
  static final String FIND_BY_UUID_PATH = "api/v2/detectors/findByUuid";
  static final String TOGGLE_DETECTOR_PATH = "api/v2/detectors/toggleDetector";
  static final String MAPPINGS_PATH = "api/detectorMappings";
  static final String FIND_MATCHING_BY_TAGS_PATH = "api/detectorMappings/findMatchingByTags";
  static final String SEARCH_MAPPINGS_PATH = "api/detectorMappings/search";
  static final String DISABLE_MAPPING_PATH = "api/detectorMappings/disable";

  private static final String UUID_PARAM = "uuid";
  private static final String ID_PARAM = "id";
  private static final String ENABLED_PARAM = "enabled";
  private static final String DETECTOR_UUID = "detectorUuid";
  private static final String GROUPED_DETECTORS_BY_SEARCH_INDEX = "groupedDetectorsBySearchIndex";
  private static final String FIRST_SEARCH_INDEX = "0";
  private static final List<String> SERVER_MANAGED_FIELDS =
      List.of(
          DetectorResource.TRAINING_INTERVAL,
          DetectorResource.LAST_UPDATE_TIMESTAMP,
          DetectorResource.CREATED_BY,
          DetectorResource.META);

  private final ModelServiceHttpClient httpClient;
  private final String user;
  private final Duration createTimeout;
  private final Duration createPollInterval;
  private final Ticker ticker;
  private final Sleeper sleeper;
  private final Timer createConfirmTimer;

  public DetectorClient(DetectorClientConfig config) {
    this(
        config,
        new ModelServiceHttpClient(config.getUrl(), config.getRequestTimeout()),
        Ticker.systemTicker(),
        Sleeper.SYSTEM);
  }

  @VisibleForTesting
  DetectorClient(
      DetectorClientConfig config,
      ModelServiceHttpClient httpClient,
      Ticker ticker,
      Sleeper sleeper) {
    this.httpClient = httpClient;
    this.user = config.getUser();
    this.createTimeout = config.getCreateTimeout();
    this.createPollInterval = config.getCreatePollInterval();
    this.ticker = ticker;
    this.sleeper = sleeper;
    this.createConfirmTimer = Timer.builder(CREATE_CONFIRM_TIMER).register(Metrics.globalRegistry);
  }

  /** @throws DetectorNotFoundException if the service answers with a non 2xx status */
  public DetectorResource getDetector(String detectorUuid) {
    String response;
    try {
      response = httpClient.get(FIND_BY_UUID_PATH, Map.of(UUID_PARAM, detectorUuid));
    } catch (TransportException e) {
      if (e.getStatusCode() == TransportException.NO_STATUS) {
        throw e;
      }
      throw new DetectorNotFoundException(detectorUuid, e);
    }
    return DetectorResourceReader.fromJson(response);
  }

  /**
   * Returns the detectors mapped to a metric. A mapped detector that cannot be fetched is logged
   * and left out, so the result may be partial when mappings and detectors have drifted apart.
   */
  public List<DetectorResource> listDetectorsForMetric(Map<String, String> metricTags) {
    String response =
        httpClient.post(FIND_MATCHING_BY_TAGS_PATH, Map.of(), toJson(List.of(metricTags)));
    JsonNode detectorItems =
        readTree(response).path(GROUPED_DETECTORS_BY_SEARCH_INDEX).path(FIRST_SEARCH_INDEX);

    List<DetectorResource> detectors = new ArrayList<>();
    for (JsonNode detectorItem : detectorItems) {
      if (!detectorItem.hasNonNull(UUID_PARAM)) {
        LOGGER.warn("Skipping matched detector without uuid: {}", detectorItem);
        continue;
      }
      String detectorUuid = detectorItem.get(UUID_PARAM).asText();
      try {
        detectors.add(getDetector(detectorUuid));
      } catch (TransportException e) {
        LOGGER.warn(
            "Metric mapped to detector UUID '{}', but the detector does not exist.",
            detectorUuid,
            e);
      }
    }
    return detectors;
  }

  public List<DetectorMapping> listDetectorMappings(String detectorUuid) {
    String response =
        httpClient.post(
            SEARCH_MAPPINGS_PATH, Map.of(), toJson(Map.of(DETECTOR_UUID, detectorUuid)));
    try {
      return ObjectMapperProvider.get()
          .readValue(response, new TypeReference<List<DetectorMapping>>() {});
    } catch (JsonProcessingException e) {
      throw new DetectorClientException(
          String.format("Unable to read mappings of detector %s", detectorUuid), e);
    }
  }

  public void saveMetricDetectorMapping(String detectorUuid, Metric metric) {
    DetectorMapping mapping = DetectorMapping.forMetric(detectorUuid, metric, user);
    httpClient.post(MAPPINGS_PATH, Map.of(), toJson(ObjectMapperProvider.getNonEmpty(), mapping));
  }

  public void deleteMetricDetectorMapping(String detectorMappingId) {
    httpClient.delete(MAPPINGS_PATH, Map.of(ID_PARAM, detectorMappingId));
  }

  public void disableMetricDetectorMapping(String detectorMappingId) {
    httpClient.put(DISABLE_MAPPING_PATH, Map.of(ID_PARAM, detectorMappingId), "");
  }

  /**
   * Creates the detector as this client's user, then polls once per poll interval until the
   * service can return it.
   *
   * <p>A lookup answered with an error status counts as "not visible yet"; a lookup that fails on
   * the wire propagates. So does a 2xx lookup whose body is not a readable detector ({@code
   * InvalidDetectorConfigException}): the detector is visible, only malformed.
   *
   * @throws CreateTimeoutException if the detector is still not visible after the create timeout
   */
  public DetectorResource createDetector(DetectorResource detector) {
    DetectorResource request = detector.toBuilder().createdBy(user).build();
    String detectorUuid =
        httpClient
            .post(DETECTORS_PATH, Map.of(), toJson(ObjectMapperProvider.getNonEmpty(), request))
            .trim();
    if (Strings.isNullOrEmpty(detectorUuid)) {
      throw new DetectorClientException("Model service returned no uuid for the new detector");
    }
    LOGGER.info("Created detector {}, waiting for it to become available", detectorUuid);

    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    while (stopwatch.elapsed().compareTo(createTimeout) < 0) {
      sleep(createPollInterval);
      try {
        DetectorResource created = getDetector(detectorUuid);
        createConfirmTimer.record(stopwatch.elapsed());
        return created;
      } catch (DetectorNotFoundException e) {
        LOGGER.debug("Detector {} not available yet after {}", detectorUuid, stopwatch.elapsed());
      }
    }
    throw new CreateTimeoutException(detectorUuid, createTimeout);
  }

  /**
   * Replaces the detector stored under its uuid and returns the service's copy. Training interval,
   * last update timestamp, creator and meta are never sent.
   */
  public DetectorResource updateDetector(DetectorResource detector) {
    Preconditions.checkArgument(
        detector.getUuid() != null, "Cannot update a detector without uuid");
    ObjectNode request = ObjectMapperProvider.get().valueToTree(detector);
    request.remove(SERVER_MANAGED_FIELDS);
    httpClient.put(DETECTORS_PATH, Map.of(UUID_PARAM, detector.getUuid()), toJson(request));
    return getDetector(detector.getUuid());
  }

  public void enableDetector(String detectorUuid) {
    httpClient.get(TOGGLE_DETECTOR_PATH, Map.of(ENABLED_PARAM, "true", UUID_PARAM, detectorUuid));
  }

  public void disableDetector(String detectorUuid) {
    httpClient.post(
        TOGGLE_DETECTOR_PATH, Map.of(ENABLED_PARAM, "false", UUID_PARAM, detectorUuid), "{}");
  }

  /** Deletes the detector only; its mappings have to be deleted separately. */
  public void deleteDetector(String detectorUuid) {
    httpClient.delete(DETECTORS_PATH, Map.of(UUID_PARAM, detectorUuid));
  }

  /**
   * Creates the detector and maps the metric to it. If saving the mapping fails the detector is
   * left in place without a mapping.
   */
  public DetectorResource createMetricDetector(DetectorResource detector, Metric metric) {
    DetectorResource created = createDetector(detector);
    saveMetricDetectorMapping(created.getUuid(), metric);
    return created;
  }

  private void sleep(Duration duration) {
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DetectorClientException("Interrupted while waiting for detector creation", e);
    }
  }

  private static String toJson(Object value) {
    return toJson(ObjectMapperProvider.get(), value);
  }

  private static String toJson(ObjectMapper objectMapper, Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DetectorClientException(
          String.format("Unable to serialize %s", value.getClass().getSimpleName()), e);
    }
  }

  private static JsonNode readTree(String json) {
    try {
      return ObjectMapperProvider.get().readTree(json);
    } catch (JsonProcessingException e) {
      throw new DetectorClientException("Unable to parse model service response", e);
    }
  }
}
