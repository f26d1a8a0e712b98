package com.expediagroup.adaptivealerting.detector.build.client;

import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;

/** Model service settings, fixed when the client is created. */
public class DetectorClientConfig {
  static final String MODEL_SERVICE_CONFIG = "model.service";
  private static final String URL = "url";
  private static final String USER = "user";
  private static final String REQUEST_TIMEOUT = "request.timeout";
  private static final String CREATE_TIMEOUT = "create.timeout";
  private static final String CREATE_POLL_INTERVAL = "create.poll.interval";

  private final String url;
  private final String user;
  private final Duration requestTimeout;
  private final Duration createTimeout;
  private final Duration createPollInterval;

  public static DetectorClientConfig from(Config config) {
    return resolve(null, null, config);
  }

  /**
   * Uses {@code url} and {@code user} when given, and the {@code model.service} block of {@code
   * config} otherwise.
   *
   * @throws ConfigurationException if either value ends up missing or empty
   */
  public static DetectorClientConfig resolve(String url, String user, Config config) {
    Config serviceConfig =
        config.hasPath(MODEL_SERVICE_CONFIG)
            ? config.getConfig(MODEL_SERVICE_CONFIG)
            : ConfigFactory.empty();
    String resolvedUrl = firstNonEmpty(url, serviceConfig, URL);
    if (resolvedUrl == null) {
      throw new ConfigurationException("model service url not found.");
    }
    String resolvedUser = firstNonEmpty(user, serviceConfig, USER);
    if (resolvedUser == null) {
      throw new ConfigurationException("model service user not found.");
    }

    Config withDefaults =
        serviceConfig.withFallback(
            ConfigFactory.defaultReference().getConfig(MODEL_SERVICE_CONFIG));
    return new DetectorClientConfig(
        resolvedUrl,
        resolvedUser,
        withDefaults.getDuration(REQUEST_TIMEOUT),
        withDefaults.getDuration(CREATE_TIMEOUT),
        withDefaults.getDuration(CREATE_POLL_INTERVAL));
  }

  private static String firstNonEmpty(String explicit, Config serviceConfig, String key) {
    if (!Strings.isNullOrEmpty(explicit)) {
      return explicit;
    }
    if (serviceConfig.hasPath(key) && !serviceConfig.getString(key).isEmpty()) {
      return serviceConfig.getString(key);
    }
    return null;
  }

  private DetectorClientConfig(
      String url,
      String user,
      Duration requestTimeout,
      Duration createTimeout,
      Duration createPollInterval) {
    this.url = url;
    this.user = user;
    this.requestTimeout = requestTimeout;
    this.createTimeout = createTimeout;
    this.createPollInterval = createPollInterval;
  }

  public String getUrl() {
    return url;
  }

  public String getUser() {
    return user;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public Duration getCreateTimeout() {
    return createTimeout;
  }

  public Duration getCreatePollInterval() {
    return createPollInterval;
  }
}
