package com.expediagroup.adaptivealerting.detector.build.client;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DetectorClientConfigTest {

  @Test
  void testExplicitValuesWin() {
    Config config =
        ConfigFactory.parseMap(
            Map.of(
                "model.service.url", "http://configured",
                "model.service.user", "configured-user"));

    DetectorClientConfig clientConfig =
        DetectorClientConfig.resolve("http://explicit", "explicit-user", config);

    Assertions.assertEquals("http://explicit", clientConfig.getUrl());
    Assertions.assertEquals("explicit-user", clientConfig.getUser());
  }

  @Test
  void testFallsBackToConfig() {
    Config config =
        ConfigFactory.parseMap(
            Map.of(
                "model.service.url", "http://configured",
                "model.service.user", "configured-user",
                "model.service.request.timeout", "10s"));

    DetectorClientConfig clientConfig = DetectorClientConfig.resolve("", null, config);

    Assertions.assertEquals("http://configured", clientConfig.getUrl());
    Assertions.assertEquals("configured-user", clientConfig.getUser());
    Assertions.assertEquals(Duration.ofSeconds(10), clientConfig.getRequestTimeout());
  }

  @Test
  void testDefaultTimeouts() {
    DetectorClientConfig clientConfig =
        DetectorClientConfig.resolve("http://explicit", "explicit-user", ConfigFactory.empty());

    Assertions.assertEquals(Duration.ofSeconds(30), clientConfig.getRequestTimeout());
    Assertions.assertEquals(Duration.ofSeconds(60), clientConfig.getCreateTimeout());
    Assertions.assertEquals(Duration.ofSeconds(1), clientConfig.getCreatePollInterval());
  }

  @Test
  void testMissingUrl() {
    Config config = ConfigFactory.parseMap(Map.of("model.service.user", "configured-user"));

    ConfigurationException exception =
        Assertions.assertThrows(
            ConfigurationException.class, () -> DetectorClientConfig.from(config));
    Assertions.assertTrue(exception.getMessage().contains("url"));
  }

  @Test
  void testMissingUser() {
    Config config =
        ConfigFactory.parseMap(
            Map.of("model.service.url", "http://configured", "model.service.user", ""));

    ConfigurationException exception =
        Assertions.assertThrows(
            ConfigurationException.class, () -> DetectorClientConfig.from(config));
    Assertions.assertTrue(exception.getMessage().contains("user"));
  }
}
