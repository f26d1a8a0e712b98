package com.expediagroup.adaptivealerting.detector.build.client;

import java.time.Duration;

public class CreateTimeoutException extends DetectorClientException {
  private final String detectorUuid;

  public CreateTimeoutException(String detectorUuid, Duration timeout) {
    super(
        String.format(
            "Timeout waiting %s for detector uuid '%s' to be available from model service.",
            timeout, detectorUuid));
    this.detectorUuid = detectorUuid;
  }

  public String getDetectorUuid() {
    return detectorUuid;
  }
}
