package com.expediagroup.adaptivealerting.detector.build.client;

public class DetectorNotFoundException extends TransportException {
  private final String detectorUuid;

  public DetectorNotFoundException(String detectorUuid, TransportException cause) {
    super(
        String.format("Detector %s not found, status %d", detectorUuid, cause.getStatusCode()),
        cause.getStatusCode(),
        cause);
    this.detectorUuid = detectorUuid;
  }

  public String getDetectorUuid() {
    return detectorUuid;
  }
}
