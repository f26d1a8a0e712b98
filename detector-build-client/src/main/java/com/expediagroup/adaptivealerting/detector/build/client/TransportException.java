package com.expediagroup.adaptivealerting.detector.build.client;

/** A model service call that failed on the wire or answered with a non 2xx status. */
public class TransportException extends DetectorClientException {
  public static final int NO_STATUS = -1;

  private final int statusCode;

  public TransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
  }

  protected TransportException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status of the response, {@link #NO_STATUS} when none was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
