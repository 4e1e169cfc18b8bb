package org.hypertrace.alertmanager.transport.exception;

import java.io.IOException;

/**
 * No response was received from the AlertManager endpoint. The payload has been handed to the
 * retry folder before this is thrown, successfully or not.
 */
public class TransportException extends AlertManagerException {

  public TransportException(String url, IOException cause) {
    super(String.format("failed to post alert to %s: %s", url, cause.getMessage()), cause);
  }
}
