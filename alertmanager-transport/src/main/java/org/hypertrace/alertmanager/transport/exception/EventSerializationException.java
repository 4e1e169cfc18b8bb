package org.hypertrace.alertmanager.transport.exception;

/** The alert could not be rendered into the AlertManager JSON payload. Never retried. */
public class EventSerializationException extends AlertManagerException {

  public EventSerializationException(String message) {
    super(message);
  }

  public EventSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
