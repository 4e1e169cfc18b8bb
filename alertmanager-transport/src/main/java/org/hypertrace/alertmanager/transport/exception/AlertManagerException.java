package org.hypertrace.alertmanager.transport.exception;

/** Base type of every failure raised while delivering an alert to AlertManager. */
public class AlertManagerException extends Exception {

  public AlertManagerException(String message) {
    super(message);
  }

  public AlertManagerException(String message, Throwable cause) {
    super(message, cause);
  }
}
