package org.hypertrace.alertmanager.transport.exception;

public class PersistenceException extends AlertManagerException {

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
