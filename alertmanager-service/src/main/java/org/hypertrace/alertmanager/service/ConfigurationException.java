package org.hypertrace.alertmanager.service;

import org.hypertrace.alertmanager.transport.exception.AlertManagerException;

/** The AlertManager configuration cannot be used. Blocks startup and reload. */
public class ConfigurationException extends AlertManagerException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
