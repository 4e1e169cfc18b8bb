package org.hypertrace.alertmanager.service;

import org.hypertrace.alertmanager.transport.exception.AlertManagerException;

public class ServiceDisabledException extends AlertManagerException {

  public ServiceDisabledException() {
    super("service is not enabled");
  }
}
