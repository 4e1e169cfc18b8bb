package org.hypertrace.alertmanager.service.handler;

import org.hypertrace.alertmanager.service.model.AlertEvent;

/** Output target the alert routing framework hands events to. */
public interface AlertHandler {
  void handle(AlertEvent event);
}
