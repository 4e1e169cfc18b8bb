package org.hypertrace.alertmanager.service.model;

/** Severity of an alert state, rendered on the wire by its name. */
public enum Level {
  OK,
  INFO,
  WARNING,
  CRITICAL
}
