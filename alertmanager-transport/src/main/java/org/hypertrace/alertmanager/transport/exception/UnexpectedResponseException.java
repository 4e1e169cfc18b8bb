package org.hypertrace.alertmanager.transport.exception;

import lombok.Getter;

/** AlertManager answered with something other than 200. The request is not staged for retry. */
@Getter
public class UnexpectedResponseException extends AlertManagerException {

  private final int statusCode;

  public UnexpectedResponseException(int statusCode) {
    super(String.format("unexpected response code %d from AlertManager service", statusCode));
    this.statusCode = statusCode;
  }
}
