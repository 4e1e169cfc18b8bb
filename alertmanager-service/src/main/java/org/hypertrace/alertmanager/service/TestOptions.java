package org.hypertrace.alertmanager.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Input of the self-test. {@code message} is accepted for compatibility with other notifiers but
 * the test always sends an empty alert.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class TestOptions {
  @JsonProperty("url")
  private String url = "";

  @JsonProperty("retry-folder")
  private String retryFolder = "";

  @JsonProperty("message")
  private String message;
}
