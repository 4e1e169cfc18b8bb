package org.hypertrace.alertmanager.service.handler;

import com.typesafe.config.Config;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder(toBuilder = true)
@Getter
@ToString
public class HandlerConfig {
  static final String URL_CONFIG = "url";
  static final String RETRY_FOLDER_CONFIG = "retry-folder";

  @Builder.Default private final String url = "";
  @Builder.Default private final String retryFolder = "";

  /** Applies the overrides present in {@code handlerConfig} on top of {@code defaults}. */
  public static HandlerConfig from(Config handlerConfig, HandlerConfig defaults) {
    HandlerConfigBuilder builder = defaults.toBuilder();
    if (handlerConfig.hasPath(URL_CONFIG)) {
      builder.url(handlerConfig.getString(URL_CONFIG));
    }
    if (handlerConfig.hasPath(RETRY_FOLDER_CONFIG)) {
      builder.retryFolder(handlerConfig.getString(RETRY_FOLDER_CONFIG));
    }
    return builder.build();
  }
}
