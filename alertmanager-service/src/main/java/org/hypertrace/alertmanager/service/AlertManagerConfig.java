package org.hypertrace.alertmanager.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Service level AlertManager settings. Instances are immutable so that a reload can swap the
 * whole value at once.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class AlertManagerConfig {
  public static final String CONFIG_PATH = "alertmanager";
  static final String ENABLED_CONFIG = "enabled";
  static final String URL_CONFIG = "url";
  static final String RETRY_FOLDER_CONFIG = "retry-folder";

  private final boolean enabled;
  @Builder.Default private final String url = "";
  @Builder.Default private final String retryFolder = "";

  /** Reads an {@code alertmanager} section, falling back to reference.conf for missing keys. */
  public static AlertManagerConfig from(Config alertManagerConfig) {
    Config config =
        alertManagerConfig
            .withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH))
            .resolve();
    return AlertManagerConfig.builder()
        .enabled(config.getBoolean(ENABLED_CONFIG))
        .url(config.getString(URL_CONFIG))
        .retryFolder(config.getString(RETRY_FOLDER_CONFIG))
        .build();
  }

  /**
   * The URL is only checked when the service is enabled, and only syntactically. The retry folder
   * must exist either way.
   */
  public void validate() throws ConfigurationException {
    if (enabled) {
      if (url == null || url.isEmpty()) {
        throw new ConfigurationException("url cannot be empty");
      }
      try {
        new URI(url);
      } catch (URISyntaxException e) {
        throw new ConfigurationException(
            String.format("invalid AlertManager URL: \"%s\"", url), e);
      }
    }
    if (!folderExists(retryFolder)) {
      throw new ConfigurationException(
          String.format("folder \"%s\" does not exist", retryFolder));
    }
  }

  private static boolean folderExists(String folder) {
    // stat semantics: only a path known to be missing is rejected, an empty one would resolve to
    // the working directory
    if (folder == null || folder.isEmpty()) {
      return false;
    }
    try {
      return !Files.notExists(Paths.get(folder));
    } catch (InvalidPathException e) {
      return false;
    }
  }
}
