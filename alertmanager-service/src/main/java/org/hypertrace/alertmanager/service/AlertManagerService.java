package org.hypertrace.alertmanager.service;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.hypertrace.alertmanager.service.handler.AlertHandler;
import org.hypertrace.alertmanager.service.handler.AlertManagerHandler;
import org.hypertrace.alertmanager.service.handler.HandlerConfig;
import org.hypertrace.alertmanager.service.model.AlertEvent;
import org.hypertrace.alertmanager.transport.AlertManagerEvent;
import org.hypertrace.alertmanager.transport.AlertManagerSender;
import org.hypertrace.alertmanager.transport.exception.AlertManagerException;
import org.hypertrace.alertmanager.transport.http.HttpWithJsonSender;
import org.hypertrace.alertmanager.transport.retry.RetryFilePersister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards alerts to an AlertManager endpoint. The configuration is held as an immutable snapshot
 * that {@link #update} replaces atomically; each call to {@link #alert} works against the
 * snapshot it read first.
 */
public class AlertManagerService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertManagerService.class);
  static final String TEST_MESSAGE = "test alertmanager message";

  private final AtomicReference<AlertManagerConfig> configValue;
  private final AlertEventTranslator translator;
  private final AlertManagerSender sender;

  public AlertManagerService(AlertManagerConfig config, AlertManagerSender sender) {
    this(config, new AlertEventTranslator(), sender);
  }

  @VisibleForTesting
  AlertManagerService(
      AlertManagerConfig config, AlertEventTranslator translator, AlertManagerSender sender) {
    this.configValue = new AtomicReference<>(config);
    this.translator = translator;
    this.sender = sender;
  }

  /** Builds the service from the {@code alertmanager} section of the application config. */
  public static AlertManagerService fromConfig(Config appConfig) throws ConfigurationException {
    Config section =
        appConfig.hasPath(AlertManagerConfig.CONFIG_PATH)
            ? appConfig.getConfig(AlertManagerConfig.CONFIG_PATH)
            : ConfigFactory.empty();
    AlertManagerConfig config = AlertManagerConfig.from(section);
    config.validate();
    LOGGER.info("Starting AlertManager service with {}", config);
    return new AlertManagerService(
        config,
        new AlertManagerSender(HttpWithJsonSender.getInstance(), new RetryFilePersister()));
  }

  /** Hot reload. Accepts exactly one {@link AlertManagerConfig}, which must validate. */
  public void update(List<?> newConfigs) throws ConfigurationException {
    if (newConfigs.size() != 1) {
      throw new ConfigurationException(
          String.format("expected only one new config object, got %d", newConfigs.size()));
    }
    Object newConfig = newConfigs.get(0);
    if (!(newConfig instanceof AlertManagerConfig)) {
      throw new ConfigurationException(
          String.format(
              "expected config object to be of type %s, got %s",
              AlertManagerConfig.class.getName(),
              newConfig == null ? "null" : newConfig.getClass().getName()));
    }
    AlertManagerConfig config = (AlertManagerConfig) newConfig;
    config.validate();
    configValue.set(config);
    LOGGER.info("AlertManager configuration updated: {}", config);
  }

  public AlertManagerConfig config() {
    return configValue.get();
  }

  /** Sends {@code event} to {@code url}, staging it in {@code retryFolder} if unreachable. */
  public void alert(String url, String retryFolder, AlertEvent event)
      throws AlertManagerException {
    AlertManagerConfig config = config();
    if (!config.isEnabled()) {
      throw new ServiceDisabledException();
    }
    AlertManagerEvent alertManagerEvent = translator.translate(event);
    sender.send(url, retryFolder, alertManagerEvent);
  }

  public HandlerConfig defaultHandlerConfig() {
    AlertManagerConfig config = config();
    return HandlerConfig.builder()
        .url(config.getUrl())
        .retryFolder(config.getRetryFolder())
        .build();
  }

  /**
   * @param context key/values added to the logging context of every delivery failure reported by
   *     the handler
   */
  public AlertHandler handler(HandlerConfig handlerConfig, Map<String, String> context) {
    return new AlertManagerHandler(this, handlerConfig, context);
  }

  public TestOptions testOptions() {
    AlertManagerConfig config = config();
    return new TestOptions(config.getUrl(), config.getRetryFolder(), TEST_MESSAGE);
  }

  /** Sends an empty alert to the target described by {@code options}, surfacing any failure. */
  public void test(Object options) throws AlertManagerException {
    if (!(options instanceof TestOptions)) {
      throw new IllegalArgumentException(
          String.format(
              "unexpected options type %s",
              options == null ? "null" : options.getClass().getName()));
    }
    TestOptions testOptions = (TestOptions) options;
    alert(testOptions.getUrl(), testOptions.getRetryFolder(), AlertEvent.empty());
  }
}
