package org.hypertrace.alertmanager.service.handler;

import java.util.Map;
import org.hypertrace.alertmanager.service.AlertManagerService;
import org.hypertrace.alertmanager.service.model.AlertEvent;
import org.hypertrace.alertmanager.transport.exception.AlertManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Binds {@link AlertManagerService#alert} to one configured target.
 *
 * <p>Delivery is fire-and-forget: a failed delivery is logged together with the handler context
 * and never reported to the framework calling {@link #handle}. Undelivered payloads that reached
 * the retry folder are picked up out of band.
 */
public class AlertManagerHandler implements AlertHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertManagerHandler.class);

  private final AlertManagerService service;
  private final HandlerConfig handlerConfig;
  private final Map<String, String> context;

  public AlertManagerHandler(
      AlertManagerService service, HandlerConfig handlerConfig, Map<String, String> context) {
    this.service = service;
    this.handlerConfig = handlerConfig;
    this.context = Map.copyOf(context);
  }

  @Override
  public void handle(AlertEvent event) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    context.forEach(MDC::put);
    try {
      service.alert(handlerConfig.getUrl(), handlerConfig.getRetryFolder(), event);
    } catch (AlertManagerException e) {
      LOGGER.error("failed to handle event to AlertManager", e);
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  public HandlerConfig getHandlerConfig() {
    return handlerConfig;
  }
}
