package org.hypertrace.alertmanager.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.List;
import okhttp3.Response;
import org.hypertrace.alertmanager.transport.exception.EventSerializationException;
import org.hypertrace.alertmanager.transport.exception.PersistenceException;
import org.hypertrace.alertmanager.transport.exception.TransportException;
import org.hypertrace.alertmanager.transport.exception.UnexpectedResponseException;
import org.hypertrace.alertmanager.transport.http.HttpWithJsonSender;
import org.hypertrace.alertmanager.transport.retry.RetryFilePersister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sender specific to AlertManager. Serializes the alert as a one element array, posts it and
 * classifies the outcome:
 *
 * <ul>
 *   <li>200: delivered
 *   <li>any other status: {@link UnexpectedResponseException}, nothing is staged
 *   <li>no response at all: the payload is written to the retry folder and {@link
 *       TransportException} is thrown whether or not that write succeeded
 * </ul>
 */
public class AlertManagerSender {
  private static final int OK_CODE = 200;
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertManagerSender.class);

  private final HttpWithJsonSender sender;
  private final RetryFilePersister retryFilePersister;

  public AlertManagerSender(HttpWithJsonSender sender, RetryFilePersister retryFilePersister) {
    this.sender = sender;
    this.retryFilePersister = retryFilePersister;
  }

  public void send(String url, String retryFolder, AlertManagerEvent event)
      throws EventSerializationException, TransportException, UnexpectedResponseException {
    Preconditions.checkArgument(url != null, "url cannot be null");
    Preconditions.checkArgument(event != null, "event cannot be null");
    byte[] payload = serialize(List.of(event));

    Response response;
    try {
      response = sender.send(url, payload);
    } catch (IOException e) {
      // stage for retry only when nothing came back
      saveForRetry(retryFolder, payload);
      throw new TransportException(url, e);
    }

    int responseCode = response.code();
    if (responseCode != OK_CODE) {
      LOGGER.error(
          "Error response from AlertManager. Response Code: {}, Response Message: {}",
          responseCode,
          response.message());
      throw new UnexpectedResponseException(responseCode);
    }
    LOGGER.debug("Alert delivered to {}", url);
  }

  private byte[] serialize(List<AlertManagerEvent> events) throws EventSerializationException {
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    try {
      return objectMapper.writeValueAsBytes(events);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Failed to serialize alert to JSON", e);
    }
  }

  private void saveForRetry(String retryFolder, byte[] payload) {
    try {
      retryFilePersister.persist(retryFolder, payload);
    } catch (PersistenceException e) {
      LOGGER.error("Couldn't save alert for retry", e);
    }
  }
}
