package org.hypertrace.alertmanager.transport;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.hypertrace.alertmanager.transport.exception.PersistenceException;
import org.hypertrace.alertmanager.transport.exception.TransportException;
import org.hypertrace.alertmanager.transport.exception.UnexpectedResponseException;
import org.hypertrace.alertmanager.transport.http.HttpWithJsonSender;
import org.hypertrace.alertmanager.transport.retry.RetryFilePersister;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AlertManagerSenderTest {

  private static final AlertManagerEvent EVENT =
      new AlertManagerEvent(
          Map.of("_topic", "cpu", "_level", "CRITICAL", "host", "serverA"),
          Map.of("value", "97.5"));
  private static final TypeReference<List<AlertManagerEvent>> EVENT_LIST =
      new TypeReference<>() {};

  @TempDir Path retryFolder;

  private MockWebServer mockWebServer;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testSendsSingletonArray() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    newSender().send(mockWebServer.url("/").toString(), retryFolder.toString(), EVENT);

    String body = mockWebServer.takeRequest().getBody().readUtf8();
    List<AlertManagerEvent> sent = ObjectMapperProvider.get().readValue(body, EVENT_LIST);
    Assertions.assertEquals(List.of(EVENT), sent);
    Assertions.assertTrue(listFiles().isEmpty());
  }

  @Test
  void testNonOkResponseIsNotStaged() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    UnexpectedResponseException e =
        Assertions.assertThrows(
            UnexpectedResponseException.class,
            () ->
                newSender()
                    .send(mockWebServer.url("/").toString(), retryFolder.toString(), EVENT));

    Assertions.assertEquals(500, e.getStatusCode());
    Assertions.assertTrue(e.getMessage().contains("500"));
    Assertions.assertTrue(listFiles().isEmpty());
  }

  @Test
  void testAcceptedIsStillAnError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202));

    Assertions.assertThrows(
        UnexpectedResponseException.class,
        () -> newSender().send(mockWebServer.url("/").toString(), retryFolder.toString(), EVENT));
  }

  @Test
  void testUnreachableEndpointIsStagedForRetry() throws Exception {
    String url = mockWebServer.url("/").toString();
    mockWebServer.shutdown();

    TransportException e =
        Assertions.assertThrows(
            TransportException.class,
            () -> newSender().send(url, retryFolder.toString(), EVENT));

    Assertions.assertTrue(e.getCause() instanceof IOException);
    List<Path> files = listFiles();
    Assertions.assertEquals(1, files.size());
    List<AlertManagerEvent> staged =
        ObjectMapperProvider.get().readValue(Files.readAllBytes(files.get(0)), EVENT_LIST);
    Assertions.assertEquals(List.of(EVENT), staged);
  }

  @Test
  void testPersistenceFailureDoesNotMaskTransportError() throws Exception {
    HttpWithJsonSender httpSender = mock(HttpWithJsonSender.class);
    IOException refused = new IOException("connection refused");
    when(httpSender.send(anyString(), any())).thenThrow(refused);
    RetryFilePersister persister = mock(RetryFilePersister.class);
    when(persister.persist(anyString(), any()))
        .thenThrow(new PersistenceException("disk full", new IOException("disk full")));

    TransportException e =
        Assertions.assertThrows(
            TransportException.class,
            () ->
                new AlertManagerSender(httpSender, persister)
                    .send("http://alertmanager:9093", "/var/retry", EVENT));

    Assertions.assertSame(refused, e.getCause());
    verify(persister).persist(eq("/var/retry"), any());
  }

  @Test
  void testPayloadNotStagedOnRejection() throws Exception {
    RetryFilePersister persister = mock(RetryFilePersister.class);
    mockWebServer.enqueue(new MockResponse().setResponseCode(400));

    Assertions.assertThrows(
        UnexpectedResponseException.class,
        () ->
            new AlertManagerSender(HttpWithJsonSender.getInstance(), persister)
                .send(mockWebServer.url("/").toString(), retryFolder.toString(), EVENT));

    verify(persister, never()).persist(anyString(), any());
  }

  private AlertManagerSender newSender() {
    return new AlertManagerSender(HttpWithJsonSender.getInstance(), new RetryFilePersister());
  }

  private List<Path> listFiles() throws IOException {
    try (Stream<Path> files = Files.list(retryFolder)) {
      return files.collect(Collectors.toList());
    }
  }
}
