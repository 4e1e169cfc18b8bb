package org.hypertrace.alertmanager.transport.http;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.charset.StandardCharsets;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWithJsonSenderTest {

  private MockWebServer mockWebServer;
  private HttpWithJsonSender sender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    sender = new HttpWithJsonSender(new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsJsonBody() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    byte[] json = "[{\"labels\":{},\"annotations\":{}}]".getBytes(StandardCharsets.UTF_8);

    Response response = sender.send(mockWebServer.url("/api/v1/alerts").toString(), json);

    Assertions.assertEquals(200, response.code());
    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    Assertions.assertEquals("/api/v1/alerts", request.getPath());
    Assertions.assertEquals(
        "application/json; charset=utf-8", request.getHeader("Content-Type"));
    Assertions.assertEquals(
        "[{\"labels\":{},\"annotations\":{}}]", request.getBody().readUtf8());
  }

  @Test
  void testReturnsNonSuccessStatus() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    Response response = sender.send(mockWebServer.url("/").toString(), new byte[0]);

    Assertions.assertEquals(503, response.code());
  }

  @Test
  void testUnreachableEndpointThrows() throws IOException {
    String url = mockWebServer.url("/").toString();
    mockWebServer.shutdown();

    Assertions.assertThrows(IOException.class, () -> sender.send(url, new byte[0]));
  }

  @Test
  void testNonHttpUrlThrows() {
    Assertions.assertThrows(
        MalformedURLException.class, () -> sender.send("alertmanager:9093", new byte[0]));
  }
}
