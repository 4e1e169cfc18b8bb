package org.hypertrace.alertmanager.transport.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.net.MalformedURLException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic blocking sender that posts a JSON document to a URL. Stateless apart from the shared
 * {@link OkHttpClient}, so a single instance is safe to use from any number of threads.
 *
 * <p>The returned {@link Response} has its body already closed; only the status line is
 * meaningful to callers.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final HttpWithJsonSender INSTANCE = new HttpWithJsonSender(new OkHttpClient());

  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  /**
   * @throws IOException when no response could be obtained, including a URL that cannot be
   *     addressed over HTTP
   */
  public Response send(String url, byte[] json) throws IOException {
    HttpUrl httpUrl = HttpUrl.parse(url);
    if (httpUrl == null) {
      throw new MalformedURLException(String.format("not an http(s) URL: %s", url));
    }
    LOGGER.debug("Posting {} bytes of json to {}", json.length, httpUrl);
    RequestBody body = RequestBody.create(json, JSON);
    Request request = new Request.Builder().url(httpUrl).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return response;
    }
  }
}
