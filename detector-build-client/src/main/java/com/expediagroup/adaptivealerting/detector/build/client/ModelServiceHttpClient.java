package com.expediagroup.adaptivealerting.detector.build.client;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends JSON requests to the model service and returns response bodies as strings. Any I/O failure
 * or non 2xx status surfaces as a {@link TransportException}; nothing is retried here.
 */
public class ModelServiceHttpClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(ModelServiceHttpClient.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final HttpUrl baseUrl;

  public ModelServiceHttpClient(String baseUrl, Duration requestTimeout) {
    this(new OkHttpClient.Builder().callTimeout(requestTimeout).build(), baseUrl);
  }

  @VisibleForTesting
  ModelServiceHttpClient(OkHttpClient client, String baseUrl) {
    HttpUrl parsedUrl = HttpUrl.parse(baseUrl);
    if (parsedUrl == null) {
      throw new ConfigurationException(String.format("Invalid model service url: %s", baseUrl));
    }
    this.client = client;
    this.baseUrl = parsedUrl;
  }

  public String get(String path, Map<String, String> queryParameters) {
    return execute(new Request.Builder().url(url(path, queryParameters)).get().build());
  }

  public String post(String path, Map<String, String> queryParameters, String jsonString) {
    return execute(
        new Request.Builder()
            .url(url(path, queryParameters))
            .post(RequestBody.create(jsonString, JSON))
            .build());
  }

  public String put(String path, Map<String, String> queryParameters, String jsonString) {
    return execute(
        new Request.Builder()
            .url(url(path, queryParameters))
            .put(RequestBody.create(jsonString, JSON))
            .build());
  }

  public String delete(String path, Map<String, String> queryParameters) {
    return execute(new Request.Builder().url(url(path, queryParameters)).delete().build());
  }

  private HttpUrl url(String path, Map<String, String> queryParameters) {
    HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegments(path);
    queryParameters.forEach(builder::addQueryParameter);
    return builder.build();
  }

  private String execute(Request request) {
    LOGGER.debug("{} {}", request.method(), request.url());
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String bodyString = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new TransportException(
            String.format(
                "%s %s failed with status %d: %s",
                request.method(), request.url(), response.code(), bodyString),
            response.code());
      }
      return bodyString;
    } catch (IOException e) {
      throw new TransportException(
          String.format("%s %s failed: %s", request.method(), request.url(), e.getMessage()), e);
    }
  }
}
