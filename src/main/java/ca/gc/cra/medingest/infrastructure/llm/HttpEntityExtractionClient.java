package ca.gc.cra.medingest.infrastructure.llm;

import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.port.EntityExtractionClient;
import ca.gc.cra.medingest.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EntityExtractionClient} that POSTs {@code {content, document_date, document_type}} as JSON to an
 * extraction endpoint and returns the raw response body.
 * <p>Non-2xx responses raise {@link IOException}; a blank body is "no entities".</p>
 *
 * @since 0.1.0
 */
public final class HttpEntityExtractionClient implements EntityExtractionClient {
  private static final Logger log = LoggerFactory.getLogger(HttpEntityExtractionClient.class);
  private static final int LOGGED_BODY_BYTES = 256;

  private final HttpClient client;
  private final URI endpoint;
  private final Duration timeout;
  private final JsonWriter writer = new JsonWriter(false);

  /**
   * Creates a client.
   *
   * @param endpoint extraction endpoint
   * @param timeout per-request timeout
   */
  public HttpEntityExtractionClient(URI endpoint, Duration timeout) {
    this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, timeout);
  }

  HttpEntityExtractionClient(HttpClient client, URI endpoint, Duration timeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Optional<String> extract(String content, String documentDate, String documentType)
      throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body(content, documentDate, documentType), StandardCharsets.UTF_8))
        .build();
    HttpResponse<String> response =
        client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new IOException("Entity extraction endpoint returned HTTP " + response.statusCode() + ": "
          + Logs.truncate(response.body(), LOGGED_BODY_BYTES));
    }
    String raw = response.body();
    if (raw == null || raw.isBlank()) {
      log.debug("Entity extraction endpoint returned an empty body");
      return Optional.empty();
    }
    return Optional.of(raw);
  }

  String body(String content, String documentDate, String documentType) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("content", content == null ? "" : content);
    payload.put("document_date", documentDate);
    payload.put("document_type", documentType);
    return writer.write(payload);
  }
}
