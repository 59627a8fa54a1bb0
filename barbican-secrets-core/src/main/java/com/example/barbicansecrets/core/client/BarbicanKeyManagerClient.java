package com.example.barbicansecrets.core.client;

import static java.lang.System.Logger.Level.*;

import com.example.barbicansecrets.core.RequestContext;
import com.example.barbicansecrets.core.errors.KeyManagerException;
import com.example.barbicansecrets.core.errors.SecretErrorKind;
import com.example.barbicansecrets.core.errors.SecretManagerException;
import com.example.barbicansecrets.core.secrets.Secret;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * {@link KeyManagerClient} speaking the Barbican v1 REST API over the JDK {@link HttpClient}.
 *
 * <p>Listing follows the {@code next} links returned by the service until the last page. The
 * authentication token is obtained from a supplier for every request and sent as {@code
 * X-Auth-Token}; acquiring it is the caller's concern.
 *
 * <pre>{@code
 * var client = BarbicanKeyManagerClient.builder()
 *     .endpoint(URI.create("https://barbican.example.com:9311"))
 *     .tokenSupplier(() -> keystoneToken)
 *     .build();
 * }</pre>
 */
public final class BarbicanKeyManagerClient implements KeyManagerClient {

  private static final Logger logger = System.getLogger(BarbicanKeyManagerClient.class.getName());

  static final String AUTH_TOKEN_HEADER = "X-Auth-Token";
  private static final String SECRETS_PATH = "/v1/secrets";
  private static final String JSON = "application/json";

  private final URI secretsUri;
  private final Supplier<String> tokenSupplier;
  private final HttpClient httpClient;
  private final ObjectMapper mapper;
  private final int pageLimit;
  private final Duration requestTimeout;

  private BarbicanKeyManagerClient(final Builder builder) {
    this.secretsUri = secretsUri(builder.endpoint);
    this.tokenSupplier = builder.tokenSupplier;
    this.httpClient =
        Optional.ofNullable(builder.httpClient)
            .orElseGet(() -> HttpClient.newBuilder().connectTimeout(builder.connectTimeout).build());
    this.mapper = builder.mapper;
    this.pageLimit = builder.pageLimit;
    this.requestTimeout = builder.requestTimeout;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link BarbicanKeyManagerClient}. */
  public static class Builder {
    private URI endpoint;
    private Supplier<String> tokenSupplier = () -> null;
    private HttpClient httpClient;
    private ObjectMapper mapper = new ObjectMapper();
    private int pageLimit = 100;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);

    private Builder() {}

    /**
     * Sets the service base URL, with or without the {@code /v1} suffix (required).
     *
     * @param endpoint key manager endpoint
     * @return this builder
     */
    public Builder endpoint(final URI endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Sets the supplier of the token sent with each request. A null token sends no header.
     *
     * @param tokenSupplier token supplier
     * @return this builder
     */
    public Builder tokenSupplier(final Supplier<String> tokenSupplier) {
      this.tokenSupplier = tokenSupplier;
      return this;
    }

    /**
     * Sets the HTTP client. Default: a new client using {@link #connectTimeout(Duration)}.
     *
     * @param httpClient shared HTTP client
     * @return this builder
     */
    public Builder httpClient(final HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder mapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * Sets the page size requested when listing.
     *
     * <p>Default: 100
     *
     * @param pageLimit secrets per page
     * @return this builder
     */
    public Builder pageLimit(final int pageLimit) {
      this.pageLimit = pageLimit;
      return this;
    }

    public Builder connectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Sets the timeout of requests made with a context that has no deadline.
     *
     * <p>Default: 60 seconds
     *
     * @param requestTimeout per-request timeout
     * @return this builder
     */
    public Builder requestTimeout(final Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return configured client
     * @throws IllegalStateException if required fields are not set
     */
    public BarbicanKeyManagerClient build() {
      if (endpoint == null) throw new IllegalStateException("endpoint is required");
      if (tokenSupplier == null) throw new IllegalStateException("tokenSupplier cannot be null");
      if (mapper == null) throw new IllegalStateException("mapper cannot be null");
      if (pageLimit < 1) throw new IllegalArgumentException("pageLimit must be >= 1");
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
        throw new IllegalArgumentException("connectTimeout must be positive");
      if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
        throw new IllegalArgumentException("requestTimeout must be positive");
      return new BarbicanKeyManagerClient(this);
    }
  }

  @Override
  public List<Secret> list(final RequestContext context, final ListOptions options) {
    final var secrets = new ArrayList<Secret>();
    var next = Optional.of(listUri(options));
    while (next.isPresent()) {
      final var uri = next.get();
      final var response = send(context, newRequest(context, uri).GET().build());
      final var page = read(response, SecretPage.class);
      final var pageSecrets = Optional.ofNullable(page.secrets()).orElse(List.of());
      secrets.addAll(pageSecrets);
      next =
          Optional.ofNullable(page.next())
              .filter(link -> !pageSecrets.isEmpty())
              .map(link -> nextLink(response, link))
              .filter(link -> !link.equals(uri));
    }
    logger.log(DEBUG, "Listed {0} secret(s) with {1}", secrets.size(), options);
    return secrets;
  }

  @Override
  public String create(final RequestContext context, final CreateOptions options) {
    final String body;
    try {
      body = mapper.writeValueAsString(options);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize secret " + options.name(), e);
    }

    final var request =
        newRequest(context, secretsUri)
            .header("Content-Type", JSON)
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
    final var response = send(context, request);
    return Optional.ofNullable(read(response, JsonNode.class).get("secret_ref"))
        .filter(JsonNode::isTextual)
        .map(JsonNode::asText)
        .orElseThrow(
            () ->
                new KeyManagerException(
                    response.statusCode(), "Create response carries no secret_ref"));
  }

  @Override
  public void delete(final RequestContext context, final String secretId) {
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("secretId must not be blank");
    final var uri =
        URI.create(
            secretsUri
                + "/"
                + URLEncoder.encode(secretId, StandardCharsets.UTF_8).replace("+", "%20"));
    send(context, newRequest(context, uri).DELETE().build());
  }

  private HttpRequest.Builder newRequest(final RequestContext context, final URI uri) {
    final var timeout =
        context.remaining().filter(left -> !left.isZero()).orElse(requestTimeout);
    final var builder = HttpRequest.newBuilder(uri).header("Accept", JSON).timeout(timeout);
    Optional.ofNullable(tokenSupplier.get())
        .filter(token -> !token.isBlank())
        .ifPresent(token -> builder.header(AUTH_TOKEN_HEADER, token));
    return builder;
  }

  private HttpResponse<String> send(final RequestContext context, final HttpRequest request) {
    context.throwIfDone();
    final var description = request.method() + " " + request.uri();
    try {
      logger.log(DEBUG, "Sending {0}", description);
      final var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2)
        throw new KeyManagerException(response.statusCode(), errorMessage(description, response));
      return response;
    } catch (final HttpTimeoutException e) {
      if (context.isExpired())
        throw new SecretManagerException(
            SecretErrorKind.CANCELLED, "Deadline exceeded during " + description, e);
      throw new KeyManagerException(0, "Timed out during " + description, e);
    } catch (final IOException e) {
      throw new KeyManagerException(0, "Failed to reach key manager for " + description, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SecretManagerException(
          SecretErrorKind.CANCELLED, "Interrupted during " + description, e);
    }
  }

  private <T> T read(final HttpResponse<String> response, final Class<T> type) {
    final T value;
    try {
      value = mapper.readValue(response.body(), type);
    } catch (final JsonProcessingException e) {
      throw new KeyManagerException(
          response.statusCode(), "Malformed response from " + response.uri(), e);
    }
    return Optional.ofNullable(value)
        .orElseThrow(
            () ->
                new KeyManagerException(
                    response.statusCode(), "Malformed response from " + response.uri()));
  }

  private static URI nextLink(final HttpResponse<String> response, final String link) {
    try {
      return URI.create(link);
    } catch (final IllegalArgumentException e) {
      throw new KeyManagerException(
          response.statusCode(), "Malformed response from " + response.uri() + ": next " + link, e);
    }
  }

  private String errorMessage(final String description, final HttpResponse<String> response) {
    final var prefix = "Key manager returned " + response.statusCode() + " for " + description;
    final var body = Optional.ofNullable(response.body()).filter(b -> !b.isBlank());
    final var detail =
        body.flatMap(
                b -> {
                  try {
                    final var node = mapper.readTree(b);
                    return Optional.ofNullable(node.get("description"))
                        .or(() -> Optional.ofNullable(node.get("title")))
                        .map(JsonNode::asText);
                  } catch (final JsonProcessingException e) {
                    return Optional.empty();
                  }
                })
            .or(() -> body);
    return detail.map(d -> prefix + ": " + d).orElse(prefix);
  }

  private URI listUri(final ListOptions options) {
    final var query = new StringJoiner("&");
    options.nameFilter().ifPresent(name -> query.add("name=" + encode(name)));
    options
        .secretTypeFilter()
        .ifPresent(type -> query.add("secret_type=" + encode(type.wireValue())));
    query.add("limit=" + pageLimit);
    return URI.create(secretsUri + "?" + query);
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static URI secretsUri(final URI endpoint) {
    var base = endpoint.toString();
    while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
    if (base.endsWith("/v1")) base = base.substring(0, base.length() - "/v1".length());
    return URI.create(base + SECRETS_PATH);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SecretPage(
      @JsonProperty("secrets") List<Secret> secrets,
      @JsonProperty("total") Integer total,
      @JsonProperty("next") String next) {}
}
