package com.example.barbicansecrets.core.client;

import static java.lang.System.Logger.Level.*;

import java.lang.System.Logger;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Provides a lazily configured {@link KeyManagerClient}.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>os.barbican.endpoint / OS_BARBICAN_ENDPOINT (required)
 *   <li>os.auth.token / OS_AUTH_TOKEN (read on every request)
 *   <li>os.barbican.timeout.millis / OS_BARBICAN_TIMEOUT_MILLIS (optional, default 10000)
 *   <li>os.barbican.page.limit / OS_BARBICAN_PAGE_LIMIT (optional, default 100)
 * </ul>
 */
public class KeyManagerClientProvider {

  private static final Logger logger = System.getLogger(KeyManagerClientProvider.class.getName());

  static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;
  static final int DEFAULT_PAGE_LIMIT = 100;

  private static volatile KeyManagerClient client;

  private KeyManagerClientProvider() {}

  /** Drops the current client; next access will lazily rebuild one with current config. */
  public static synchronized void resetClient() {
    client = null;
  }

  /**
   * Lazily gets the client, building it if necessary.
   *
   * @return shared client
   * @throws IllegalStateException if no endpoint is configured
   */
  public static synchronized KeyManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /**
   * Builds a {@link BarbicanKeyManagerClient} from the current system properties and environment.
   *
   * @return configured client
   */
  private static KeyManagerClient buildClient() {
    final var endpoint =
        setting("os.barbican.endpoint", "OS_BARBICAN_ENDPOINT")
            .map(URI::create)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Key manager endpoint is not configured (os.barbican.endpoint or"
                            + " OS_BARBICAN_ENDPOINT)"));

    final var timeoutMillis =
        numericSetting("os.barbican.timeout.millis", "OS_BARBICAN_TIMEOUT_MILLIS")
            .filter(millis -> millis > 0)
            .orElse(DEFAULT_TIMEOUT_MILLIS);

    final var pageLimit =
        numericSetting("os.barbican.page.limit", "OS_BARBICAN_PAGE_LIMIT")
            .filter(limit -> limit > 0 && limit <= Integer.MAX_VALUE)
            .map(Long::intValue)
            .orElse(DEFAULT_PAGE_LIMIT);

    logger.log(INFO, "Building key manager client for {0}", endpoint);
    return BarbicanKeyManagerClient.builder()
        .endpoint(endpoint)
        .tokenSupplier(() -> setting("os.auth.token", "OS_AUTH_TOKEN").orElse(null))
        .connectTimeout(Duration.ofMillis(timeoutMillis))
        .pageLimit(pageLimit)
        .build();
  }

  static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isBlank());
  }

  private static Optional<Long> numericSetting(final String property, final String env) {
    return setting(property, env)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring non-numeric value for {0}: {1}", property, val);
                return Optional.empty();
              }
            });
  }
}
