package com.example.barbicansecrets.core.secrets;

import static java.lang.System.Logger.Level.*;

import com.example.barbicansecrets.core.RequestContext;
import com.example.barbicansecrets.core.client.CreateOptions;
import com.example.barbicansecrets.core.client.KeyManagerClient;
import com.example.barbicansecrets.core.client.KeyManagerClientProvider;
import com.example.barbicansecrets.core.client.ListOptions;
import com.example.barbicansecrets.core.errors.KeyManagerException;
import com.example.barbicansecrets.core.errors.SecretErrorKind;
import com.example.barbicansecrets.core.errors.SecretManagerException;
import com.example.barbicansecrets.core.metrics.ApiMetrics;
import java.lang.System.Logger;
import java.util.List;
import java.util.Objects;

/**
 * Name-based helpers over the key manager secrets API.
 *
 * <p>Every call goes to the service; nothing is cached between calls. The {@link RequestContext}
 * passed in is handed unchanged to each remote call, and each remote call is measured as resource
 * {@code secret} with operation {@code list}, {@code create} or {@code delete}.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var secrets = new SecretManager(KeyManagerClientProvider.getClient());
 * var ctx = RequestContext.withTimeout(Duration.ofSeconds(30));
 *
 * var ref = secrets.ensureSecret(ctx, "listener-tls", "text/plain", base64Pkcs12);
 * var id = SecretManager.parseSecretId(ref);
 * }</pre>
 *
 * <h2>Cleanup</h2>
 *
 * <pre>{@code
 * // removes every opaque secret whose name contains the load balancer id
 * secrets.deleteSecrets(ctx, loadBalancerId);
 * }</pre>
 */
public final class SecretManager {

  private static final Logger logger = System.getLogger(SecretManager.class.getName());

  static final String RESOURCE = "secret";
  static final String ALGORITHM = "aes";
  static final String MODE = "cbc";
  static final int BIT_LENGTH = 256;
  static final String PAYLOAD_ENCODING = "base64";

  private final KeyManagerClient client;
  private final ApiMetrics metrics;

  public SecretManager(final KeyManagerClient client) {
    this(client, ApiMetrics.global());
  }

  public SecretManager(final KeyManagerClient client, final ApiMetrics metrics) {
    this.client = Objects.requireNonNull(client, "client");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates a manager backed by the client configured through {@link KeyManagerClientProvider}.
   *
   * @return manager using the shared client and the global metrics registry
   */
  public static SecretManager fromEnvironment() {
    return new SecretManager(KeyManagerClientProvider.getClient());
  }

  /**
   * Returns the reference of the secret named {@code name}, creating it when no such secret exists.
   *
   * <p>An existing secret is reused as is; its type and payload are not compared with the
   * arguments.
   *
   * @param context request context
   * @param name secret name
   * @param secretType payload content type used when creating
   * @param payload base64 payload used when creating
   * @return reference of the existing or newly created secret
   * @throws SecretManagerException when the lookup is ambiguous or the service fails
   */
  public String ensureSecret(
      final RequestContext context,
      final String name,
      final String secretType,
      final String payload) {
    try {
      return getSecret(context, name).secretRef();
    } catch (final SecretManagerException e) {
      if (!e.is(SecretErrorKind.NOT_FOUND)) throw e;
      return createSecret(context, name, secretType, payload);
    }
  }

  /**
   * Looks up a secret by exact name.
   *
   * @param context request context
   * @param name secret name
   * @return the only secret with that name
   * @throws SecretManagerException of kind {@link SecretErrorKind#NOT_FOUND} when none matches, of
   *     kind {@link SecretErrorKind#AMBIGUOUS_RESULT} when several match
   */
  public Secret getSecret(final RequestContext context, final String name) {
    final var secrets = list(context, ListOptions.byName(name));
    if (secrets.isEmpty())
      throw new SecretManagerException(SecretErrorKind.NOT_FOUND, "Secret not found: " + name);
    if (secrets.size() > 1)
      throw new SecretManagerException(
          SecretErrorKind.AMBIGUOUS_RESULT,
          "Found " + secrets.size() + " secrets named " + name);
    logger.log(DEBUG, "Found secret {0}", name);
    return secrets.get(0);
  }

  /**
   * Creates an opaque secret.
   *
   * <p>The secret is recorded as AES/CBC with a 256 bit length and a base64 encoded payload whose
   * content type is {@code secretType}. Failures are not retried.
   *
   * @param context request context
   * @param name secret name
   * @param secretType payload content type, e.g. {@code text/plain}
   * @param payload base64 payload
   * @return the reference assigned by the service
   */
  public String createSecret(
      final RequestContext context,
      final String name,
      final String secretType,
      final String payload) {
    final var options =
        new CreateOptions(
            name,
            ALGORITHM,
            MODE,
            BIT_LENGTH,
            secretType,
            PAYLOAD_ENCODING,
            payload,
            SecretType.OPAQUE);

    context.throwIfDone();
    final String secretRef;
    try (var mc = metrics.start(RESOURCE, "create")) {
      secretRef = client.create(context, options);
      mc.success();
    }
    logger.log(INFO, "Created secret {0}: {1}", name, secretRef);
    return secretRef;
  }

  /**
   * Returns the secret id, the last {@code /}-separated segment of a reference.
   *
   * <pre>{@code
   * parseSecretId("http://host:9311/v1/secrets/abc123"); // "abc123"
   * }</pre>
   *
   * @param ref secret reference
   * @return the last path segment
   * @throws SecretManagerException of kind {@link SecretErrorKind#MALFORMED_REFERENCE} when {@code
   *     ref} contains no separator
   */
  public static String parseSecretId(final String ref) {
    if (ref == null)
      throw new SecretManagerException(
          SecretErrorKind.MALFORMED_REFERENCE, "Could not parse secret reference: null");
    final var parts = ref.split("/", -1);
    if (parts.length < 2)
      throw new SecretManagerException(
          SecretErrorKind.MALFORMED_REFERENCE, "Could not parse secret reference: " + ref);
    return parts[parts.length - 1];
  }

  /**
   * Deletes every opaque secret whose name contains {@code partName}.
   *
   * <p>Matching is case-sensitive and unanchored; an empty {@code partName} matches every opaque
   * secret. Deletes run one at a time in listing order. A secret that is already gone is skipped.
   * Any other failure stops the batch and is rethrown, so secrets after the failing one are left in
   * place; earlier deletions are not undone.
   *
   * @param context request context, checked before each delete
   * @param partName substring to look for in secret names
   * @return number of secrets deleted by this call
   * @throws SecretManagerException of kind {@link SecretErrorKind#CANCELLED} when the context is
   *     cancelled mid-batch, or {@link SecretErrorKind#MALFORMED_REFERENCE} when a matching secret's
   *     reference yields no identifier
   */
  public int deleteSecrets(final RequestContext context, final String partName) {
    Objects.requireNonNull(partName, "partName");
    final var secrets = list(context, ListOptions.bySecretType(SecretType.OPAQUE));

    var deleted = 0;
    for (final var secret : secrets) {
      final var name = Objects.requireNonNullElse(secret.name(), "");
      if (!name.contains(partName)) continue;

      final var secretId = parseSecretId(secret.secretRef());
      if (secretId.isEmpty())
        throw new SecretManagerException(
            SecretErrorKind.MALFORMED_REFERENCE,
            "Secret " + name + " has no identifier in reference " + secret.secretRef());
      context.throwIfDone();
      try (var mc = metrics.start(RESOURCE, "delete")) {
        client.delete(context, secretId);
        mc.success();
        deleted++;
        logger.log(INFO, "Deleted secret {0} ({1})", name, secretId);
      } catch (final KeyManagerException e) {
        if (!e.isNotFound()) throw e;
        logger.log(DEBUG, "Secret {0} ({1}) already deleted", name, secretId);
      }
    }
    return deleted;
  }

  private List<Secret> list(final RequestContext context, final ListOptions options) {
    context.throwIfDone();
    try (var mc = metrics.start(RESOURCE, "list")) {
      final var secrets = client.list(context, options);
      mc.success();
      return secrets;
    }
  }
}
