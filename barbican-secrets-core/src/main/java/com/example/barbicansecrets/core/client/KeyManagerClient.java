package com.example.barbicansecrets.core.client;

import com.example.barbicansecrets.core.RequestContext;
import com.example.barbicansecrets.core.errors.KeyManagerException;
import com.example.barbicansecrets.core.secrets.Secret;
import java.util.List;

/**
 * Client for the secrets resource of the OpenStack key manager API.
 *
 * <p>Implementations own transport, authentication and pagination. Every method receives the
 * caller's {@link RequestContext} unchanged and fails with {@link KeyManagerException} when the
 * service reports an error.
 */
public interface KeyManagerClient {

  /**
   * Lists every secret matching the filters, across all pages.
   *
   * @param context request context
   * @param options server-side filters
   * @return matching secrets, possibly empty
   */
  List<Secret> list(RequestContext context, ListOptions options);

  /**
   * Creates a secret.
   *
   * @param context request context
   * @param options secret attributes and payload
   * @return the reference assigned by the service
   */
  String create(RequestContext context, CreateOptions options);

  /**
   * Deletes a secret by id.
   *
   * @param context request context
   * @param secretId secret id, the last segment of its reference
   * @throws KeyManagerException with {@link KeyManagerException#isNotFound()} when already absent
   */
  void delete(RequestContext context, String secretId);
}
