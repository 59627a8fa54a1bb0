package com.example.barbicansecrets.core.errors;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeyManagerExceptionTest {

  @Test
  @DisplayName("only a 404 counts as not found")
  void notFoundIsStatus404() {
    assertTrue(new KeyManagerException(404, "gone").isNotFound());
    assertFalse(new KeyManagerException(500, "boom").isNotFound());
    assertFalse(new KeyManagerException(0, "unreachable").isNotFound());
  }

  @Test
  @DisplayName("service failures are classified as REMOTE_SERVICE and keep their cause")
  void classifiedAsRemoteService() {
    final var cause = new java.io.IOException("reset");
    final var e = new KeyManagerException(0, "unreachable", cause);

    assertEquals(SecretErrorKind.REMOTE_SERVICE, e.kind());
    assertTrue(e.is(SecretErrorKind.REMOTE_SERVICE));
    assertFalse(e.is(SecretErrorKind.NOT_FOUND));
    assertSame(cause, e.getCause());
  }

  @Test
  @DisplayName("kind is required")
  void kindRequired() {
    assertThrows(NullPointerException.class, () -> new SecretManagerException(null, "x"));
  }
}
