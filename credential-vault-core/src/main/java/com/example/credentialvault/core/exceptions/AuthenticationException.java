package com.example.credentialvault.core.exceptions;

/**
 * Raised when an encrypted credential fails authentication: the wrong secret was used, the blob
 * was produced on another machine, or the stored value is corrupted. No plaintext is ever
 * returned alongside this failure.
 */
public class AuthenticationException extends VaultException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
