package com.example.credentialvault.core.exceptions;

/** Base type for every failure raised by the credential vault. */
public class VaultException extends RuntimeException {

  public VaultException(final String message) {
    super(message);
  }

  public VaultException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
