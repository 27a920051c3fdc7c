package com.example.credentialvault.core.exceptions;

/**
 * Raised when the host platform cannot supply a stable machine identifier. The vault cannot
 * encrypt or decrypt anything without one, so callers should treat this as fatal.
 */
public class UnsupportedPlatformException extends VaultException {

  public UnsupportedPlatformException(final String message) {
    super(message);
  }

  public UnsupportedPlatformException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
