package com.example.credentialvault.core.exceptions;

/** Raised for a project identifier or connection name that cannot be used on disk. */
public class InvalidNameException extends VaultException {

  public InvalidNameException(final String message) {
    super(message);
  }
}
