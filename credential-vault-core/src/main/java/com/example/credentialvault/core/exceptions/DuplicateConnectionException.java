package com.example.credentialvault.core.exceptions;

/** Raised when creating a connection whose name is already stored. */
public class DuplicateConnectionException extends VaultException {

  private final String connectionName;

  public DuplicateConnectionException(final String connectionName) {
    super("Connection '" + connectionName + "' already exists.");
    this.connectionName = connectionName;
  }

  public String connectionName() {
    return connectionName;
  }
}
