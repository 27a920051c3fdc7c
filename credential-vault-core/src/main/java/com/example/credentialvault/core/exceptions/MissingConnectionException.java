package com.example.credentialvault.core.exceptions;

import java.util.List;

/**
 * Raised when an operation names a connection that is not in the store.
 *
 * <p>The message lists every connection name that is currently valid so a user can correct the
 * request; the same list is available from {@link #validNames()}.
 */
public class MissingConnectionException extends VaultException {

  private final String connectionName;
  private final List<String> validNames;

  public MissingConnectionException(final String connectionName, final List<String> validNames) {
    super(message(connectionName, validNames));
    this.connectionName = connectionName;
    this.validNames = List.copyOf(validNames);
  }

  private static String message(final String connectionName, final List<String> validNames) {
    final var valid =
        validNames.isEmpty()
            ? "No connection names have been saved"
            : String.join(", ", validNames);
    return "Connection '"
        + connectionName
        + "' does not exist in the credentials store. Valid connection names are: "
        + valid
        + ".";
  }

  public String connectionName() {
    return connectionName;
  }

  /**
   * Connection names present in the store when the lookup failed, in store order.
   *
   * @return immutable list of names, empty if the store holds no connections
   */
  public List<String> validNames() {
    return validNames;
  }
}
