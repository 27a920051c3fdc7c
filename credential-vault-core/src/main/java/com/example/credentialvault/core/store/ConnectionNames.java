package com.example.credentialvault.core.store;

import com.example.credentialvault.core.exceptions.InvalidNameException;

/** Rules for connection names, which double as section headers in the store file. */
public final class ConnectionNames {

  /** Export selector meaning every connection in the store. */
  public static final String WILDCARD = "*";

  private ConnectionNames() {}

  /**
   * Checks that a name can be written as a section header and read back unchanged.
   *
   * @param name candidate connection name
   * @return the same name
   * @throws InvalidNameException if the name is blank, padded with whitespace, contains a square
   *     bracket or line break, or is the export wildcard
   */
  public static String requireValid(final String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidNameException("Connection name must not be blank");
    }
    if (!name.equals(name.strip())) {
      throw new InvalidNameException(
          "Connection name '" + name + "' must not start or end with whitespace");
    }
    if (WILDCARD.equals(name)) {
      throw new InvalidNameException(
          "'" + WILDCARD + "' is reserved for exporting all connections");
    }
    if (name.chars().anyMatch(c -> c == '[' || c == ']' || c == '\r' || c == '\n')) {
      throw new InvalidNameException(
          "Connection name '" + name + "' must not contain brackets or line breaks");
    }
    return name;
  }
}
