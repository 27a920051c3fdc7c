package com.example.credentialvault.core.connection;

/**
 * Decrypted credentials of one connection.
 *
 * @param username plaintext username
 * @param password plaintext password
 * @param resourceId DSN or URL the credentials are for
 */
public record ConnectionCredentials(String username, String password, String resourceId) {

  @Override
  public String toString() {
    return "ConnectionCredentials[username="
        + username
        + ", password=****, resourceId="
        + resourceId
        + "]";
  }
}
