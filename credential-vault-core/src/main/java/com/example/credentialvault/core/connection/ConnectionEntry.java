package com.example.credentialvault.core.connection;

import java.util.Optional;

/**
 * One row of a connection listing.
 *
 * @param name connection name
 * @param resourceId DSN or URL
 * @param auxiliaryPath wallet path for DSN connections, empty otherwise
 * @param credentials decrypted credentials, present only when the listing asked for them
 */
public record ConnectionEntry(
    String name,
    String resourceId,
    String auxiliaryPath,
    Optional<ConnectionCredentials> credentials) {}
