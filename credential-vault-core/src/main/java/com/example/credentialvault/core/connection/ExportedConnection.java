package com.example.credentialvault.core.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A connection as written to an export archive. Username and password are encrypted with the
 * export secret, not the system identity.
 *
 * @param connectionName connection name
 * @param username encoded blob
 * @param password encoded blob
 * @param resourceId DSN or URL, in plain text
 */
public record ExportedConnection(
    @JsonProperty("connection_name") String connectionName,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("resource_id") String resourceId) {}
