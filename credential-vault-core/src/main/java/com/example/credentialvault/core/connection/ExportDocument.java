package com.example.credentialvault.core.connection;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Structured content of an export archive.
 *
 * @param header where and when the export was produced
 * @param connections exported connections in store order
 */
public record ExportDocument(
    @JsonProperty("header") ExportHeader header,
    @JsonProperty("connections") List<ExportedConnection> connections) {

  public ExportDocument {
    connections = connections == null ? List.of() : List.copyOf(connections);
  }
}
