package com.example.credentialvault.core.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Header of an export document.
 *
 * @param resourceType tag of the exported store, e.g. {@code "dsn"}
 * @param projectId project identifier the store belongs to
 * @param sourceFilename file name of the archive the document was written to
 * @param auxiliaryPath wallet path of a single exported DSN connection, empty otherwise
 * @param exportTimestamp local time of the export, {@code yyyy-MM-dd HH:mm:ss}
 */
public record ExportHeader(
    @JsonProperty("resource_type") String resourceType,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("source_filename") String sourceFilename,
    @JsonProperty("auxiliary_path") String auxiliaryPath,
    @JsonProperty("export_timestamp") String exportTimestamp) {}
