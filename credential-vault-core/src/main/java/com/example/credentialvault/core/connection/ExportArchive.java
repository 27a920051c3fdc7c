package com.example.credentialvault.core.connection;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialvault.core.exceptions.StoreIOException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.lang.System.Logger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes export archives: a ZIP file holding a single JSON entry named after the
 * archive ({@code creds.zip} contains {@code creds.json}).
 *
 * <p>The archive container is not encrypted. Only the username and password inside each record
 * are protected, by the export secret.
 */
public final class ExportArchive {

  private static final Logger LOGGER = System.getLogger(ExportArchive.class.getName());
  private static final String JSON_SUFFIX = ".json";

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private ExportArchive() {}

  /**
   * Name of the JSON entry for an archive path.
   *
   * @param archive archive path
   * @return archive file name with its extension replaced by {@code .json}
   */
  public static String entryName(final Path archive) {
    final var fileName = archive.getFileName().toString();
    final var dot = fileName.lastIndexOf('.');
    return (dot > 0 ? fileName.substring(0, dot) : fileName) + JSON_SUFFIX;
  }

  /**
   * Writes a document, replacing any existing file.
   *
   * @param archive target path; missing parent directories are created
   * @param document content
   * @throws StoreIOException if the archive cannot be written
   */
  public static void write(final Path archive, final ExportDocument document) {
    try {
      final var parent = archive.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (final var zip = new ZipOutputStream(Files.newOutputStream(archive))) {
        final var entry = new ZipEntry(entryName(archive));
        entry.setMethod(ZipEntry.DEFLATED);
        zip.putNextEntry(entry);
        zip.write(MAPPER.writeValueAsBytes(document));
        zip.closeEntry();
      }
      LOGGER.log(DEBUG, "Wrote export archive {0}", archive);
    } catch (final IOException e) {
      throw new StoreIOException("Failed to write export archive", archive, e);
    }
  }

  /**
   * Reads the first JSON entry of an archive.
   *
   * @param archive archive path
   * @return parsed document
   * @throws StoreIOException if the archive cannot be read, has no JSON entry or holds invalid
   *     JSON
   */
  public static ExportDocument read(final Path archive) {
    try (final var zip = new ZipInputStream(Files.newInputStream(archive))) {
      for (var entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
        if (!entry.isDirectory() && entry.getName().endsWith(JSON_SUFFIX)) {
          LOGGER.log(DEBUG, "Reading {0} from {1}", entry.getName(), archive);
          return MAPPER.readValue(zip.readAllBytes(), ExportDocument.class);
        }
      }
      throw new IOException("Archive contains no " + JSON_SUFFIX + " entry");
    } catch (final IOException e) {
      throw new StoreIOException("Failed to read export archive", archive, e);
    }
  }
}
