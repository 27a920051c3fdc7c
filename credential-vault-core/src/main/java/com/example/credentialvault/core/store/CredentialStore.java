package com.example.credentialvault.core.store;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.credentialvault.core.exceptions.MissingConnectionException;
import com.example.credentialvault.core.exceptions.StoreIOException;
import java.io.IOException;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sectioned key/value file holding one section per named connection.
 *
 * <p>Every read loads the file from disk and every write rewrites the whole file through a
 * temporary sibling that is renamed over the original. There is no locking between processes:
 * two processes writing the same store concurrently can lose each other's updates.
 *
 * <p>Instances are not thread-safe; {@link com.example.credentialvault.core.vault.Vault}
 * serializes access.
 */
public final class CredentialStore {

  public static final String USERNAME = "username";
  public static final String PASSWORD = "password";
  public static final String RESOURCE_ID = "resource_id";
  public static final String AUXILIARY_PATH = "auxiliary_path";

  private static final Logger LOGGER = System.getLogger(CredentialStore.class.getName());

  private final Path file;

  public CredentialStore(final Path file) {
    this.file = file;
  }

  public Path file() {
    return file;
  }

  /** Creates the parent directory and an empty store file if either is missing. */
  public void ensureStoreExists() {
    try {
      Files.createDirectories(file.getParent());
      if (Files.notExists(file)) {
        Files.createFile(file);
        restrictPermissions(file);
        LOGGER.log(INFO, "Created credential store {0}", file);
      }
    } catch (final IOException e) {
      throw new StoreIOException("Failed to create credential store", file, e);
    }
  }

  public boolean hasConnection(final String name) {
    return load().containsKey(name);
  }

  /**
   * Names of all stored connections.
   *
   * @return names in the order they appear in the file
   */
  public List<String> listConnectionNames() {
    return List.copyOf(load().keySet());
  }

  /**
   * Every connection with its stored fields.
   *
   * @return ordered copy of the whole store
   */
  public Map<String, Map<String, String>> readAllConnections() {
    final var copy = new LinkedHashMap<String, Map<String, String>>();
    load().forEach((name, fields) -> copy.put(name, new LinkedHashMap<>(fields)));
    return copy;
  }

  /**
   * All fields of one connection, as stored.
   *
   * @param name connection name
   * @return ordered copy of the section
   * @throws MissingConnectionException if the section does not exist
   */
  public Map<String, String> readConnection(final String name) {
    final var sections = load();
    return Optional.ofNullable(sections.get(name))
        .<Map<String, String>>map(LinkedHashMap::new)
        .orElseThrow(() -> new MissingConnectionException(name, List.copyOf(sections.keySet())));
  }

  /**
   * Reads one stored value.
   *
   * @param name connection name
   * @param field field key
   * @param defaultValue returned when the section exists but the field does not
   * @return stored value or {@code defaultValue}
   * @throws MissingConnectionException if the section does not exist
   */
  public String readField(final String name, final String field, final String defaultValue) {
    return readConnection(name).getOrDefault(field, defaultValue);
  }

  /**
   * Creates the section if needed and sets the given fields, then rewrites the file.
   *
   * @param name connection name
   * @param fields values to set; other fields of the section are kept
   */
  public void writeFields(final String name, final Map<String, String> fields) {
    final var sections = load();
    final var section = sections.computeIfAbsent(name, n -> new LinkedHashMap<>());
    fields.forEach(
        (key, value) -> {
          LOGGER.log(
              DEBUG,
              "{0} field {1} of connection {2}",
              section.containsKey(key) ? "Updating" : "Creating",
              key,
              name);
          section.put(key, value);
        });
    save(sections);
  }

  /**
   * Removes a connection.
   *
   * @param name connection name
   * @return false, after logging a warning, if there was no such connection
   */
  public boolean deleteConnection(final String name) {
    final var sections = load();
    if (sections.remove(name) == null) {
      LOGGER.log(WARNING, "Connection ''{0}'' does not exist in {1}", name, file);
      return false;
    }
    save(sections);
    return true;
  }

  private LinkedHashMap<String, LinkedHashMap<String, String>> load() {
    if (Files.notExists(file)) {
      return new LinkedHashMap<>();
    }
    try {
      LOGGER.log(DEBUG, "Reading credential store {0}", file);
      return SectionedFile.parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new StoreIOException("Failed to read credential store", file, e);
    }
  }

  private void save(final Map<String, ? extends Map<String, String>> sections) {
    final var temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(temp, SectionedFile.render(sections), StandardCharsets.UTF_8);
      restrictPermissions(temp);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (final AtomicMoveNotSupportedException e) {
        LOGGER.log(WARNING, "Atomic rename not supported for {0}; replacing in place", file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.log(DEBUG, "Rewrote credential store {0} ({1} connections)", file, sections.size());
    } catch (final IOException e) {
      throw new StoreIOException("Failed to write credential store", file, e);
    }
  }

  private static void restrictPermissions(final Path path) {
    try {
      Files.setPosixFilePermissions(
          path, EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
    } catch (final UnsupportedOperationException e) {
      LOGGER.log(DEBUG, "POSIX permissions not supported for {0}", path);
    } catch (final IOException e) {
      LOGGER.log(WARNING, "Could not restrict permissions on {0}: {1}", path, e.toString());
    }
  }
}
