package com.example.credentialvault.core.connection;

import static com.example.credentialvault.core.store.CredentialStore.AUXILIARY_PATH;
import static com.example.credentialvault.core.store.CredentialStore.PASSWORD;
import static com.example.credentialvault.core.store.CredentialStore.RESOURCE_ID;
import static com.example.credentialvault.core.store.CredentialStore.USERNAME;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.credentialvault.core.exceptions.DuplicateConnectionException;
import com.example.credentialvault.core.store.ConnectionNames;
import com.example.credentialvault.core.store.ResourceType;
import com.example.credentialvault.core.vault.Vault;
import com.example.credentialvault.core.vault.VaultRegistry;
import java.lang.System.Logger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Create, read, update, delete, list, export and import named connections of one store.
 *
 * <p>Usernames and passwords are encrypted with the system identity before they reach disk and
 * decrypted through the vault's cache when read. Callers supply already validated plain text.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var registry = new VaultRegistry();
 * var manager = new ConnectionManager(registry, "my-project", ResourceType.DSN);
 *
 * manager.create("db1", "alice", "s3cret", "host:1521/orcl");
 * var creds = manager.read("db1");
 *
 * manager.update("db1", ConnectionUpdate.builder().password("newpass").build());
 * manager.export("*", Path.of("db-creds.zip"), "export-password");
 * }</pre>
 *
 * <p>Managers built from the same registry for the same project and resource type share one
 * {@link Vault}, and therefore one decryption cache.
 */
public final class ConnectionManager {

  private static final Logger LOGGER = System.getLogger(ConnectionManager.class.getName());

  static final DateTimeFormatter EXPORT_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final Vault vault;
  private final Clock clock;

  public ConnectionManager(
      final VaultRegistry registry,
      final String projectIdentifier,
      final ResourceType resourceType) {
    this(registry, projectIdentifier, resourceType, Clock.systemDefaultZone());
  }

  public ConnectionManager(
      final VaultRegistry registry,
      final String projectIdentifier,
      final ResourceType resourceType,
      final Clock clock) {
    this(registry.getVault(projectIdentifier, resourceType), clock);
  }

  ConnectionManager(final Vault vault, final Clock clock) {
    this.vault = vault;
    this.clock = clock;
  }

  public Vault vault() {
    return vault;
  }

  public ResourceType resourceType() {
    return vault.resourceType();
  }

  /**
   * Stores a new connection without an auxiliary path.
   *
   * @see #create(String, String, String, String, String)
   */
  public void create(
      final String name, final String username, final String password, final String resourceId) {
    create(name, username, password, resourceId, "");
  }

  /**
   * Stores a new connection.
   *
   * @param name unique connection name
   * @param username plaintext username
   * @param password plaintext password
   * @param resourceId DSN or URL
   * @param auxiliaryPath wallet path, stored for DSN connections only
   * @throws DuplicateConnectionException if {@code name} is already stored
   * @throws com.example.credentialvault.core.exceptions.InvalidNameException if {@code name}
   *     cannot be used as a connection name
   * @throws IllegalArgumentException if {@code resourceId} or {@code auxiliaryPath} contains a
   *     line break or leading or trailing whitespace
   */
  public void create(
      final String name,
      final String username,
      final String password,
      final String resourceId,
      final String auxiliaryPath) {
    ConnectionNames.requireValid(name);
    synchronized (vault) {
      if (vault.hasConnection(name)) {
        throw new DuplicateConnectionException(name);
      }
      vault.writeFields(name, fields(username, password, resourceId, auxiliaryPath));
    }
    LOGGER.log(INFO, "Connection ''{0}'' created in {1}", name, vault.storeFile());
  }

  /**
   * Decrypts a connection's credentials.
   *
   * @param name connection name
   * @return plaintext username and password with the resource id
   * @throws com.example.credentialvault.core.exceptions.MissingConnectionException if absent;
   *     the exception lists every valid name
   * @throws com.example.credentialvault.core.exceptions.AuthenticationException if the stored
   *     values do not decrypt on this machine
   */
  public ConnectionCredentials read(final String name) {
    final var stored = vault.storedFields(name);
    return new ConnectionCredentials(
        vault.decrypt(stored.getOrDefault(USERNAME, "")),
        vault.decrypt(stored.getOrDefault(PASSWORD, "")),
        stored.getOrDefault(RESOURCE_ID, ""));
  }

  /**
   * Decrypts only the username of a connection.
   *
   * @param name connection name
   * @return plaintext username
   */
  public String username(final String name) {
    return vault.decrypt(vault.storedField(name, USERNAME, ""));
  }

  /**
   * Decrypts only the password of a connection.
   *
   * @param name connection name
   * @return plaintext password
   */
  public String password(final String name) {
    return vault.decrypt(vault.storedField(name, PASSWORD, ""));
  }

  /**
   * Raw stored value of a connection field, without decryption.
   *
   * @param name connection name
   * @param key field key, e.g. {@code resource_id}
   * @param defaultValue returned if the connection or the field is absent
   * @return stored value or {@code defaultValue}
   */
  public String property(final String name, final String key, final String defaultValue) {
    synchronized (vault) {
      if (!vault.hasConnection(name)) {
        return defaultValue;
      }
      return vault.storedField(name, key, defaultValue);
    }
  }

  /**
   * Rewrites a connection, keeping the current value of every field the update leaves unset.
   * Username and password are re-encrypted with fresh salts either way.
   *
   * @param name connection name
   * @param changes fields to change
   * @throws com.example.credentialvault.core.exceptions.MissingConnectionException if absent
   */
  public void update(final String name, final ConnectionUpdate changes) {
    synchronized (vault) {
      final var current = read(name);
      final var currentAuxiliary = vault.storedField(name, AUXILIARY_PATH, "");
      vault.writeFields(
          name,
          fields(
              changes.username().orElse(current.username()),
              changes.password().orElse(current.password()),
              changes.resourceId().orElse(current.resourceId()),
              changes.auxiliaryPath().orElse(currentAuxiliary)));
    }
    LOGGER.log(INFO, "Connection ''{0}'' updated in {1}", name, vault.storeFile());
  }

  /**
   * Removes a connection. Deleting a name that does not exist only logs a warning.
   *
   * @param name connection name
   * @return true if a connection was removed
   */
  public boolean delete(final String name) {
    final var deleted = vault.deleteConnection(name);
    if (deleted) {
      LOGGER.log(INFO, "Connection ''{0}'' deleted from {1}", name, vault.storeFile());
    }
    return deleted;
  }

  /**
   * Lists every stored connection in store order.
   *
   * @param includeCredentials whether to decrypt username and password; when false nothing is
   *     decrypted and the system identity is not consulted
   * @return one entry per connection
   */
  public List<ConnectionEntry> list(final boolean includeCredentials) {
    final var entries = new ArrayList<ConnectionEntry>();
    vault
        .storedConnections()
        .forEach(
            (name, stored) -> {
              final var resourceId = stored.getOrDefault(RESOURCE_ID, "");
              final var credentials =
                  includeCredentials
                      ? Optional.of(
                          new ConnectionCredentials(
                              vault.decrypt(stored.getOrDefault(USERNAME, "")),
                              vault.decrypt(stored.getOrDefault(PASSWORD, "")),
                              resourceId))
                      : Optional.<ConnectionCredentials>empty();
              entries.add(
                  new ConnectionEntry(
                      name, resourceId, stored.getOrDefault(AUXILIARY_PATH, ""), credentials));
            });
    return List.copyOf(entries);
  }

  /**
   * Writes connections to an archive with their credentials re-encrypted under {@code secret}, so
   * that another machine knowing the secret can import them.
   *
   * @param selector a connection name, or {@link ConnectionNames#WILDCARD} for every connection
   * @param archive archive path, see {@link ExportArchive}
   * @param secret export secret
   * @return the document written
   * @throws com.example.credentialvault.core.exceptions.MissingConnectionException if a single
   *     named connection is absent
   */
  public ExportDocument export(final String selector, final Path archive, final String secret) {
    final List<ExportedConnection> exported = new ArrayList<>();
    final String auxiliaryPath;
    synchronized (vault) {
      final var all = ConnectionNames.WILDCARD.equals(selector);
      final var names = all ? vault.connectionNames() : List.of(selector);
      for (final var name : names) {
        final var credentials = read(name);
        exported.add(
            new ExportedConnection(
                name,
                vault.encryptWithSecret(credentials.username(), secret),
                vault.encryptWithSecret(credentials.password(), secret),
                credentials.resourceId()));
      }
      auxiliaryPath = all ? "" : vault.storedField(selector, AUXILIARY_PATH, "");
    }
    final var document =
        new ExportDocument(
            new ExportHeader(
                resourceType().tag(),
                vault.projectIdentifier(),
                archive.getFileName().toString(),
                auxiliaryPath,
                LocalDateTime.now(clock).format(EXPORT_TIMESTAMP)),
            exported);
    ExportArchive.write(archive, document);
    LOGGER.log(INFO, "Exported {0} connection(s) to {1}", exported.size(), archive);
    return document;
  }

  /**
   * Loads connections from an export archive, re-encrypting them with the system identity.
   *
   * <p>Every record is decrypted before anything is written, so a wrong secret leaves the store
   * untouched.
   *
   * @param archive archive produced by {@link #export}
   * @param secret the export secret
   * @param overwrite whether existing connections of the same name are replaced
   * @return imported connection names in archive order
   * @throws IllegalArgumentException if the archive holds a different resource type
   * @throws DuplicateConnectionException if a name exists and {@code overwrite} is false
   * @throws com.example.credentialvault.core.exceptions.AuthenticationException if the secret
   *     is wrong or the archive is corrupted
   */
  public List<String> importArchive(
      final Path archive, final String secret, final boolean overwrite) {
    final var document = ExportArchive.read(archive);
    final var header = document.header();
    if (header != null && !resourceType().tag().equals(header.resourceType())) {
      throw new IllegalArgumentException(
          "Archive holds '"
              + header.resourceType()
              + "' connections, expected '"
              + resourceType().tag()
              + "'");
    }
    final var decrypted = new LinkedHashMap<String, ConnectionCredentials>();
    for (final var connection : document.connections()) {
      ConnectionNames.requireValid(connection.connectionName());
      decrypted.put(
          connection.connectionName(),
          new ConnectionCredentials(
              vault.decryptWithSecret(connection.username(), secret),
              vault.decryptWithSecret(connection.password(), secret),
              connection.resourceId()));
    }
    final var auxiliaryPath =
        header != null && decrypted.size() == 1
            ? Optional.ofNullable(header.auxiliaryPath()).orElse("")
            : "";
    synchronized (vault) {
      if (!overwrite) {
        for (final var name : decrypted.keySet()) {
          if (vault.hasConnection(name)) {
            throw new DuplicateConnectionException(name);
          }
        }
      }
      decrypted.forEach(
          (name, credentials) -> {
            LOGGER.log(DEBUG, "Importing connection ''{0}''", name);
            vault.writeFields(
                name,
                fields(
                    credentials.username(),
                    credentials.password(),
                    credentials.resourceId(),
                    auxiliaryPath));
          });
    }
    LOGGER.log(INFO, "Imported {0} connection(s) from {1}", decrypted.size(), archive);
    return List.copyOf(decrypted.keySet());
  }

  private Map<String, String> fields(
      final String username,
      final String password,
      final String resourceId,
      final String auxiliaryPath) {
    requireStorable(RESOURCE_ID, resourceId);
    requireStorable(AUXILIARY_PATH, auxiliaryPath);
    final var fields = new LinkedHashMap<String, String>();
    fields.put(USERNAME, vault.encrypt(username));
    fields.put(PASSWORD, vault.encrypt(password));
    fields.put(RESOURCE_ID, Optional.ofNullable(resourceId).orElse(""));
    if (resourceType().supportsAuxiliaryPath()) {
      fields.put(AUXILIARY_PATH, Optional.ofNullable(auxiliaryPath).orElse(""));
    }
    return fields;
  }

  // Stored values are single lines of the store file, read back stripped.
  private static void requireStorable(final String field, final String value) {
    if (value == null) {
      return;
    }
    if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
      throw new IllegalArgumentException(field + " must not contain line breaks");
    }
    if (!value.equals(value.strip())) {
      throw new IllegalArgumentException(field + " must not start or end with whitespace");
    }
  }
}
