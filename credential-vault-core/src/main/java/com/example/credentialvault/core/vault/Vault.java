package com.example.credentialvault.core.vault;

import com.example.credentialvault.core.crypto.CredentialCipher;
import com.example.credentialvault.core.identity.SystemIdentityResolver;
import com.example.credentialvault.core.store.CredentialStore;
import com.example.credentialvault.core.store.ProjectDirectories;
import com.example.credentialvault.core.store.ResourceType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The credential store of one (project, resource type) pair together with its decryption cache.
 *
 * <p>Obtain instances from {@link VaultRegistry} so that every caller working on the same store
 * shares one cache. All methods synchronize on the vault; callers performing a read-modify-write
 * sequence can hold the same monitor ({@code synchronized (vault) {...}}) to make it atomic
 * within the process.
 */
public final class Vault {

  private final String projectIdentifier;
  private final ResourceType resourceType;
  private final CredentialStore store;
  private final DecryptionCache cache = new DecryptionCache();
  private final CredentialCipher cipher;
  private final SystemIdentityResolver identityResolver;

  Vault(
      final String projectIdentifier,
      final ResourceType resourceType,
      final VaultSettings settings) {
    this.projectIdentifier = projectIdentifier;
    this.resourceType = resourceType;
    this.store =
        new CredentialStore(
            ProjectDirectories.storeFile(
                settings.homeDirectory(), projectIdentifier, resourceType));
    this.cipher = settings.cipher();
    this.identityResolver = settings.identityResolver();
    store.ensureStoreExists();
  }

  public String projectIdentifier() {
    return projectIdentifier;
  }

  public ResourceType resourceType() {
    return resourceType;
  }

  public Path storeFile() {
    return store.file();
  }

  public DecryptionCache cache() {
    return cache;
  }

  public synchronized boolean hasConnection(final String name) {
    return store.hasConnection(name);
  }

  public synchronized List<String> connectionNames() {
    return store.listConnectionNames();
  }

  /**
   * Stored (still encrypted) fields of a connection.
   *
   * @param name connection name
   * @return copy of the stored fields
   * @throws com.example.credentialvault.core.exceptions.MissingConnectionException if absent
   */
  public synchronized Map<String, String> storedFields(final String name) {
    return store.readConnection(name);
  }

  /**
   * Stored fields of every connection, read in one pass over the store file.
   *
   * @return connection name to stored fields, in store order
   */
  public synchronized Map<String, Map<String, String>> storedConnections() {
    return store.readAllConnections();
  }

  public synchronized String storedField(
      final String name, final String field, final String defaultValue) {
    return store.readField(name, field, defaultValue);
  }

  /**
   * Writes fields to a connection, creating it if needed. Cache entries of values being replaced
   * are evicted.
   *
   * @param name connection name
   * @param fields stored representation of each field
   */
  public synchronized void writeFields(final String name, final Map<String, String> fields) {
    if (store.hasConnection(name)) {
      final var previous = store.readConnection(name);
      fields.forEach(
          (key, value) -> {
            final var old = previous.get(key);
            if (old != null && !old.equals(value)) {
              cache.evict(old);
            }
          });
    }
    store.writeFields(name, fields);
  }

  /**
   * Removes a connection and forgets its cached plaintext.
   *
   * @param name connection name
   * @return false if there was no such connection
   */
  public synchronized boolean deleteConnection(final String name) {
    if (store.hasConnection(name)) {
      store.readConnection(name).values().forEach(cache::evict);
    }
    return store.deleteConnection(name);
  }

  /**
   * Encrypts with the system identity. The result is cached so that reading it back does not
   * derive the key again.
   *
   * @param plaintext value to protect
   * @return encoded blob
   */
  public synchronized String encrypt(final String plaintext) {
    final var blob = cipher.encryptWithIdentity(plaintext, identityResolver);
    cache.put(blob, plaintext);
    return blob;
  }

  /**
   * Decrypts a blob encrypted with the system identity, through the cache.
   *
   * @param blob encoded blob
   * @return plaintext
   * @throws com.example.credentialvault.core.exceptions.AuthenticationException if the blob
   *     does not authenticate on this machine
   */
  public synchronized String decrypt(final String blob) {
    return cache.getOrDecrypt(blob, b -> cipher.decryptWithIdentity(b, identityResolver));
  }

  /** Encrypts with an explicit secret, bypassing the cache. */
  public String encryptWithSecret(final String plaintext, final String secret) {
    return cipher.encryptWithSecret(plaintext, secret);
  }

  /** Decrypts with an explicit secret, bypassing the cache. */
  public String decryptWithSecret(final String blob, final String secret) {
    return cipher.decryptWithSecret(blob, secret);
  }

  @Override
  public String toString() {
    return "Vault[" + projectIdentifier + ", " + resourceType.tag() + ", " + store.file() + "]";
  }
}
