package com.example.credentialvault.core.vault;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialvault.core.store.ResourceType;
import java.lang.System.Logger;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one shared {@link Vault} per (project identifier, resource type) pair.
 *
 * <p>Creating a vault touches the filesystem, and the decryption cache is only useful if every
 * caller on the same store goes through the same instance. Create one registry per process and
 * pass it to everything that needs a vault.
 */
public final class VaultRegistry {

  private static final Logger LOGGER = System.getLogger(VaultRegistry.class.getName());

  private final ConcurrentHashMap<VaultKey, Vault> vaults = new ConcurrentHashMap<>();
  private final VaultSettings settings;

  /** Creates a registry using {@link VaultSettings#defaults()}. */
  public VaultRegistry() {
    this(VaultSettings.defaults());
  }

  public VaultRegistry(final VaultSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public VaultSettings settings() {
    return settings;
  }

  /**
   * Returns the vault for the pair, creating it and its store file on first use.
   *
   * @param projectIdentifier project identifier, sanitized into a directory name
   * @param resourceType store partition
   * @return the shared vault
   * @throws com.example.credentialvault.core.exceptions.InvalidNameException if the identifier
   *     sanitizes to nothing; nothing is registered in that case
   */
  public Vault getVault(final String projectIdentifier, final ResourceType resourceType) {
    return vaults.computeIfAbsent(
        new VaultKey(projectIdentifier, resourceType),
        key -> {
          LOGGER.log(DEBUG, "Opening vault for {0}/{1}", key.projectIdentifier(), key.type().tag());
          return new Vault(key.projectIdentifier(), key.type(), settings);
        });
  }

  public int size() {
    return vaults.size();
  }

  private record VaultKey(String projectIdentifier, ResourceType type) {
    VaultKey {
      Objects.requireNonNull(type, "resourceType");
    }
  }
}
