package com.example.credentialvault.core.vault;

import com.example.credentialvault.core.crypto.CredentialCipher;
import com.example.credentialvault.core.identity.PlatformIdentityResolver;
import com.example.credentialvault.core.identity.SystemIdentityResolver;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings shared by every {@link Vault} a {@link VaultRegistry} creates.
 *
 * <p>The home directory under which project directories are created is resolved from, in order:
 *
 * <ul>
 *   <li>system property {@code credential.vault.home}
 *   <li>environment variable {@code CREDENTIAL_VAULT_HOME}
 *   <li>system property {@code user.home}
 * </ul>
 *
 * <pre>{@code
 * var settings = VaultSettings.builder()
 *     .homeDirectory(Path.of("/tmp/vault-home"))
 *     .identityResolver(() -> "fixed-test-identity")
 *     .build();
 * }</pre>
 *
 * @param homeDirectory base directory for project directories
 * @param identityResolver default source of the encryption secret
 * @param cipher encryption codec
 */
public record VaultSettings(
    Path homeDirectory, SystemIdentityResolver identityResolver, CredentialCipher cipher) {

  public static final String HOME_PROPERTY = "credential.vault.home";
  public static final String HOME_ENV = "CREDENTIAL_VAULT_HOME";

  public VaultSettings {
    Objects.requireNonNull(homeDirectory, "homeDirectory");
    Objects.requireNonNull(identityResolver, "identityResolver");
    Objects.requireNonNull(cipher, "cipher");
  }

  /**
   * Settings with every value at its default.
   *
   * @return default settings
   */
  public static VaultSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  static Path resolveHomeDirectory() {
    return resolveHomeDirectory(System::getProperty, System::getenv);
  }

  static Path resolveHomeDirectory(
      final Function<String, String> properties, final Function<String, String> environment) {
    return nonBlank(properties.apply(HOME_PROPERTY))
        .or(() -> nonBlank(environment.apply(HOME_ENV)))
        .or(() -> nonBlank(properties.apply("user.home")))
        .map(Path::of)
        .orElseThrow(() -> new IllegalStateException("Unable to determine home directory"));
  }

  private static Optional<String> nonBlank(final String value) {
    return Optional.ofNullable(value).filter(v -> !v.isBlank()).map(String::trim);
  }

  /** Fluent builder for {@link VaultSettings}; unset values take their defaults. */
  public static class Builder {
    private Path homeDirectory;
    private SystemIdentityResolver identityResolver;
    private CredentialCipher cipher;

    private Builder() {}

    /**
     * Overrides the home directory.
     *
     * @param homeDirectory base directory for project directories
     * @return this builder
     */
    public Builder homeDirectory(final Path homeDirectory) {
      this.homeDirectory = homeDirectory;
      return this;
    }

    /**
     * Overrides the identity source.
     *
     * <p>Default: {@link PlatformIdentityResolver}
     *
     * @param identityResolver resolver used as the default encryption secret
     * @return this builder
     */
    public Builder identityResolver(final SystemIdentityResolver identityResolver) {
      this.identityResolver = identityResolver;
      return this;
    }

    /**
     * Overrides the cipher, e.g. to observe key derivations.
     *
     * @param cipher encryption codec
     * @return this builder
     */
    public Builder cipher(final CredentialCipher cipher) {
      this.cipher = cipher;
      return this;
    }

    public VaultSettings build() {
      return new VaultSettings(
          Optional.ofNullable(homeDirectory).orElseGet(VaultSettings::resolveHomeDirectory),
          Optional.ofNullable(identityResolver).orElseGet(PlatformIdentityResolver::new),
          Optional.ofNullable(cipher).orElseGet(CredentialCipher::new));
    }
  }
}
