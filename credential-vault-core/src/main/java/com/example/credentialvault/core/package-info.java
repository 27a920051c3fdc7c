/**
 * Root package for the credential-vault library.
 *
 * <p>Named connection credentials (username, password, a DSN or URL and an optional wallet path)
 * are kept in a file under {@code ~/.<project>/}, with username and password encrypted under a key
 * derived from the machine's own identifier. A store copied to another machine cannot be
 * decrypted there.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.credentialvault.core.identity.SystemIdentityResolver} – source of the
 *       machine identifier used as the default encryption secret.
 *   <li>{@link com.example.credentialvault.core.crypto.CredentialCipher} – PBKDF2-HMAC-SHA-256 key
 *       derivation and AES-256-GCM encryption of short strings.
 *   <li>{@link com.example.credentialvault.core.store.CredentialStore} – sectioned on-disk store,
 *       one section per connection.
 *   <li>{@link com.example.credentialvault.core.vault.VaultRegistry} – hands out one shared
 *       {@link com.example.credentialvault.core.vault.Vault} (store plus decryption cache) per
 *       project and resource type.
 *   <li>{@link com.example.credentialvault.core.connection.ConnectionManager} – create, read,
 *       update, delete, list, export and import of named connections.
 * </ul>
 */
package com.example.credentialvault.core;
