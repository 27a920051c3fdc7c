/**
 * Machine-bound credential vault.
 *
 * <p>Provides components for:
 *
 * <ul>
 *   <li>Resolving a stable identifier of the current machine
 *   <li>PBKDF2 key derivation and AES-256-GCM encryption of credentials
 *   <li>Sectioned on-disk credential stores, one per project and resource type
 *   <li>Shared vaults with a decryption cache
 *   <li>Connection lifecycle management and portable export archives
 * </ul>
 */
module com.example.credentialvault.core {
  requires com.fasterxml.jackson.databind;

  exports com.example.credentialvault.core.connection;
  exports com.example.credentialvault.core.crypto;
  exports com.example.credentialvault.core.exceptions;
  exports com.example.credentialvault.core.identity;
  exports com.example.credentialvault.core.store;
  exports com.example.credentialvault.core.vault;

  opens com.example.credentialvault.core.connection to
      com.fasterxml.jackson.databind;
}
