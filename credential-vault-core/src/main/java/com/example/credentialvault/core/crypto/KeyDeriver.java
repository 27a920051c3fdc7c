package com.example.credentialvault.core.crypto;

/** Stretches a secret and a salt into a symmetric key. */
@FunctionalInterface
public interface KeyDeriver {

  /**
   * Derives key material for the given secret and salt.
   *
   * @param secret password-like secret, typically the system identity
   * @param salt random salt stored alongside the ciphertext
   * @return raw key bytes
   */
  byte[] deriveKey(final String secret, final byte[] salt);
}
