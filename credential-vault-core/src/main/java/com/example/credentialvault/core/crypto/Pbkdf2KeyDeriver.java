package com.example.credentialvault.core.crypto;

import java.security.GeneralSecurityException;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * PBKDF2-HMAC-SHA-256 key derivation producing 256-bit keys.
 *
 * <p>The iteration count is part of the stored format: changing it makes every existing blob
 * undecryptable.
 */
public final class Pbkdf2KeyDeriver implements KeyDeriver {

  public static final String ALGORITHM = "PBKDF2WithHmacSHA256";
  public static final int ITERATIONS = 100_000;
  public static final int KEY_LENGTH_BITS = 256;

  @Override
  public byte[] deriveKey(final String secret, final byte[] salt) {
    final var spec = new PBEKeySpec(secret.toCharArray(), salt, ITERATIONS, KEY_LENGTH_BITS);
    try {
      return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("Failed to derive key with " + ALGORITHM, e);
    } finally {
      spec.clearPassword();
    }
  }
}
