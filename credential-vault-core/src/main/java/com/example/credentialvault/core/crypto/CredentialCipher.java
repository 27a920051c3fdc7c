package com.example.credentialvault.core.crypto;

import com.example.credentialvault.core.exceptions.AuthenticationException;
import com.example.credentialvault.core.identity.SystemIdentityResolver;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM encryption of short strings under a key derived from a secret.
 *
 * <p>Every call draws a fresh salt and nonce, so encrypting the same plaintext twice never yields
 * the same blob. The secret is either supplied explicitly ({@link #encryptWithSecret}) or taken
 * from a {@link SystemIdentityResolver} ({@link #encryptWithIdentity}), which binds the blob to
 * the current machine.
 */
public final class CredentialCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int TAG_LENGTH_BITS = EncryptedBlob.TAG_LENGTH * 8;

  private final KeyDeriver keyDeriver;
  private final SecureRandom random;

  /** Creates a cipher using PBKDF2 key derivation. */
  public CredentialCipher() {
    this(new Pbkdf2KeyDeriver());
  }

  public CredentialCipher(final KeyDeriver keyDeriver) {
    this(keyDeriver, new SecureRandom());
  }

  public CredentialCipher(final KeyDeriver keyDeriver, final SecureRandom random) {
    this.keyDeriver = keyDeriver;
    this.random = random;
  }

  public String encryptWithIdentity(final String plaintext, final SystemIdentityResolver identity) {
    return encryptWithSecret(plaintext, identity.systemIdentity());
  }

  public String decryptWithIdentity(final String encoded, final SystemIdentityResolver identity) {
    return decryptWithSecret(encoded, identity.systemIdentity());
  }

  /**
   * Encrypts a string.
   *
   * @param plaintext value to protect
   * @param secret secret the key is derived from
   * @return encoded blob, see {@link EncryptedBlob}
   */
  public String encryptWithSecret(final String plaintext, final String secret) {
    final var salt = randomBytes(EncryptedBlob.SALT_LENGTH);
    final var nonce = randomBytes(EncryptedBlob.NONCE_LENGTH);
    final byte[] sealed;
    try {
      final var cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.ENCRYPT_MODE, key(secret, salt), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
      sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt credential", e);
    }
    // JCE appends the tag to the ciphertext; the stored layout puts it first.
    final var split = sealed.length - EncryptedBlob.TAG_LENGTH;
    return new EncryptedBlob(
            salt,
            nonce,
            Arrays.copyOfRange(sealed, split, sealed.length),
            Arrays.copyOfRange(sealed, 0, split))
        .encode();
  }

  /**
   * Decrypts and authenticates a blob produced by {@link #encryptWithSecret}.
   *
   * @param encoded encoded blob
   * @param secret secret the blob was encrypted with
   * @return the plaintext
   * @throws AuthenticationException if the blob is malformed or fails tag verification
   */
  public String decryptWithSecret(final String encoded, final String secret) {
    final var blob = EncryptedBlob.decode(encoded);
    final var sealed =
        ByteBuffer.allocate(blob.ciphertext().length + EncryptedBlob.TAG_LENGTH)
            .put(blob.ciphertext())
            .put(blob.tag())
            .array();
    final byte[] plain;
    try {
      final var cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE,
          key(secret, blob.salt()),
          new GCMParameterSpec(TAG_LENGTH_BITS, blob.nonce()));
      plain = cipher.doFinal(sealed);
    } catch (final AEADBadTagException e) {
      throw new AuthenticationException(
          "Credential failed authentication (wrong secret, different machine or corrupted data)",
          e);
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("Failed to decrypt credential", e);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plain))
          .toString();
    } catch (final CharacterCodingException e) {
      throw new AuthenticationException("Decrypted credential is not valid UTF-8", e);
    } finally {
      Arrays.fill(plain, (byte) 0);
    }
  }

  private SecretKeySpec key(final String secret, final byte[] salt) {
    final var derived = keyDeriver.deriveKey(secret, salt);
    try {
      return new SecretKeySpec(derived, "AES");
    } finally {
      Arrays.fill(derived, (byte) 0);
    }
  }

  private byte[] randomBytes(final int length) {
    final var bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
