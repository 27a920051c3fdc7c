package com.example.credentialvault.core.crypto;

import com.example.credentialvault.core.exceptions.AuthenticationException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;

/**
 * Binary layout of an encrypted credential.
 *
 * <p>The encoded form is {@code base64(salt || nonce || tag || ciphertext)} with fixed widths of
 * 16, 12 and 16 bytes for the first three fields; the ciphertext may be empty.
 *
 * @param salt PBKDF2 salt
 * @param nonce AES-GCM nonce
 * @param tag AES-GCM authentication tag
 * @param ciphertext encrypted payload, same length as the plaintext bytes
 */
public record EncryptedBlob(byte[] salt, byte[] nonce, byte[] tag, byte[] ciphertext) {

  public static final int SALT_LENGTH = 16;
  public static final int NONCE_LENGTH = 12;
  public static final int TAG_LENGTH = 16;
  public static final int HEADER_LENGTH = SALT_LENGTH + NONCE_LENGTH + TAG_LENGTH;

  public EncryptedBlob {
    if (salt.length != SALT_LENGTH
        || nonce.length != NONCE_LENGTH
        || tag.length != TAG_LENGTH) {
      throw new IllegalArgumentException("Invalid salt, nonce or tag length");
    }
  }

  /**
   * Parses an encoded blob.
   *
   * @param encoded base64 text as stored on disk
   * @return the split fields
   * @throws AuthenticationException if the text is missing, is not base64 or is shorter than the
   *     fixed header
   */
  public static EncryptedBlob decode(final String encoded) {
    if (encoded == null) {
      throw new AuthenticationException("Encrypted credential is missing");
    }
    final byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(encoded.trim());
    } catch (final IllegalArgumentException e) {
      throw new AuthenticationException("Encrypted credential is not valid base64", e);
    }
    if (bytes.length < HEADER_LENGTH) {
      throw new AuthenticationException(
          "Encrypted credential is truncated: " + bytes.length + " bytes");
    }
    return new EncryptedBlob(
        Arrays.copyOfRange(bytes, 0, SALT_LENGTH),
        Arrays.copyOfRange(bytes, SALT_LENGTH, SALT_LENGTH + NONCE_LENGTH),
        Arrays.copyOfRange(bytes, SALT_LENGTH + NONCE_LENGTH, HEADER_LENGTH),
        Arrays.copyOfRange(bytes, HEADER_LENGTH, bytes.length));
  }

  /**
   * Encodes the fields in stored order.
   *
   * @return base64 text
   */
  public String encode() {
    final var buffer = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length);
    buffer.put(salt).put(nonce).put(tag).put(ciphertext);
    return Base64.getEncoder().encodeToString(buffer.array());
  }
}
