package com.example.credentialvault.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialvault.core.exceptions.AuthenticationException;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class EncryptedBlobTest {

  @Test
  void shouldSplitAtFixedOffsets() {
    final var bytes = new byte[46];
    for (var i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) i;
    }

    final var blob = EncryptedBlob.decode(Base64.getEncoder().encodeToString(bytes));

    assertEquals(0, blob.salt()[0]);
    assertEquals(15, blob.salt()[15]);
    assertEquals(16, blob.nonce()[0]);
    assertEquals(28, blob.tag()[0]);
    assertArrayEquals(new byte[] {44, 45}, blob.ciphertext());
    assertEquals(Base64.getEncoder().encodeToString(bytes), blob.encode());
  }

  @Test
  void shouldAcceptEmptyCiphertext() {
    final var encoded = Base64.getEncoder().encodeToString(new byte[EncryptedBlob.HEADER_LENGTH]);

    assertEquals(0, EncryptedBlob.decode(encoded).ciphertext().length);
  }

  @Test
  void shouldTreatMissingTextAsMalformed() {
    assertThrows(AuthenticationException.class, () -> EncryptedBlob.decode(null));
  }

  @Test
  void shouldRejectWrongFieldWidths() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new EncryptedBlob(new byte[15], new byte[12], new byte[16], new byte[0]));
  }
}
