package com.example.credentialvault.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialvault.core.exceptions.AuthenticationException;
import com.example.credentialvault.core.exceptions.UnsupportedPlatformException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CredentialCipherTest {

  private static final String SECRET = "machine-1234";

  private final CredentialCipher cipher = new CredentialCipher();

  @Nested
  @DisplayName("Round trip")
  class RoundTrip {

    @ParameterizedTest
    @ValueSource(strings = {"s3cret", "", "pässwörd ✓", "longer value with = and ; chars"})
    @DisplayName("Should decrypt what was encrypted with the same secret")
    void shouldRoundTrip(final String plaintext) {
      final var blob = cipher.encryptWithSecret(plaintext, SECRET);

      assertEquals(plaintext, cipher.decryptWithSecret(blob, SECRET));
    }

    @Test
    @DisplayName("Should use the identity resolver as the secret")
    void shouldUseIdentity() {
      final var blob = cipher.encryptWithIdentity("alice", () -> SECRET);

      assertEquals("alice", cipher.decryptWithSecret(blob, SECRET));
      assertEquals("alice", cipher.decryptWithIdentity(blob, () -> SECRET));
    }

    @Test
    @DisplayName("Should propagate identity failures")
    void shouldPropagateIdentityFailure() {
      assertThrows(
          UnsupportedPlatformException.class,
          () ->
              cipher.encryptWithIdentity(
                  "alice",
                  () -> {
                    throw new UnsupportedPlatformException("no identity");
                  }));
    }
  }

  @Nested
  @DisplayName("Encoded layout")
  class Layout {

    @Test
    @DisplayName("Should encode salt, nonce and tag ahead of a ciphertext as long as the input")
    void shouldUseFixedLayout() {
      final var plaintext = "host:1521/orcl";
      final var bytes = Base64.getDecoder().decode(cipher.encryptWithSecret(plaintext, SECRET));

      assertEquals(
          16 + 12 + 16 + plaintext.getBytes(StandardCharsets.UTF_8).length, bytes.length);
    }

    @Test
    @DisplayName("Should produce a different blob on every call")
    void shouldBeNonDeterministic() {
      final var first = EncryptedBlob.decode(cipher.encryptWithSecret("same", SECRET));
      final var second = EncryptedBlob.decode(cipher.encryptWithSecret("same", SECRET));

      assertNotEquals(first.encode(), second.encode());
      assertFalse(Arrays.equals(first.salt(), second.salt()));
      assertFalse(Arrays.equals(first.nonce(), second.nonce()));
    }

    @Test
    @DisplayName("Should derive exactly one key per encryption and per decryption")
    void shouldDeriveOncePerCall() {
      final var derivations = new AtomicInteger();
      final var pbkdf2 = new Pbkdf2KeyDeriver();
      final var counting =
          new CredentialCipher(
              (secret, salt) -> {
                derivations.incrementAndGet();
                return pbkdf2.deriveKey(secret, salt);
              });

      final var blob = counting.encryptWithSecret("x", SECRET);
      counting.decryptWithSecret(blob, SECRET);

      assertEquals(2, derivations.get());
    }
  }

  @Nested
  @DisplayName("Authentication failures")
  class Failures {

    @Test
    @DisplayName("Should reject a different secret")
    void shouldRejectWrongSecret() {
      final var blob = cipher.encryptWithSecret("s3cret", SECRET);

      assertThrows(AuthenticationException.class, () -> cipher.decryptWithSecret(blob, "other"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 20, 30, 43, 44, 49})
    @DisplayName("Should reject a blob with any flipped byte")
    void shouldRejectTamperedByte(final int offset) {
      final var bytes = Base64.getDecoder().decode(cipher.encryptWithSecret("s3cret", SECRET));
      bytes[offset] ^= 0x01;
      final var tampered = Base64.getEncoder().encodeToString(bytes);

      assertThrows(
          AuthenticationException.class, () -> cipher.decryptWithSecret(tampered, SECRET));
    }

    @Test
    @DisplayName("Should reject text that is not base64")
    void shouldRejectInvalidBase64() {
      assertThrows(
          AuthenticationException.class, () -> cipher.decryptWithSecret("not base64 !!", SECRET));
    }

    @Test
    @DisplayName("Should reject blobs shorter than the fixed header")
    void shouldRejectTruncatedBlob() {
      final var shortBlob = Base64.getEncoder().encodeToString(new byte[43]);

      assertThrows(
          AuthenticationException.class, () -> cipher.decryptWithSecret(shortBlob, SECRET));
      assertThrows(AuthenticationException.class, () -> cipher.decryptWithSecret("", SECRET));
    }
  }
}
