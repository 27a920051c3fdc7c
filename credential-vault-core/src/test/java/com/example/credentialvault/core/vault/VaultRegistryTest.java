package com.example.credentialvault.core.vault;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialvault.core.crypto.CredentialCipher;
import com.example.credentialvault.core.crypto.KeyDeriver;
import com.example.credentialvault.core.crypto.Pbkdf2KeyDeriver;
import com.example.credentialvault.core.exceptions.InvalidNameException;
import com.example.credentialvault.core.store.ResourceType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VaultRegistryTest {

  private static final String IDENTITY = "test-machine-id";

  @TempDir Path home;

  private final AtomicInteger derivations = new AtomicInteger();
  private VaultRegistry registry;

  @BeforeEach
  void setUp() {
    final var pbkdf2 = new Pbkdf2KeyDeriver();
    final KeyDeriver counting =
        (secret, salt) -> {
          derivations.incrementAndGet();
          return pbkdf2.deriveKey(secret, salt);
        };
    registry =
        new VaultRegistry(
            VaultSettings.builder()
                .homeDirectory(home)
                .identityResolver(() -> IDENTITY)
                .cipher(new CredentialCipher(counting))
                .build());
  }

  @Test
  @DisplayName("Should return one instance per project and resource type")
  void shouldShareInstances() {
    final var first = registry.getVault("orac", ResourceType.DSN);

    assertSame(first, registry.getVault("orac", ResourceType.DSN));
    assertSame(first.cache(), registry.getVault("orac", ResourceType.DSN).cache());
    assertNotSame(first, registry.getVault("orac", ResourceType.URL));
    assertEquals(2, registry.size());
  }

  @Test
  @DisplayName("Should hand out a single instance under concurrent first use")
  void shouldShareInstancesAcrossThreads() throws Exception {
    final var executor = Executors.newFixedThreadPool(8);
    try {
      final Callable<Vault> lookup = () -> registry.getVault("orac", ResourceType.DSN);
      final var futures =
          executor.invokeAll(IntStream.range(0, 16).mapToObj(i -> lookup).toList());
      final var expected = futures.get(0).get();
      for (final var future : futures) {
        assertSame(expected, future.get());
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should create the store file on first use")
  void shouldCreateStoreFile() {
    final var vault = registry.getVault("my:project", ResourceType.URL);

    assertEquals(home.resolve(".myproject").resolve("url_credentials.ini"), vault.storeFile());
    assertTrue(Files.isRegularFile(vault.storeFile()));
  }

  @Test
  @DisplayName("Should derive a key only once for repeated decryptions of the same blob")
  void shouldCacheDecryption() {
    final var blob = new CredentialCipher().encryptWithSecret("s3cret", IDENTITY);
    final var vault = registry.getVault("orac", ResourceType.DSN);

    assertEquals("s3cret", vault.decrypt(blob));
    assertEquals("s3cret", registry.getVault("orac", ResourceType.DSN).decrypt(blob));
    assertEquals(1, derivations.get());
  }

  @Test
  @DisplayName("Should not register a vault for an invalid project identifier")
  void shouldRejectInvalidProject() {
    assertThrows(InvalidNameException.class, () -> registry.getVault(":*?", ResourceType.DSN));
    assertThrows(InvalidNameException.class, () -> registry.getVault(null, ResourceType.DSN));

    assertEquals(0, registry.size());
  }

  @Test
  void shouldRejectNullResourceType() {
    assertThrows(NullPointerException.class, () -> registry.getVault("orac", null));
  }
}
