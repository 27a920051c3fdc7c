package com.example.credentialvault.core.vault;

import static java.lang.System.Logger.Level.DEBUG;

import java.lang.System.Logger;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Memoizes decrypted credentials by their exact encoded blob.
 *
 * <p>Key derivation is slow, so listing or reading many connections would otherwise
 * pay for one derivation per field on every call. A blob never changes in place: an update writes
 * a new blob, and the owner evicts the old one.
 *
 * <p>Only the owning {@link Vault} fills or evicts entries; other callers can inspect it.
 */
public final class DecryptionCache {

  private static final Logger LOGGER = System.getLogger(DecryptionCache.class.getName());

  private final ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();

  /**
   * Returns the cached plaintext for {@code blob}, decrypting and caching it on a miss. A failed
   * decryption leaves the cache unchanged.
   *
   * @param blob encoded ciphertext
   * @param decryptor decrypts the blob on a cache miss
   * @return plaintext
   */
  String getOrDecrypt(final String blob, final UnaryOperator<String> decryptor) {
    return Optional.ofNullable(entries.get(blob))
        .map(
            hit -> {
              LOGGER.log(DEBUG, "Decryption cache hit");
              return hit;
            })
        .orElseGet(
            () -> {
              LOGGER.log(DEBUG, "Decryption cache miss");
              final var plaintext = decryptor.apply(blob);
              entries.put(blob, plaintext);
              return plaintext;
            });
  }

  /** Records a plaintext already known for {@code blob}, e.g. right after encrypting it. */
  void put(final String blob, final String plaintext) {
    entries.put(blob, plaintext);
  }

  void evict(final String blob) {
    entries.remove(blob);
  }

  public boolean contains(final String blob) {
    return entries.containsKey(blob);
  }

  public int size() {
    return entries.size();
  }
}
