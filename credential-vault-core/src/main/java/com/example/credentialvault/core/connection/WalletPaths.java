package com.example.credentialvault.core.connection;

import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Validation of the wallet ZIP path stored as a DSN connection's auxiliary path. */
public final class WalletPaths {

  private static final Logger LOGGER = System.getLogger(WalletPaths.class.getName());

  private WalletPaths() {}

  /**
   * Expands a leading {@code ~}, makes the path absolute and checks that it names an existing
   * {@code .zip} file.
   *
   * @param rawPath path as typed by a user
   * @return the normalized absolute path, or empty if the input is blank or not a usable wallet
   */
  public static Optional<Path> validate(final String rawPath) {
    if (rawPath == null || rawPath.isBlank()) {
      return Optional.empty();
    }
    final Path wallet;
    try {
      wallet = expandHome(rawPath.strip()).toAbsolutePath().normalize();
    } catch (final InvalidPathException e) {
      LOGGER.log(WARNING, "Wallet path ''{0}'' is not a valid path", rawPath);
      return Optional.empty();
    }
    if (!Files.exists(wallet)) {
      LOGGER.log(WARNING, "Wallet path ''{0}'' does not exist", wallet);
      return Optional.empty();
    }
    if (!wallet.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip")) {
      LOGGER.log(WARNING, "Wallet path ''{0}'' is not a ZIP file", wallet);
      return Optional.empty();
    }
    return Optional.of(wallet);
  }

  private static Path expandHome(final String path) {
    if (path.equals("~")) {
      return Path.of(System.getProperty("user.home"));
    }
    if (path.startsWith("~/") || path.startsWith("~\\")) {
      return Path.of(System.getProperty("user.home"), path.substring(2));
    }
    return Path.of(path);
  }
}
