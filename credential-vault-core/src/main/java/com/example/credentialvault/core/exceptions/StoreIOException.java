package com.example.credentialvault.core.exceptions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Filesystem failure while reading or writing a credential store or export archive. */
public class StoreIOException extends VaultException {

  private final Path path;

  public StoreIOException(final String message, final Path path, final IOException cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public StoreIOException(final String message, final Path path, final UncheckedIOException cause) {
    this(message, path, cause.getCause());
  }

  public Path path() {
    return path;
  }
}
