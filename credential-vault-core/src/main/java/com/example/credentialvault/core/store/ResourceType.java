package com.example.credentialvault.core.store;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of resource a credential store holds. Each type is kept in its own file so that database
 * and web credentials never share a namespace.
 */
public enum ResourceType {
  /** Database connect descriptor (DSN / TNS alias). Supports an auxiliary wallet path. */
  DSN("dsn"),
  /** Web application URL. */
  URL("url");

  private final String tag;

  ResourceType(final String tag) {
    this.tag = tag;
  }

  /**
   * Lower-case tag used in file names and export headers.
   *
   * @return the tag, e.g. {@code "dsn"}
   */
  public String tag() {
    return tag;
  }

  /**
   * Whether connections of this type carry an {@code auxiliary_path} entry.
   *
   * @return true only for {@link #DSN}
   */
  public boolean supportsAuxiliaryPath() {
    return this == DSN;
  }

  /**
   * Parses a tag case-insensitively.
   *
   * @param tag {@code "dsn"} or {@code "url"}
   * @return matching type
   * @throws IllegalArgumentException for any other value
   */
  public static ResourceType fromTag(final String tag) {
    return Arrays.stream(values())
        .filter(type -> type.tag.equals(tag == null ? null : tag.trim().toLowerCase(Locale.ROOT)))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + tag));
  }
}
