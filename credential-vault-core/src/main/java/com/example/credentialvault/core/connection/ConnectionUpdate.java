package com.example.credentialvault.core.connection;

import java.util.Optional;

/**
 * Changes to apply to an existing connection. Fields left unset keep their current value.
 *
 * <pre>{@code
 * manager.update("db1", ConnectionUpdate.builder().password("newpass").build());
 * }</pre>
 */
public final class ConnectionUpdate {

  private final String username;
  private final String password;
  private final String resourceId;
  private final String auxiliaryPath;

  private ConnectionUpdate(final Builder builder) {
    this.username = builder.username;
    this.password = builder.password;
    this.resourceId = builder.resourceId;
    this.auxiliaryPath = builder.auxiliaryPath;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> username() {
    return Optional.ofNullable(username);
  }

  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  public Optional<String> resourceId() {
    return Optional.ofNullable(resourceId);
  }

  public Optional<String> auxiliaryPath() {
    return Optional.ofNullable(auxiliaryPath);
  }

  /** Builder for {@link ConnectionUpdate}. */
  public static class Builder {
    private String username;
    private String password;
    private String resourceId;
    private String auxiliaryPath;

    private Builder() {}

    public Builder username(final String username) {
      this.username = username;
      return this;
    }

    public Builder password(final String password) {
      this.password = password;
      return this;
    }

    public Builder resourceId(final String resourceId) {
      this.resourceId = resourceId;
      return this;
    }

    /**
     * Sets the wallet path. Ignored for URL connections.
     *
     * @param auxiliaryPath new path, or an empty string to clear it
     * @return this builder
     */
    public Builder auxiliaryPath(final String auxiliaryPath) {
      this.auxiliaryPath = auxiliaryPath;
      return this;
    }

    public ConnectionUpdate build() {
      return new ConnectionUpdate(this);
    }
  }
}
