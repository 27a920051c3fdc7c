package com.example.credentialvault.core.identity;

/**
 * Source of the machine identifier that encrypts stored credentials by default.
 *
 * <p>Implementations must return the same value every time they are called on the same machine
 * and must read a hardware or firmware backed identifier rather than any value assigned by
 * software at install time. The result is never persisted.
 */
@FunctionalInterface
public interface SystemIdentityResolver {

  /**
   * Resolves the identifier of the current machine.
   *
   * @return stable, non-blank machine identifier
   * @throws com.example.credentialvault.core.exceptions.UnsupportedPlatformException if the host
   *     platform is not recognised or exposes no identifier
   */
  String systemIdentity();
}
