package com.example.credentialvault.core.identity;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialvault.core.exceptions.UnsupportedPlatformException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * {@link SystemIdentityResolver} that reads the identifier each operating system exposes for the
 * machine it runs on.
 *
 * <ul>
 *   <li>macOS: {@code IOPlatformUUID} reported by {@code ioreg -d2 -c IOPlatformExpertDevice}
 *   <li>Windows: {@code Win32_ComputerSystemProduct.UUID} queried through PowerShell
 *   <li>Linux: {@code /etc/machine-id}, falling back to {@code /var/lib/dbus/machine-id}
 * </ul>
 *
 * <p>The identifier is looked up again on every call; nothing is cached.
 */
public final class PlatformIdentityResolver implements SystemIdentityResolver {

  private static final Logger LOGGER = System.getLogger(PlatformIdentityResolver.class.getName());

  static final List<String> MAC_COMMAND = List.of("ioreg", "-d2", "-c", "IOPlatformExpertDevice");
  static final List<String> WINDOWS_COMMAND =
      List.of(
          "powershell", "-NoProfile", "(Get-CimInstance -Class Win32_ComputerSystemProduct).UUID");
  static final List<Path> LINUX_MACHINE_ID_FILES =
      List.of(Path.of("/etc/machine-id"), Path.of("/var/lib/dbus/machine-id"));

  private static final Pattern IOREG_UUID =
      Pattern.compile("\"IOPlatformUUID\"\\s*=\\s*\"([^\"]+)\"");
  private static final long COMMAND_TIMEOUT_SECONDS = 10L;

  private final String osName;
  private final CommandRunner commandRunner;
  private final List<Path> machineIdFiles;

  /** Creates a resolver for the running JVM's operating system. */
  public PlatformIdentityResolver() {
    this(
        System.getProperty("os.name", ""),
        PlatformIdentityResolver::execute,
        LINUX_MACHINE_ID_FILES);
  }

  PlatformIdentityResolver(
      final String osName, final CommandRunner commandRunner, final List<Path> machineIdFiles) {
    this.osName = osName;
    this.commandRunner = commandRunner;
    this.machineIdFiles = List.copyOf(machineIdFiles);
  }

  @Override
  public String systemIdentity() {
    final var platform =
        Platform.detect(osName)
            .orElseThrow(
                () -> new UnsupportedPlatformException("Unsupported platform: '" + osName + "'"));
    LOGGER.log(DEBUG, "Resolving system identity for platform {0}", platform);
    final var identity =
        switch (platform) {
          case MAC -> macIdentity();
          case WINDOWS -> commandOutput(WINDOWS_COMMAND).trim();
          case LINUX -> linuxIdentity();
        };
    if (identity.isBlank()) {
      throw new UnsupportedPlatformException(
          "Platform " + platform + " reported an empty system identity");
    }
    return identity;
  }

  private String macIdentity() {
    final var matcher = IOREG_UUID.matcher(commandOutput(MAC_COMMAND));
    if (!matcher.find()) {
      throw new UnsupportedPlatformException("IOPlatformUUID not found in ioreg output");
    }
    return matcher.group(1).trim();
  }

  private String linuxIdentity() {
    for (final var file : machineIdFiles) {
      final var value = readMachineId(file);
      if (value.isPresent()) {
        LOGGER.log(DEBUG, "System identity read from {0}", file);
        return value.get();
      }
    }
    throw new UnsupportedPlatformException("No readable machine-id file in " + machineIdFiles);
  }

  private static Optional<String> readMachineId(final Path file) {
    if (!Files.isReadable(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(file, StandardCharsets.UTF_8).trim())
          .filter(value -> !value.isEmpty());
    } catch (final IOException e) {
      LOGGER.log(DEBUG, "Unable to read machine-id file {0}: {1}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private String commandOutput(final List<String> command) {
    try {
      return commandRunner.run(command);
    } catch (final IOException e) {
      throw new UnsupportedPlatformException(
          "Failed to run '" + String.join(" ", command) + "'", e);
    }
  }

  private static String execute(final List<String> command) throws IOException {
    return execute(command, COMMAND_TIMEOUT_SECONDS);
  }

  static String execute(final List<String> command, final long timeoutSeconds)
      throws IOException {
    final var process =
        new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
    // Read stdout concurrently with waitFor.
    final var output = CompletableFuture.supplyAsync(() -> readOutput(process));
    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException("Timed out after " + timeoutSeconds + "s");
      }
      if (process.exitValue() != 0) {
        throw new IOException("Exited with status " + process.exitValue());
      }
      return output.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new IOException("Interrupted while waiting for command", e);
    } catch (final ExecutionException | TimeoutException e) {
      process.destroyForcibly();
      throw new IOException("Failed to read command output", e);
    }
  }

  private static String readOutput(final Process process) {
    try (final var stdout = process.getInputStream()) {
      return new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Runs an operating system command and returns its standard output. */
  @FunctionalInterface
  interface CommandRunner {
    String run(final List<String> command) throws IOException;
  }

  enum Platform {
    MAC,
    WINDOWS,
    LINUX;

    static Optional<Platform> detect(final String osName) {
      final var name = Optional.ofNullable(osName).orElse("").toLowerCase(Locale.ROOT);
      if (name.startsWith("mac") || name.contains("darwin")) {
        return Optional.of(MAC);
      }
      if (name.startsWith("windows")) {
        return Optional.of(WINDOWS);
      }
      if (name.contains("linux")) {
        return Optional.of(LINUX);
      }
      return Optional.empty();
    }
  }
}
