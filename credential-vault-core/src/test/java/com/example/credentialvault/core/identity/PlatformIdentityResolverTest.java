package com.example.credentialvault.core.identity;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialvault.core.exceptions.UnsupportedPlatformException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class PlatformIdentityResolverTest {

  private static final String IOREG_OUTPUT =
      """
      +-o Root  <class IORegistryEntry, id 0x100000100, retain 30>
        +-o MacBookPro18,3  <class IOPlatformExpertDevice, id 0x100000110, registered>
            {
              "IOPlatformSerialNumber" = "C02XXXXXXX"
              "IOPlatformUUID" = "4C4C4544-0042-3510-8052-B4C04F4E3732"
            }
      """;

  @TempDir Path tempDir;

  @Nested
  @DisplayName("macOS")
  class Mac {

    @Test
    @DisplayName("Should extract IOPlatformUUID from ioreg output")
    void shouldExtractPlatformUuid() {
      final var commands = new ArrayList<List<String>>();
      final var resolver =
          new PlatformIdentityResolver(
              "Mac OS X",
              command -> {
                commands.add(command);
                return IOREG_OUTPUT;
              },
              List.of());

      assertEquals("4C4C4544-0042-3510-8052-B4C04F4E3732", resolver.systemIdentity());
      assertEquals(List.of(PlatformIdentityResolver.MAC_COMMAND), commands);
    }

    @Test
    @DisplayName("Should fail when ioreg output has no platform UUID")
    void shouldFailWithoutUuid() {
      final var resolver =
          new PlatformIdentityResolver("Mac OS X", command -> "nothing here", List.of());

      assertThrows(UnsupportedPlatformException.class, resolver::systemIdentity);
    }

    @Test
    @DisplayName("Should wrap command failures")
    void shouldWrapCommandFailure() {
      final var resolver =
          new PlatformIdentityResolver(
              "Mac OS X",
              command -> {
                throw new IOException("ioreg: not found");
              },
              List.of());

      final var e = assertThrows(UnsupportedPlatformException.class, resolver::systemIdentity);
      assertInstanceOf(IOException.class, e.getCause());
    }
  }

  @Nested
  @DisplayName("Windows")
  class Windows {

    @Test
    @DisplayName("Should trim the PowerShell UUID output")
    void shouldTrimOutput() {
      final var resolver =
          new PlatformIdentityResolver(
              "Windows 11", command -> "  03000200-0400-0500-0006-000700080009\r\n", List.of());

      assertEquals("03000200-0400-0500-0006-000700080009", resolver.systemIdentity());
    }

    @Test
    @DisplayName("Should reject blank output")
    void shouldRejectBlankOutput() {
      final var resolver = new PlatformIdentityResolver("Windows 10", command -> "\r\n", List.of());

      assertThrows(UnsupportedPlatformException.class, resolver::systemIdentity);
    }
  }

  @Nested
  @DisplayName("Linux")
  class Linux {

    @Test
    @DisplayName("Should read the first machine-id file")
    void shouldReadMachineId() throws IOException {
      final var machineId = Files.writeString(tempDir.resolve("machine-id"), "abc123\n");
      final var resolver =
          new PlatformIdentityResolver(
              "Linux",
              command -> fail("no command expected"),
              List.of(machineId, tempDir.resolve("other")));

      assertEquals("abc123", resolver.systemIdentity());
    }

    @Test
    @DisplayName("Should fall back when the first file is missing or empty")
    void shouldFallBack() throws IOException {
      final var empty = Files.writeString(tempDir.resolve("empty"), "\n");
      final var dbus = Files.writeString(tempDir.resolve("dbus-machine-id"), "from-dbus\n");
      final var resolver =
          new PlatformIdentityResolver(
              "Linux", command -> "", List.of(tempDir.resolve("missing"), empty, dbus));

      assertEquals("from-dbus", resolver.systemIdentity());
    }

    @Test
    @DisplayName("Should fail when no file is readable")
    void shouldFailWithoutFiles() {
      final var resolver =
          new PlatformIdentityResolver("Linux", command -> "", List.of(tempDir.resolve("none")));

      assertThrows(UnsupportedPlatformException.class, resolver::systemIdentity);
    }

    @Test
    @DisplayName("Should return the same value on every call")
    void shouldBeDeterministic() throws IOException {
      final var machineId = Files.writeString(tempDir.resolve("machine-id"), "stable-id");
      final var resolver = new PlatformIdentityResolver("Linux", command -> "", List.of(machineId));

      assertEquals(resolver.systemIdentity(), resolver.systemIdentity());
    }
  }

  @Test
  @DisplayName("Should reject unrecognised platforms")
  void shouldRejectUnknownPlatform() {
    final var resolver = new PlatformIdentityResolver("Plan 9", command -> "id", List.of());

    final var e = assertThrows(UnsupportedPlatformException.class, resolver::systemIdentity);
    assertTrue(e.getMessage().contains("Plan 9"));
  }

  @Test
  @DisplayName("Should detect platforms from os.name values")
  void shouldDetectPlatforms() {
    assertEquals(
        PlatformIdentityResolver.Platform.MAC,
        PlatformIdentityResolver.Platform.detect("Mac OS X").orElseThrow());
    assertEquals(
        PlatformIdentityResolver.Platform.WINDOWS,
        PlatformIdentityResolver.Platform.detect("Windows Server 2022").orElseThrow());
    assertEquals(
        PlatformIdentityResolver.Platform.LINUX,
        PlatformIdentityResolver.Platform.detect("Linux").orElseThrow());
    assertTrue(PlatformIdentityResolver.Platform.detect("SunOS").isEmpty());
    assertTrue(PlatformIdentityResolver.Platform.detect(null).isEmpty());
  }

  @Nested
  @DisplayName("Command execution")
  @EnabledOnOs({OS.LINUX, OS.MAC})
  class CommandExecution {

    @Test
    @DisplayName("Should return standard output of a successful command")
    void shouldReturnOutput() throws IOException {
      assertEquals("ok\n", PlatformIdentityResolver.execute(List.of("sh", "-c", "echo ok"), 10));
    }

    @Test
    @DisplayName("Should not stall on a command that floods standard error")
    void shouldDiscardStandardError() {
      final var command = List.of("sh", "-c", "head -c 1048576 /dev/zero >&2; echo ok");

      final var output =
          assertTimeout(
              Duration.ofSeconds(10), () -> PlatformIdentityResolver.execute(command, 10));

      assertEquals("ok\n", output);
    }

    @Test
    @DisplayName("Should give up on a command that outlives the timeout")
    void shouldTimeOut() {
      final var command = List.of("sh", "-c", "exec sleep 30");

      final IOException e =
          assertTimeout(
              Duration.ofSeconds(10),
              () ->
                  assertThrows(
                      IOException.class, () -> PlatformIdentityResolver.execute(command, 1)));

      assertTrue(e.getMessage().contains("Timed out"));
    }

    @Test
    @DisplayName("Should fail on a non-zero exit status")
    void shouldFailOnExitStatus() {
      final var e =
          assertThrows(
              IOException.class,
              () -> PlatformIdentityResolver.execute(List.of("sh", "-c", "exit 3"), 10));

      assertTrue(e.getMessage().contains("3"));
    }
  }
}
