package com.example.credentialvault.core.store;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialvault.core.exceptions.InvalidNameException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConnectionNamesTest {

  @ParameterizedTest
  @ValueSource(strings = {"db1", "Prod DB", "scott@orcl", "DB1"})
  void shouldAcceptUsableNames(final String name) {
    assertEquals(name, ConnectionNames.requireValid(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", " db1", "db1 ", "*", "[db1]", "a]b", "line\nbreak"})
  void shouldRejectNamesThatBreakTheStoreFormat(final String name) {
    assertThrows(InvalidNameException.class, () -> ConnectionNames.requireValid(name));
  }

  @Test
  void shouldRejectNull() {
    assertThrows(InvalidNameException.class, () -> ConnectionNames.requireValid(null));
  }
}
