package com.example.credentialvault.core.store;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * INI-style text format: {@code [section]} headers followed by {@code key = value} lines. Blank
 * lines and lines starting with {@code #} or {@code ;} are ignored. Section and key order is kept.
 */
final class SectionedFile {

  private SectionedFile() {}

  static LinkedHashMap<String, LinkedHashMap<String, String>> parse(final List<String> lines)
      throws IOException {
    final var sections = new LinkedHashMap<String, LinkedHashMap<String, String>>();
    LinkedHashMap<String, String> current = null;
    for (var i = 0; i < lines.size(); i++) {
      final var line = lines.get(i).strip();
      if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
        continue;
      }
      if (line.startsWith("[") && line.endsWith("]")) {
        current =
            sections.computeIfAbsent(
                line.substring(1, line.length() - 1), name -> new LinkedHashMap<>());
        continue;
      }
      final var separator = line.indexOf('=');
      if (current == null || separator <= 0) {
        throw new IOException("Malformed line " + (i + 1) + " in credential store");
      }
      current.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
    }
    return sections;
  }

  static String render(final Map<String, ? extends Map<String, String>> sections) {
    final var out = new StringBuilder();
    sections.forEach(
        (name, fields) -> {
          out.append('[').append(name).append("]\n");
          fields.forEach((key, value) -> out.append(key).append(" = ").append(value).append('\n'));
          out.append('\n');
        });
    return out.toString();
  }
}
