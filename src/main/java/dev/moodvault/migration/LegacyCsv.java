/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal reader for the comma separated files written by the legacy bot.
 *
 * <p>Handles quoted fields with doubled quotes, CRLF line endings and a leading UTF-8 BOM. Blank
 * lines are ignored.
 */
final class LegacyCsv {

  private LegacyCsv() {}

  /** Parsed file: header row plus data rows. */
  record Table(List<String> header, List<List<String>> rows) {
    /** Index of {@code name} in the header (case-insensitive), or {@code -1}. */
    int column(String name) {
      for (int i = 0; i < header.size(); i++) {
        if (header.get(i).trim().toLowerCase(Locale.ROOT).equals(name)) {
          return i;
        }
      }
      return -1;
    }

    static String cell(List<String> row, int idx) {
      if (idx < 0 || idx >= row.size()) {
        return null;
      }
      String value = row.get(idx).trim();
      return value.isEmpty() ? null : value;
    }
  }

  static Table parse(String text) {
    String body = text.startsWith("\uFEFF") ? text.substring(1) : text;
    List<List<String>> records = new ArrayList<>();
    List<String> current = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean lineHasContent = false;

    for (int i = 0; i < body.length(); i++) {
      char ch = body.charAt(i);
      if (quoted) {
        if (ch == '"') {
          if (i + 1 < body.length() && body.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(ch);
        }
        continue;
      }
      switch (ch) {
        case '"' -> {
          quoted = true;
          lineHasContent = true;
        }
        case ',' -> {
          current.add(field.toString());
          field.setLength(0);
          lineHasContent = true;
        }
        case '\r' -> {
          // handled with the following \n
        }
        case '\n' -> {
          if (lineHasContent || field.length() > 0) {
            current.add(field.toString());
            records.add(current);
          }
          current = new ArrayList<>();
          field.setLength(0);
          lineHasContent = false;
        }
        default -> {
          field.append(ch);
          lineHasContent = true;
        }
      }
    }
    if (lineHasContent || field.length() > 0) {
      current.add(field.toString());
      records.add(current);
    }

    if (records.isEmpty()) {
      return new Table(List.of(), List.of());
    }
    return new Table(records.get(0), records.subList(1, records.size()));
  }
}
