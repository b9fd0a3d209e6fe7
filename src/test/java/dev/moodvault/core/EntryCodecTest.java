/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class EntryCodecTest {
  private static final Instant CREATED = Instant.parse("2024-01-05T20:15:00Z");

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void encodeOmitsAbsentFieldsAndOwner() {
    Entry entry =
        new Entry(
            42L, LocalDate.of(2024, 1, 5), EntryFields.builder().mood("7").build(), CREATED);

    JsonObject json =
        JsonParser.parseString(new String(EntryCodec.encode(entry), StandardCharsets.UTF_8))
            .getAsJsonObject();

    assertEquals(1, json.get("v").getAsInt());
    assertEquals("2024-01-05", json.get("date").getAsString());
    assertFalse(json.has("owner"));
    assertEquals(1, json.getAsJsonObject("fields").size());
    assertEquals(entry, EntryCodec.decode(42L, EntryCodec.encode(entry)));
  }

  @Test
  void decodeDropsUnknownFieldsAndDefaultsCreatedAt() {
    String payload =
        "{\"v\":1,\"date\":\"2024-02-01\",\"fields\":{\"mood\":\"3\",\"weather\":\"x\"}}";
    Entry decoded = EntryCodec.decode(7L, utf8(payload));

    assertEquals("3", decoded.fields().mood());
    assertEquals(Instant.parse("2024-02-01T00:00:00Z"), decoded.createdAt());
    assertNull(decoded.fields().comment());
  }

  @Test
  void unsupportedVersionOrBrokenPayloadIsInvalidRecord() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> EntryCodec.decode(1L, utf8("{\"v\":2,\"date\":\"2024-02-01\"}")));
    assertEquals(ErrorCode.INVALID_RECORD, e.errorCode());

    assertThrows(ValidationException.class, () -> EntryCodec.decode(1L, utf8("[]")));
    assertThrows(ValidationException.class, () -> EntryCodec.decode(1L, utf8("{oops")));
    assertThrows(
        ValidationException.class,
        () -> EntryCodec.decode(1L, utf8("{\"v\":1,\"date\":\"2024-13-40\"}")));
  }

  @Test
  void bundlesCarryOwners() {
    List<Entry> entries =
        List.of(
            new Entry(
                1L, LocalDate.of(2024, 1, 1), EntryFields.builder().sleep("6").build(), CREATED),
            new Entry(2L, LocalDate.of(2024, 1, 2), EntryFields.EMPTY, CREATED));

    assertEquals(entries, EntryCodec.decodeBundle(EntryCodec.encodeBundle(entries)));
    assertThrows(
        ValidationException.class,
        () -> EntryCodec.decodeBundle(utf8("{\"v\":1,\"entries\":[{\"date\":\"2024-01-01\"}]}")));
    assertThrows(ValidationException.class, () -> EntryCodec.decodeBundle(utf8("{\"v\":1}")));
  }
}
