/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plaintext layout of encrypted payloads.
 *
 * <p>A stored entry is {@code {"v":1,"date":"2024-01-01","created_at":"...","fields":{...}}}.
 * Absent attributes are omitted. Attribute names outside the schema are dropped on decode.
 */
final class EntryCodec {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  private EntryCodec() {}

  static byte[] encode(Entry entry) {
    return toJson(entry, false).toString().getBytes(StandardCharsets.UTF_8);
  }

  static Entry decode(long owner, byte[] plaintext) {
    return fromJson(owner, parseObject(plaintext));
  }

  /** Encodes a sharing bundle, which also carries each entry's owner. */
  static byte[] encodeBundle(List<Entry> entries) {
    JsonObject root = new JsonObject();
    root.addProperty("v", EntryFields.SCHEMA_VERSION);
    JsonArray array = new JsonArray();
    for (Entry entry : entries) {
      array.add(toJson(entry, true));
    }
    root.add("entries", array);
    return root.toString().getBytes(StandardCharsets.UTF_8);
  }

  static List<Entry> decodeBundle(byte[] plaintext) {
    JsonObject root = parseObject(plaintext);
    checkVersion(root);
    JsonElement array = root.get("entries");
    if (array == null || !array.isJsonArray()) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "bundle has no entries array");
    }
    List<Entry> out = new ArrayList<>();
    for (JsonElement el : array.getAsJsonArray()) {
      if (!el.isJsonObject() || !el.getAsJsonObject().has("owner")) {
        throw new ValidationException(ErrorCode.INVALID_RECORD, "bundle entry is malformed");
      }
      JsonObject obj = el.getAsJsonObject();
      long owner;
      try {
        owner = obj.get("owner").getAsLong();
      } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
        throw new ValidationException(ErrorCode.INVALID_RECORD, "bundle entry owner is invalid", e);
      }
      out.add(fromJson(owner, obj));
    }
    return out;
  }

  private static JsonObject toJson(Entry entry, boolean withOwner) {
    JsonObject obj = new JsonObject();
    obj.addProperty("v", EntryFields.SCHEMA_VERSION);
    if (withOwner) {
      obj.addProperty("owner", entry.owner());
    }
    obj.addProperty("date", entry.date().toString());
    obj.addProperty("created_at", entry.createdAt().toString());
    JsonObject fields = new JsonObject();
    for (Map.Entry<String, String> e : entry.fields().toMap().entrySet()) {
      fields.addProperty(e.getKey(), e.getValue());
    }
    obj.add("fields", fields);
    return obj;
  }

  private static Entry fromJson(long owner, JsonObject obj) {
    checkVersion(obj);
    JsonElement rawDate = obj.get("date");
    if (rawDate == null || !rawDate.isJsonPrimitive()) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "payload has no date");
    }
    try {
      LocalDate date = LocalDate.parse(rawDate.getAsString());
      JsonElement rawCreated = obj.get("created_at");
      Instant createdAt =
          rawCreated != null && rawCreated.isJsonPrimitive()
              ? Instant.parse(rawCreated.getAsString())
              : date.atStartOfDay().toInstant(ZoneOffset.UTC);
      EntryFields.Builder builder = EntryFields.builder();
      JsonElement fields = obj.get("fields");
      if (fields != null && fields.isJsonObject()) {
        for (Map.Entry<String, JsonElement> e : fields.getAsJsonObject().entrySet()) {
          if (!EntryFields.NAMES.contains(e.getKey())) {
            LOG.debug("(moodvault) op=codec.decode dropping unknown field {}", e.getKey());
            continue;
          }
          JsonElement value = e.getValue();
          builder.set(e.getKey(), value.isJsonPrimitive() ? value.getAsString() : null);
        }
      }
      return new Entry(owner, date, builder.build(), createdAt);
    } catch (DateTimeException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "payload has an invalid date", e);
    }
  }

  private static void checkVersion(JsonObject obj) {
    JsonElement v = obj.get("v");
    int version;
    try {
      version = v != null && v.isJsonPrimitive() ? v.getAsInt() : 0;
    } catch (NumberFormatException e) {
      version = 0;
    }
    if (version < 1 || version > EntryFields.SCHEMA_VERSION) {
      throw new ValidationException(
          ErrorCode.INVALID_RECORD, "unsupported payload version " + version);
    }
  }

  private static JsonObject parseObject(byte[] plaintext) {
    try {
      JsonElement root = JsonParser.parseString(new String(plaintext, StandardCharsets.UTF_8));
      if (!root.isJsonObject()) {
        throw new ValidationException(ErrorCode.INVALID_RECORD, "payload is not an object");
      }
      return root.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "payload is not valid JSON", e);
    }
  }
}
