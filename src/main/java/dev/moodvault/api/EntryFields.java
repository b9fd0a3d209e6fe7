/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed, versioned attribute set of one diary entry.
 *
 * <p>Every attribute is optional and string-typed. The set of names is closed: changing it means
 * bumping {@link #SCHEMA_VERSION} so stored payloads can be told apart and migrated.
 *
 * @param mood overall mood score
 * @param sleep sleep quality score
 * @param comment free-form note
 * @param balance emotional balance score
 * @param mania mania score
 * @param depression depression score
 * @param anxiety anxiety score
 * @param irritability irritability score
 * @param productivity productivity score
 * @param sociability sociability score
 */
public record EntryFields(
    String mood,
    String sleep,
    String comment,
    String balance,
    String mania,
    String depression,
    String anxiety,
    String irritability,
    String productivity,
    String sociability) {

  /** Version written into every encrypted payload. */
  public static final int SCHEMA_VERSION = 1;

  /** Attribute names in schema order. */
  public static final List<String> NAMES =
      List.of(
          "mood",
          "sleep",
          "comment",
          "balance",
          "mania",
          "depression",
          "anxiety",
          "irritability",
          "productivity",
          "sociability");

  /** Entry with every attribute absent. */
  public static final EntryFields EMPTY = builder().build();

  /**
   * Starts an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds fields from a name → value mapping.
   *
   * @param values attribute values keyed by schema name; {@code null} values mean "absent"
   * @return parsed fields
   * @throws ValidationException if a key is not part of the schema
   */
  public static EntryFields fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Builder builder = builder();
    for (Map.Entry<String, String> e : values.entrySet()) {
      if (!NAMES.contains(e.getKey())) {
        throw new ValidationException(
            ErrorCode.UNKNOWN_FIELD, "unknown entry field: " + e.getKey());
      }
      builder.set(e.getKey(), e.getValue());
    }
    return builder.build();
  }

  /**
   * Returns the present attributes in schema order.
   *
   * @return ordered name → value map without absent attributes
   */
  public Map<String, String> toMap() {
    Map<String, String> out = new LinkedHashMap<>();
    for (String name : NAMES) {
      String value = get(name);
      if (value != null) {
        out.put(name, value);
      }
    }
    return out;
  }

  /**
   * Looks up one attribute by schema name.
   *
   * @param name schema name
   * @return value or {@code null} when absent
   * @throws ValidationException if {@code name} is not part of the schema
   */
  public String get(String name) {
    return switch (name) {
      case "mood" -> mood;
      case "sleep" -> sleep;
      case "comment" -> comment;
      case "balance" -> balance;
      case "mania" -> mania;
      case "depression" -> depression;
      case "anxiety" -> anxiety;
      case "irritability" -> irritability;
      case "productivity" -> productivity;
      case "sociability" -> sociability;
      default -> throw new ValidationException(
          ErrorCode.UNKNOWN_FIELD, "unknown entry field: " + name);
    };
  }

  /** Mutable builder for {@link EntryFields}. */
  public static final class Builder {
    private final Map<String, String> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder mood(String value) {
      return set("mood", value);
    }

    public Builder sleep(String value) {
      return set("sleep", value);
    }

    public Builder comment(String value) {
      return set("comment", value);
    }

    public Builder balance(String value) {
      return set("balance", value);
    }

    public Builder mania(String value) {
      return set("mania", value);
    }

    public Builder depression(String value) {
      return set("depression", value);
    }

    public Builder anxiety(String value) {
      return set("anxiety", value);
    }

    public Builder irritability(String value) {
      return set("irritability", value);
    }

    public Builder productivity(String value) {
      return set("productivity", value);
    }

    public Builder sociability(String value) {
      return set("sociability", value);
    }

    /**
     * Sets an attribute by schema name.
     *
     * @param name schema name
     * @param value attribute value, {@code null} to clear
     * @return this builder
     * @throws ValidationException if {@code name} is not part of the schema
     */
    public Builder set(String name, String value) {
      if (!NAMES.contains(name)) {
        throw new ValidationException(ErrorCode.UNKNOWN_FIELD, "unknown entry field: " + name);
      }
      values.put(name, value);
      return this;
    }

    public EntryFields build() {
      return new EntryFields(
          values.get("mood"),
          values.get("sleep"),
          values.get("comment"),
          values.get("balance"),
          values.get("mania"),
          values.get("depression"),
          values.get("anxiety"),
          values.get("irritability"),
          values.get("productivity"),
          values.get("sociability"));
    }
  }
}
