/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.moodvault.api.DateRange;
import dev.moodvault.api.DecryptException;
import dev.moodvault.api.DiaryStore;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.PersistenceException;
import dev.moodvault.api.ReadResult;
import dev.moodvault.api.User;
import dev.moodvault.api.ValidationException;
import dev.moodvault.crypto.EntryCipher;
import java.time.LocalDate;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DiaryStore} backed by the entry cache for entry data and by the store for user rows.
 *
 * <p>Persistence faults are already logged where they happen; here they only turn into {@code
 * false}, empty results or empty lists.
 */
public final class DiaryStoreImpl implements DiaryStore {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  /** Version tag written into sharing packages. */
  public static final String SHARE_FORMAT_VERSION = "1.0";

  private final EntryCache cache;
  private final EntryStore store;
  private final EntryCipher cipher;
  private final Metrics metrics;

  /**
   * Creates a new instance.
   *
   * @param cache entry cache
   * @param store backing store, used directly for user rows
   * @param cipher cipher used for sharing packages
   * @param metrics metrics registry, may be {@code null}
   */
  public DiaryStoreImpl(EntryCache cache, EntryStore store, EntryCipher cipher, Metrics metrics) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.store = Objects.requireNonNull(store, "store");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.metrics = metrics;
  }

  @Override
  public boolean saveEntry(long owner, LocalDate date, EntryFields fields) {
    try {
      cache.put(owner, date, fields);
      return true;
    } catch (PersistenceException e) {
      LOG.info(
          "(moodvault) op=diary.saveEntry owner={} kept for retry code={}", owner, e.errorCode());
      return false;
    }
  }

  @Override
  public ReadResult getEntries(long owner, DateRange range) {
    try {
      return cache.get(owner, range);
    } catch (PersistenceException e) {
      return ReadResult.empty();
    }
  }

  @Override
  public boolean hasEntry(long owner, LocalDate date) {
    try {
      return cache.hasEntry(owner, date);
    } catch (PersistenceException e) {
      return false;
    }
  }

  @Override
  public List<LocalDate> entryDates(long owner) {
    try {
      return cache.entryDates(owner);
    } catch (PersistenceException e) {
      return List.of();
    }
  }

  @Override
  public boolean deleteEntry(long owner, LocalDate date) {
    try {
      return cache.delete(owner, date);
    } catch (PersistenceException e) {
      return false;
    }
  }

  @Override
  public boolean deleteAll(long owner) {
    try {
      int removed = cache.deleteAll(owner);
      LOG.info("(moodvault) op=diary.deleteAll owner={} removed={}", owner, removed);
      return true;
    } catch (PersistenceException e) {
      return false;
    }
  }

  @Override
  public boolean upsertUser(long owner, String displayName, String notificationTime) {
    try {
      store.upsertUser(owner, displayName, notificationTime);
      return true;
    } catch (PersistenceException e) {
      return false;
    }
  }

  @Override
  public Optional<User> findUser(long owner) {
    try {
      return store.findUser(owner);
    } catch (PersistenceException e) {
      return Optional.empty();
    }
  }

  @Override
  public List<Long> usersDueForNotification(String clockTime) {
    try {
      return store.usersDueForNotification(clockTime);
    } catch (PersistenceException e) {
      return List.of();
    }
  }

  @Override
  public String exportForSharing(List<Entry> entries, String passphrase) {
    Objects.requireNonNull(entries, "entries");
    if (passphrase == null || passphrase.isBlank()) {
      throw new ValidationException(
          ErrorCode.INVALID_PASSPHRASE, "passphrase must not be blank");
    }
    byte[] sealed = cipher.sealWithPassphrase(EntryCodec.encodeBundle(entries), passphrase);
    JsonObject envelope = new JsonObject();
    envelope.addProperty("format_version", SHARE_FORMAT_VERSION);
    if (entries.isEmpty()) {
      envelope.add("sender_id", JsonNull.INSTANCE);
    } else {
      envelope.addProperty("sender_id", entries.get(0).owner());
    }
    envelope.addProperty("encrypted_data", Base64.getEncoder().encodeToString(sealed));
    return envelope.toString();
  }

  @Override
  public List<Entry> importShared(String payload, String passphrase) {
    byte[] sealed = unwrapEnvelope(payload);
    byte[] plaintext;
    try {
      plaintext = cipher.openWithPassphrase(sealed, passphrase);
    } catch (DecryptException e) {
      if (metrics != null) {
        metrics.recordDecryptFailure();
      }
      LOG.info(
          "(moodvault) code={} op={} message={}",
          e.errorCode(),
          "diary.importShared",
          e.getMessage());
      throw e;
    }
    try {
      return EntryCodec.decodeBundle(plaintext);
    } catch (ValidationException e) {
      throw new DecryptException("shared package content is damaged", e);
    }
  }

  private static byte[] unwrapEnvelope(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new DecryptException("shared package is empty");
    }
    JsonObject envelope;
    try {
      JsonElement root = JsonParser.parseString(payload);
      if (!root.isJsonObject()) {
        throw new DecryptException("shared package is not a JSON object");
      }
      envelope = root.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new DecryptException("shared package is not valid JSON", e);
    }
    JsonElement version = envelope.get("format_version");
    if (version == null
        || !version.isJsonPrimitive()
        || !SHARE_FORMAT_VERSION.equals(version.getAsString())) {
      throw new DecryptException("unsupported shared package version");
    }
    JsonElement data = envelope.get("encrypted_data");
    if (data == null || !data.isJsonPrimitive()) {
      throw new DecryptException("shared package has no encrypted_data");
    }
    try {
      return Base64.getDecoder().decode(data.getAsString());
    } catch (IllegalArgumentException e) {
      throw new DecryptException("shared package encrypted_data is not base64", e);
    }
  }
}
