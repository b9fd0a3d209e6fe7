/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import dev.moodvault.api.DateRange;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.PersistenceException;
import dev.moodvault.api.ReadResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-owner cache of decrypted entries in front of {@link EntryStore}.
 *
 * <p>A slot holds every readable entry of one owner plus the writes not yet persisted. Slots leave
 * the cache when idle longer than the TTL or when the least recently used one must make room; a
 * slot with pending writes is flushed first and kept if that flush fails. All slot transitions run
 * under one reentrant cache lock, which is always taken before the store lock.
 */
public final class EntryCache {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  private final EntryStore store;
  private final Settings settings;
  private final Metrics metrics;
  private final Clock clock;
  private final LongSupplier nanoClock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<Long, Slot> slots = new LinkedHashMap<>(16, 0.75f, true);

  /**
   * Creates a cache.
   *
   * @param store backing store
   * @param settings capacity, TTL and write policy
   * @param metrics metrics registry, may be {@code null}
   */
  public EntryCache(EntryStore store, Settings settings, Metrics metrics) {
    this(store, settings, metrics, Clock.systemUTC(), System::nanoTime);
  }

  EntryCache(
      EntryStore store,
      Settings settings,
      Metrics metrics,
      Clock clock,
      LongSupplier nanoClock) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /**
   * Returns the entries of {@code owner}, newest first, loading them on a miss.
   *
   * @throws PersistenceException if the entries had to be loaded and the load failed
   */
  public ReadResult get(long owner) {
    return get(owner, DateRange.all());
  }

  /**
   * Returns the entries of {@code owner} within {@code range}, newest first.
   *
   * @throws PersistenceException if the entries had to be loaded and the load failed
   */
  public ReadResult get(long owner, DateRange range) {
    lock.lock();
    try {
      Slot slot = liveSlot(owner);
      return slot.view(range == null ? DateRange.all() : range);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies a write to the owner's slot and, with write-through, persists it at once.
   *
   * <p>Replacing a day keeps the creation time of the entry it replaces.
   *
   * <p>On a persistence failure the write stays pending in the slot and is retried by the next
   * flush; the exception still reaches the caller.
   *
   * @return the cached entry
   * @throws PersistenceException if loading the slot or the write-through flush failed
   */
  public Entry put(long owner, LocalDate date, EntryFields fields) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(fields, "fields");
    lock.lock();
    try {
      Slot slot = liveSlot(owner);
      Entry prior = slot.entries.get(date);
      Instant createdAt = prior != null ? prior.createdAt() : clock.instant();
      Entry entry = new Entry(owner, date, fields, createdAt);
      slot.entries.put(date, entry);
      slot.pending.put(date, entry);
      if (settings.writeThrough()) {
        flushSlot(slot);
      }
      return entry;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Checks whether {@code owner} has an entry for {@code date}, including writes not yet flushed.
   *
   * @throws PersistenceException on a database fault
   */
  public boolean hasEntry(long owner, LocalDate date) {
    lock.lock();
    try {
      Slot slot = slots.get(owner);
      if (slot != null && slot.entries.containsKey(date)) {
        return true;
      }
      return store.hasEntry(owner, date);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lists entry days of {@code owner}, newest first, including writes not yet flushed.
   *
   * @throws PersistenceException on a database fault
   */
  public List<LocalDate> entryDates(long owner) {
    lock.lock();
    try {
      TreeSet<LocalDate> dates = new TreeSet<>(Comparator.reverseOrder());
      dates.addAll(store.entryDates(owner));
      Slot slot = slots.get(owner);
      if (slot != null) {
        dates.addAll(slot.pending.keySet());
      }
      return new ArrayList<>(dates);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes one entry in the database and in the slot under the same critical section.
   *
   * @return {@code true} if the entry existed
   * @throws PersistenceException if the delete failed; the slot is left untouched
   */
  public boolean delete(long owner, LocalDate date) {
    lock.lock();
    try {
      boolean removed = store.deleteEntry(owner, date);
      Slot slot = slots.get(owner);
      if (slot != null) {
        removed |= slot.entries.remove(date) != null;
        slot.pending.remove(date);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes every entry of {@code owner} and drops the slot, pending writes included.
   *
   * @return rows removed from the database
   * @throws PersistenceException if the delete failed; the slot is left untouched
   */
  public int deleteAll(long owner) {
    lock.lock();
    try {
      int removed = store.deleteAllEntries(owner);
      Slot slot = slots.remove(owner);
      if (slot != null && slot.isDirty()) {
        LOG.debug(
            "(moodvault) op=cache.deleteAll owner={} discardedPending={}",
            owner,
            slot.pending.size());
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes and drops the slot of {@code owner}.
   *
   * @throws PersistenceException if pending writes could not be flushed; the slot is kept
   */
  public void invalidate(long owner) {
    lock.lock();
    try {
      Slot slot = slots.get(owner);
      if (slot == null) {
        return;
      }
      flushSlot(slot);
      slots.remove(owner);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Persists the pending writes of {@code owner}.
   *
   * @throws PersistenceException if a write failed; it stays pending
   */
  public void flush(long owner) {
    lock.lock();
    try {
      Slot slot = slots.get(owner);
      if (slot != null) {
        flushSlot(slot);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Persists every pending write. Failures are logged and left pending.
   *
   * @return number of slots still dirty afterwards
   */
  public int flushAll() {
    lock.lock();
    try {
      int stillDirty = 0;
      for (Slot slot : new ArrayList<>(slots.values())) {
        if (!tryFlush(slot, "cache.flushAll")) {
          stillDirty++;
        }
      }
      return stillDirty;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Background maintenance: flushes dirty slots and evicts slots idle longer than the TTL. Expired
   * slots whose flush fails are kept for the next sweep.
   *
   * @return number of slots evicted
   */
  public int sweep() {
    lock.lock();
    try {
      long now = nanoClock.getAsLong();
      int evicted = 0;
      Iterator<Slot> it = new ArrayList<>(slots.values()).iterator();
      while (it.hasNext()) {
        Slot slot = it.next();
        boolean flushed = tryFlush(slot, "cache.sweep");
        if (flushed && slot.isExpired(now, settings.ttl())) {
          slots.remove(slot.owner);
          evicted++;
          if (metrics != null) {
            metrics.recordCacheEviction();
          }
        }
      }
      if (evicted > 0) {
        LOG.debug("(moodvault) op=cache.sweep evicted={} remaining={}", evicted, slots.size());
      }
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  /** Number of owners currently cached. */
  public int size() {
    lock.lock();
    try {
      return slots.size();
    } finally {
      lock.unlock();
    }
  }

  /** Whether {@code owner} is cached. */
  public boolean contains(long owner) {
    lock.lock();
    try {
      return slots.containsKey(owner);
    } finally {
      lock.unlock();
    }
  }

  /** Number of writes of {@code owner} not yet persisted. */
  public int pendingWrites(long owner) {
    lock.lock();
    try {
      Slot slot = slots.get(owner);
      return slot == null ? 0 : slot.pending.size();
    } finally {
      lock.unlock();
    }
  }

  private Slot liveSlot(long owner) {
    long now = nanoClock.getAsLong();
    Slot slot = slots.get(owner);
    if (slot != null) {
      if (!slot.isExpired(now, settings.ttl()) || slot.isDirty()) {
        slot.lastAccessNanos = now;
        if (metrics != null) {
          metrics.recordCacheHit();
        }
        return slot;
      }
      slots.remove(owner);
      if (metrics != null) {
        metrics.recordCacheEviction();
      }
    }

    if (metrics != null) {
      metrics.recordCacheMiss();
    }
    ReadResult loaded = store.readEntries(owner, DateRange.all());
    makeRoom();
    Slot fresh = new Slot(owner, now);
    for (Entry entry : loaded.entries()) {
      fresh.entries.put(entry.date(), entry);
    }
    fresh.skipped = loaded.skipped();
    slots.put(owner, fresh);
    return fresh;
  }

  private void makeRoom() {
    if (slots.size() < settings.maxOwners()) {
      return;
    }
    Iterator<Map.Entry<Long, Slot>> it = slots.entrySet().iterator();
    while (slots.size() >= settings.maxOwners() && it.hasNext()) {
      Slot candidate = it.next().getValue();
      if (!tryFlush(candidate, "cache.evict")) {
        continue;
      }
      it.remove();
      if (metrics != null) {
        metrics.recordCacheEviction();
      }
    }
    if (slots.size() >= settings.maxOwners()) {
      LOG.warn(
          "(moodvault) code={} op={} message={} size={}",
          "CACHE_OVER_CAPACITY",
          "cache.evict",
          "every evictable slot holds unflushed writes; growing past maxOwners",
          slots.size());
    }
  }

  private boolean tryFlush(Slot slot, String op) {
    if (!slot.isDirty()) {
      return true;
    }
    try {
      flushSlot(slot);
      return true;
    } catch (PersistenceException e) {
      LOG.warn(
          "(moodvault) code={} op={} message={} owner={} pending={}",
          e.errorCode(),
          op,
          e.getMessage(),
          slot.owner,
          slot.pending.size());
      return false;
    }
  }

  private void flushSlot(Slot slot) {
    Iterator<Entry> it = slot.pending.values().iterator();
    while (it.hasNext()) {
      Entry entry = it.next();
      try {
        store.upsertEntry(entry);
      } catch (PersistenceException e) {
        if (metrics != null) {
          metrics.recordCacheFlushFailure(e.errorCode());
        }
        throw e;
      }
      it.remove();
    }
  }

  /**
   * Cache tuning.
   *
   * @param maxOwners owners held at once
   * @param ttl idle lifetime of a slot
   * @param writeThrough persist every write immediately
   */
  public record Settings(int maxOwners, Duration ttl, boolean writeThrough) {
    public Settings {
      if (maxOwners < 1) {
        throw new IllegalArgumentException("maxOwners must be >= 1");
      }
      Objects.requireNonNull(ttl, "ttl");
      if (ttl.isNegative() || ttl.isZero()) {
        throw new IllegalArgumentException("ttl must be positive");
      }
    }
  }

  private static final class Slot {
    private final long owner;
    private final TreeMap<LocalDate, Entry> entries = new TreeMap<>(Comparator.reverseOrder());
    private final LinkedHashMap<LocalDate, Entry> pending = new LinkedHashMap<>();
    private int skipped;
    private long lastAccessNanos;

    private Slot(long owner, long lastAccessNanos) {
      this.owner = owner;
      this.lastAccessNanos = lastAccessNanos;
    }

    private boolean isDirty() {
      return !pending.isEmpty();
    }

    private boolean isExpired(long nowNanos, Duration ttl) {
      return nowNanos - lastAccessNanos >= ttl.toNanos();
    }

    private ReadResult view(DateRange range) {
      if (range.isUnbounded()) {
        return new ReadResult(new ArrayList<>(entries.values()), skipped);
      }
      List<Entry> out = new ArrayList<>();
      for (Entry entry : entries.values()) {
        if (range.contains(entry.date())) {
          out.add(entry);
        }
      }
      return new ReadResult(out, skipped);
    }
  }
}
