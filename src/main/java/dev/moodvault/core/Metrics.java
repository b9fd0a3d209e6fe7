/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import dev.moodvault.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counters for the storage engine, exposed via JMX.
 *
 * <p>Covers entry and user I/O, cache behavior, key derivation and decrypt failures, plus the last
 * error code seen by the store and by the cache.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");
  static final String MBEAN_NAME = "dev.moodvault:type=VaultMetrics";

  private final AtomicLong entryWriteSuccess = new AtomicLong();
  private final AtomicLong entryWriteFailure = new AtomicLong();
  private final AtomicLong entryReadSuccess = new AtomicLong();
  private final AtomicLong entryReadFailure = new AtomicLong();
  private final AtomicLong skippedRows = new AtomicLong();
  private final AtomicLong userWriteSuccess = new AtomicLong();
  private final AtomicLong userWriteFailure = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();
  private final AtomicLong cacheEvictions = new AtomicLong();
  private final AtomicLong cacheFlushFailures = new AtomicLong();
  private final AtomicLong keyDerivations = new AtomicLong();
  private final AtomicLong keyCacheHits = new AtomicLong();
  private final AtomicLong decryptFailures = new AtomicLong();

  private final AtomicReference<String> lastStoreErrorCode = new AtomicReference<>("NONE");
  private final AtomicReference<String> lastCacheErrorCode = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;
  private final Bean bean = new Bean();

  /** Creates and registers the metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  /** Records an entry upsert or delete outcome. */
  public void recordEntryWrite(boolean ok, ErrorCode code) {
    increment(ok ? entryWriteSuccess : entryWriteFailure);
    if (!ok && code != null) {
      lastStoreErrorCode.set(code.name());
    }
  }

  /**
   * Records a multi-row entry read.
   *
   * @param ok whether the query itself succeeded
   * @param code failure code when {@code ok} is false
   * @param skipped rows dropped because they could not be decrypted
   */
  public void recordEntryRead(boolean ok, ErrorCode code, int skipped) {
    increment(ok ? entryReadSuccess : entryReadFailure);
    if (skipped > 0) {
      skippedRows.addAndGet(skipped);
    }
    if (!ok && code != null) {
      lastStoreErrorCode.set(code.name());
    }
  }

  /** Records a user upsert outcome. */
  public void recordUserWrite(boolean ok, ErrorCode code) {
    increment(ok ? userWriteSuccess : userWriteFailure);
    if (!ok && code != null) {
      lastStoreErrorCode.set(code.name());
    }
  }

  public void recordCacheHit() {
    increment(cacheHits);
  }

  public void recordCacheMiss() {
    increment(cacheMisses);
  }

  public void recordCacheEviction() {
    increment(cacheEvictions);
  }

  /** Records a failed flush of a dirty cache slot. */
  public void recordCacheFlushFailure(ErrorCode code) {
    increment(cacheFlushFailures);
    if (code != null) {
      lastCacheErrorCode.set(code.name());
    }
  }

  public void recordKeyDerivation() {
    increment(keyDerivations);
  }

  public void recordKeyCacheHit() {
    increment(keyCacheHits);
  }

  public void recordDecryptFailure() {
    increment(decryptFailures);
  }

  /**
   * Read-only view of the counters (the same object JMX exposes).
   *
   * @return live metrics view
   */
  public VaultMetricsMBean view() {
    return bean;
  }

  private void increment(AtomicLong counter) {
    counter.incrementAndGet();
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(bean, objectName);
    } catch (InstanceAlreadyExistsException
        | MBeanRegistrationException
        | NotCompliantMBeanException e) {
      LOG.warn("(moodvault) metrics registration failed", e);
    } catch (Exception e) {
      LOG.warn("(moodvault) metrics registration unexpected failure", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(moodvault) metrics unregister failed", e);
    }
  }

  private final class Bean implements VaultMetricsMBean {
    @Override
    public long getEntryWriteSuccess() {
      return entryWriteSuccess.get();
    }

    @Override
    public long getEntryWriteFailure() {
      return entryWriteFailure.get();
    }

    @Override
    public long getEntryReadSuccess() {
      return entryReadSuccess.get();
    }

    @Override
    public long getEntryReadFailure() {
      return entryReadFailure.get();
    }

    @Override
    public long getSkippedRows() {
      return skippedRows.get();
    }

    @Override
    public long getUserWriteSuccess() {
      return userWriteSuccess.get();
    }

    @Override
    public long getUserWriteFailure() {
      return userWriteFailure.get();
    }

    @Override
    public long getCacheHits() {
      return cacheHits.get();
    }

    @Override
    public long getCacheMisses() {
      return cacheMisses.get();
    }

    @Override
    public long getCacheEvictions() {
      return cacheEvictions.get();
    }

    @Override
    public long getCacheFlushFailures() {
      return cacheFlushFailures.get();
    }

    @Override
    public long getKeyDerivations() {
      return keyDerivations.get();
    }

    @Override
    public long getKeyCacheHits() {
      return keyCacheHits.get();
    }

    @Override
    public long getDecryptFailures() {
      return decryptFailures.get();
    }

    @Override
    public String getLastStoreErrorCode() {
      return lastStoreErrorCode.get();
    }

    @Override
    public String getLastCacheErrorCode() {
      return lastCacheErrorCode.get();
    }
  }

  /** JMX view of the metrics registry. */
  public interface VaultMetricsMBean {
    /** Entry upserts/deletes that reached the database. */
    long getEntryWriteSuccess();

    /** Entry upserts/deletes that failed. */
    long getEntryWriteFailure();

    /** Entry range reads that completed. */
    long getEntryReadSuccess();

    /** Entry range reads that failed at the query level. */
    long getEntryReadFailure();

    /** Stored rows dropped from reads because they could not be decrypted. */
    long getSkippedRows();

    /** User upserts that reached the database. */
    long getUserWriteSuccess();

    /** User upserts that failed. */
    long getUserWriteFailure();

    /** Cache reads served from a live slot. */
    long getCacheHits();

    /** Cache reads that loaded from the database. */
    long getCacheMisses();

    /** Slots removed by TTL or capacity. */
    long getCacheEvictions();

    /** Dirty-slot flushes that failed and were kept for retry. */
    long getCacheFlushFailures();

    /** Executions of the per-owner key-stretching function. */
    long getKeyDerivations();

    /** Per-owner key requests served from the key cache. */
    long getKeyCacheHits();

    /** Blobs that failed authentication. */
    long getDecryptFailures();

    /** Last error code observed by the store. */
    String getLastStoreErrorCode();

    /** Last error code observed by the cache. */
    String getLastCacheErrorCode();
  }
}
