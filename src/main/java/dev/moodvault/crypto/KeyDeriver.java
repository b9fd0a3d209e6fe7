/* Moodvault © 2025 — MIT */
package dev.moodvault.crypto;

import dev.moodvault.api.KeyDerivationException;
import dev.moodvault.core.Metrics;
import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives per-owner and per-passphrase AES keys.
 *
 * <p>Per-owner derivation is deterministic and deliberately slow, so results are cached in memory
 * for {@link Settings#keyTtl()} and the cache holds at most {@link Settings#maxOwners()} keys.
 * Keys are never logged.
 */
public final class KeyDeriver {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  /** Length of the random salt generated for each passphrase derivation. */
  public static final int PASSPHRASE_SALT_BYTES = 32;

  static final int KEY_BYTES = 32;
  private static final String OWNER_PASSWORD_PREFIX = "moodvault-owner-";

  private final SecretMaterial secrets;
  private final Settings settings;
  private final Metrics metrics;
  private final SecureRandom random;
  private final LongSupplier nanoClock;
  private final ConcurrentHashMap<Long, DerivedKey> cache = new ConcurrentHashMap<>();

  /**
   * Creates a deriver.
   *
   * @param secrets system-wide salt material
   * @param settings iteration counts and key cache bounds
   * @param metrics metrics registry, may be {@code null}
   */
  public KeyDeriver(SecretMaterial secrets, Settings settings, Metrics metrics) {
    this(secrets, settings, metrics, new SecureRandom(), System::nanoTime);
  }

  KeyDeriver(
      SecretMaterial secrets,
      Settings settings,
      Metrics metrics,
      SecureRandom random,
      LongSupplier nanoClock) {
    if (secrets == null) {
      throw new KeyDerivationException("secret material is not configured");
    }
    this.secrets = secrets;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics;
    this.random = Objects.requireNonNull(random, "random");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /**
   * Returns the AES-256 key of {@code owner}, deriving it on a cache miss.
   *
   * @param owner owner identifier
   * @return owner key
   * @throws KeyDerivationException if the runtime cannot run the key-stretching function
   */
  public SecretKey deriveKey(long owner) {
    long now = nanoClock.getAsLong();
    DerivedKey cached = cache.get(owner);
    if (cached != null && !cached.isExpired(now, settings.keyTtl())) {
      if (metrics != null) {
        metrics.recordKeyCacheHit();
      }
      return cached.key();
    }

    SecretKey key = new SecretKeySpec(stretchOwner(owner), "AES");
    if (metrics != null) {
      metrics.recordKeyDerivation();
    }
    cache.put(owner, new DerivedKey(key, now));
    enforceBound();
    return key;
  }

  /**
   * Derives a key from a passphrase with a fresh random salt.
   *
   * @param passphrase non-blank passphrase
   * @return key with the salt needed to rebuild it
   * @throws IllegalArgumentException if the passphrase is blank
   */
  public PassphraseKey derivePassphraseKey(String passphrase) {
    byte[] salt = new byte[PASSPHRASE_SALT_BYTES];
    random.nextBytes(salt);
    return derivePassphraseKey(passphrase, salt);
  }

  /**
   * Rebuilds a passphrase key from a known salt.
   *
   * @param passphrase non-blank passphrase
   * @param salt salt recorded at sealing time
   * @return rebuilt key
   * @throws IllegalArgumentException if the passphrase is blank or the salt is empty
   */
  public PassphraseKey derivePassphraseKey(String passphrase, byte[] salt) {
    if (passphrase == null || passphrase.isBlank()) {
      throw new IllegalArgumentException("passphrase must not be blank");
    }
    if (salt == null || salt.length == 0) {
      throw new IllegalArgumentException("salt must not be empty");
    }
    byte[] raw =
        Pbkdf2.derive(passphrase.toCharArray(), salt, settings.passphraseIterations(), KEY_BYTES);
    return new PassphraseKey(new SecretKeySpec(raw, "AES"), salt);
  }

  /**
   * Removes keys older than the configured TTL.
   *
   * @return number of keys removed
   */
  public int sweepExpired() {
    long now = nanoClock.getAsLong();
    int removed = 0;
    Iterator<Map.Entry<Long, DerivedKey>> it = cache.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().isExpired(now, settings.keyTtl())) {
        it.remove();
        removed++;
      }
    }
    if (removed > 0) {
      LOG.debug("(moodvault) op=key.sweep removed={} remaining={}", removed, cache.size());
    }
    return removed;
  }

  /** Drops the cached key of {@code owner}. */
  public void invalidate(long owner) {
    cache.remove(owner);
  }

  /** Number of keys currently cached. */
  public int cachedKeys() {
    return cache.size();
  }

  private byte[] stretchOwner(long owner) {
    byte[] systemSalt = secrets.systemSalt();
    byte[] digest = secrets.secretDigest();
    ByteBuffer salt = ByteBuffer.allocate(systemSalt.length + digest.length + Long.BYTES);
    salt.put(systemSalt).put(digest).putLong(owner);
    char[] password = (OWNER_PASSWORD_PREFIX + owner).toCharArray();
    try {
      return Pbkdf2.derive(password, salt.array(), settings.ownerIterations(), KEY_BYTES);
    } finally {
      Arrays.fill(password, '\0');
    }
  }

  private void enforceBound() {
    while (cache.size() > settings.maxOwners()) {
      Long oldest = null;
      long oldestAt = Long.MAX_VALUE;
      for (Map.Entry<Long, DerivedKey> e : cache.entrySet()) {
        if (oldest == null || e.getValue().derivedAtNanos() - oldestAt < 0) {
          oldest = e.getKey();
          oldestAt = e.getValue().derivedAtNanos();
        }
      }
      if (oldest == null) {
        return;
      }
      cache.remove(oldest);
    }
  }

  private record DerivedKey(SecretKey key, long derivedAtNanos) {
    boolean isExpired(long nowNanos, Duration ttl) {
      return nowNanos - derivedAtNanos >= ttl.toNanos();
    }
  }

  /**
   * Tuning of the key deriver.
   *
   * @param ownerIterations PBKDF2 iterations for per-owner keys
   * @param passphraseIterations PBKDF2 iterations for passphrase keys
   * @param keyTtl how long a derived owner key stays cached
   * @param maxOwners upper bound on cached owner keys
   */
  public record Settings(
      int ownerIterations, int passphraseIterations, Duration keyTtl, int maxOwners) {
    public static final Settings DEFAULTS =
        new Settings(100_000, 50_000, Duration.ofHours(1), 10_000);

    public Settings {
      if (ownerIterations < 1 || passphraseIterations < 1) {
        throw new IllegalArgumentException("iteration counts must be >= 1");
      }
      Objects.requireNonNull(keyTtl, "keyTtl");
      if (keyTtl.isNegative() || keyTtl.isZero()) {
        throw new IllegalArgumentException("keyTtl must be positive");
      }
      if (maxOwners < 1) {
        throw new IllegalArgumentException("maxOwners must be >= 1");
      }
    }
  }
}
