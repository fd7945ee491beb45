package sh.xana.hashdive.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.session.StreamSession;

/**
 * Bounded set of open sessions. Idle sessions are handed out again while alive and younger than
 * the TTL, otherwise a new one is opened as long as capacity remains.
 *
 * <p>All bookkeeping lives in the underlying {@link GenericObjectPool}, which serializes
 * lease/release/evict so no idle session is ever handed to two callers.
 */
public class SessionPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionPool.class);
  private final GenericObjectPool<StreamSession> pool;
  private final Set<StreamSession> managed = ConcurrentHashMap.newKeySet();
  private final int capacity;
  private final Duration ttl;

  public SessionPool(SessionFactory sessionFactory, int capacity, Duration ttl) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
    }
    this.capacity = capacity;
    this.ttl = ttl;

    GenericObjectPoolConfig<StreamSession> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(capacity);
    config.setMaxIdle(capacity);
    config.setMinIdle(0);
    config.setBlockWhenExhausted(false);
    config.setLifo(true);
    config.setTestOnBorrow(true);
    config.setTestWhileIdle(true);
    config.setNumTestsPerEvictionRun(-1);
    config.setMinEvictableIdleTime(ttl);
    // sweeping is driven by SessionPoolSweeper, not the pool's own timer
    config.setTimeBetweenEvictionRuns(Duration.ofMillis(-1));
    config.setJmxEnabled(false);

    this.pool =
        new GenericObjectPool<>(new PooledSessionFactory(sessionFactory, ttl, managed), config);
  }

  /** @return a leased session, or null when the pool is exhausted or opening one failed */
  @Nullable
  public StreamSession lease() {
    try {
      StreamSession session = pool.borrowObject();
      log.debug(
          "Leased {} (active {}, idle {})", session.name(), pool.getNumActive(), pool.getNumIdle());
      return session;
    } catch (NoSuchElementException e) {
      log.warn("Session pool exhausted ({} of {} in use)", pool.getNumActive(), capacity);
      return null;
    } catch (Exception e) {
      log.error("Failed to lease a session", e);
      return null;
    }
  }

  /** Unknown or already released sessions are ignored */
  public void release(StreamSession session) {
    try {
      if (session.isAlive()) {
        pool.returnObject(session);
        log.debug("Released {}", session.name());
      } else {
        log.debug("Released {} is dead, invalidating", session.name());
        pool.invalidateObject(session);
      }
    } catch (IllegalStateException e) {
      log.warn("Ignoring release of {} not leased from this pool: {}", session, e.getMessage());
    } catch (Exception e) {
      log.warn("Failed to invalidate {}", session, e);
    }
  }

  /** @return number of idle sessions closed because they were stale or dead */
  public int sweepExpired() {
    long before = pool.getDestroyedByEvictorCount();
    try {
      pool.evict();
    } catch (Exception e) {
      log.error("Error while evicting idle sessions", e);
    }
    int evicted = (int) (pool.getDestroyedByEvictorCount() - before);
    if (evicted > 0) {
      log.info("Evicted {} idle sessions older than {}", evicted, ttl);
    }
    return evicted;
  }

  /** Close every session this pool opened, leased ones included */
  public void closeAll() {
    List<StreamSession> sessions = new ArrayList<>(managed);
    log.info("Closing {} pooled sessions", sessions.size());
    for (StreamSession session : sessions) {
      session.close();
    }
    managed.clear();
    pool.close();
  }

  @Override
  public void close() {
    closeAll();
  }

  public int active() {
    return pool.getNumActive();
  }

  public int idle() {
    return pool.getNumIdle();
  }
}
