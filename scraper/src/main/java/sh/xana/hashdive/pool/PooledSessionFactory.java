package sh.xana.hashdive.pool;

import java.time.Duration;
import java.util.Set;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.session.StreamSession;
import sh.xana.hashdive.session.TransportException;

/**
 * Lifecycle hooks the pool calls for each session. A session is only valid while its transport
 * is open and it has been idle for less than the TTL
 */
class PooledSessionFactory extends BasePooledObjectFactory<StreamSession> {
  private static final Logger log = LoggerFactory.getLogger(PooledSessionFactory.class);
  private final SessionFactory sessionFactory;
  private final Duration ttl;
  private final Set<StreamSession> managed;

  PooledSessionFactory(SessionFactory sessionFactory, Duration ttl, Set<StreamSession> managed) {
    this.sessionFactory = sessionFactory;
    this.ttl = ttl;
    this.managed = managed;
  }

  @Override
  public StreamSession create() {
    StreamSession session = sessionFactory.openSession();
    if (session == null) {
      throw new TransportException("Could not open a new pooled session");
    }
    managed.add(session);
    log.info("Created pooled {}", session.name());
    return session;
  }

  @Override
  public PooledObject<StreamSession> wrap(StreamSession session) {
    return new DefaultPooledObject<>(session);
  }

  @Override
  public boolean validateObject(PooledObject<StreamSession> p) {
    StreamSession session = p.getObject();
    if (!session.isAlive()) {
      log.debug("{} is no longer alive", session.name());
      return false;
    }
    long idleMillis =
        System.currentTimeMillis() - Math.max(p.getLastReturnTime(), p.getCreateTime());
    if (idleMillis >= ttl.toMillis()) {
      log.debug("{} idle for {}ms, past ttl {}", session.name(), idleMillis, ttl);
      return false;
    }
    return true;
  }

  @Override
  public void destroyObject(PooledObject<StreamSession> p) {
    StreamSession session = p.getObject();
    managed.remove(session);
    session.close();
    log.debug("Destroyed pooled {}", session.name());
  }
}
