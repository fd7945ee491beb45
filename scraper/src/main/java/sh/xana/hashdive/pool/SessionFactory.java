package sh.xana.hashdive.pool;

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.session.OpenPolicy;
import sh.xana.hashdive.session.StreamSession;
import sh.xana.hashdive.session.Transport;

/** Builds sessions that all share one connection config, each on a fresh transport */
public class SessionFactory {
  private static final Logger log = LoggerFactory.getLogger(SessionFactory.class);
  private final Supplier<Transport> transportSupplier;
  private final OpenPolicy openPolicy;

  public SessionFactory(Supplier<Transport> transportSupplier, OpenPolicy openPolicy) {
    this.transportSupplier = transportSupplier;
    this.openPolicy = openPolicy;
  }

  public StreamSession newSession() {
    return new StreamSession(transportSupplier.get(), openPolicy.pingTimeout());
  }

  /** @return an open session, or null once every attempt failed */
  @Nullable
  public StreamSession openSession() {
    StreamSession session = newSession();
    if (session.open(openPolicy)) {
      return session;
    }
    log.warn("{} could not be opened", session.name());
    session.close();
    return null;
  }
}
