package sh.xana.hashdive.pool;

import sh.xana.hashdive.common.AbstractTaskThread;

/** Periodically closes idle sessions that outlived the pool TTL */
public class SessionPoolSweeper extends AbstractTaskThread {
  private final SessionPool pool;

  public SessionPoolSweeper(SessionPool pool, long sweepIntervalMillis) {
    super("pool-sweeper", sweepIntervalMillis);
    this.pool = pool;
  }

  @Override
  protected boolean runCycle() {
    pool.sweepExpired();
    return true;
  }
}
