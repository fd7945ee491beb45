package sh.xana.hashdive.common;

import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daemon thread running {@link #runCycle()} every {@code cycleSleepMillis} until closed. A failed
 * cycle is logged and the next one still runs.
 */
public abstract class AbstractTaskThread implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AbstractTaskThread.class);
  private final Thread thread;
  private final long cycleSleepMillis;
  private final AtomicInteger cycles = new AtomicInteger();

  protected AbstractTaskThread(String name, long cycleSleepMillis) {
    if (cycleSleepMillis <= 0) {
      throw new IllegalArgumentException(
          name + " needs a positive interval, was " + cycleSleepMillis);
    }
    this.cycleSleepMillis = cycleSleepMillis;
    this.thread = new Thread(this::mainLoop);
    this.thread.setName(name);
    this.thread.setDaemon(true);
  }

  public void start() {
    log.debug("Starting {} every {}ms", thread.getName(), cycleSleepMillis);
    this.thread.start();
  }

  private void mainLoop() {
    while (true) {
      try {
        // Sleep first, the owner already did any initial work before starting us
        //noinspection BusyWait
        Thread.sleep(cycleSleepMillis);
      } catch (InterruptedException e) {
        log.debug("Thread interrupted, closing");
        break;
      }

      try {
        if (!runCycle()) {
          log.warn("runCycle returned false, stopping");
          break;
        }
      } catch (RuntimeException e) {
        log.error("Cycle {} of {} failed", cycles.get() + 1, thread.getName(), e);
      }
      cycles.incrementAndGet();
    }
    log.debug("main loop ended after {} cycles", cycles.get());
  }

  /** @return true to continue, false to stop */
  protected abstract boolean runCycle();

  public boolean isRunning() {
    return thread.isAlive();
  }

  public int cycles() {
    return cycles.get();
  }

  @Override
  public void close() {
    Utils.closeThread(log, thread);
  }
}
