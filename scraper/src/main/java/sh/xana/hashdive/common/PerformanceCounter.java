package sh.xana.hashdive.common;

import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/** Logs progress and throughput every {@code splitBy} items, and once more at the last one */
public class PerformanceCounter {
  private final AtomicInteger counter = new AtomicInteger();
  private final long startTime = System.currentTimeMillis();
  private final Logger log;
  private final int splitBy;

  public PerformanceCounter(Logger log, int splitBy) {
    this.log = log;
    this.splitBy = splitBy;
  }

  public int incrementAndLog(long inputTotalSize) {
    int idx = counter.incrementAndGet();
    if (idx % splitBy == 0 || idx == inputTotalSize) {
      // avoid divide by zero error
      long durationSec = Math.max((System.currentTimeMillis() - startTime) / 1000, 1);

      log.info(
          "finished {} of {} /min {} %{}",
          idx,
          inputTotalSize,
          "%.1f".formatted(idx / (double) durationSec * 60),
          "%.2f".formatted(idx / (double) Math.max(inputTotalSize, 1) * 100));
    }
    return idx;
  }
}
