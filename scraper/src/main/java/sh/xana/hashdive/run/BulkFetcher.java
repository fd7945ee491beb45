package sh.xana.hashdive.run;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.PerformanceCounter;
import sh.xana.hashdive.common.Utils;
import sh.xana.hashdive.extract.UserRecord;
import sh.xana.hashdive.io.RecordSink;
import sh.xana.hashdive.io.Target;

/**
 * Runs the extraction for a list of targets, at most {@code concurrency} at once and with a fixed
 * pause between starting two runs. A failed target never stops the batch, its partial record is
 * still written.
 */
public class BulkFetcher {
  private static final Logger log = LoggerFactory.getLogger(BulkFetcher.class);
  private static final Logger progress = LoggerFactory.getLogger("sh.xana.hashdive.progress");
  private final ExtractionRunner runner;
  private final RecordSink sink;
  private final int concurrency;
  private final long pacingMillis;
  private final boolean refetch;
  private final Clock clock;

  public BulkFetcher(
      ExtractionRunner runner,
      RecordSink sink,
      int concurrency,
      long pacingMillis,
      boolean refetch,
      Clock clock) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
    }
    this.runner = runner;
    this.sink = sink;
    this.concurrency = concurrency;
    this.pacingMillis = pacingMillis;
    this.refetch = refetch;
    this.clock = clock;
  }

  public BulkSummary fetchAll(List<Target> targets) throws InterruptedException {
    int total = targets.size();
    AtomicInteger succeeded = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();
    PerformanceCounter counter = new PerformanceCounter(progress, 10);
    Semaphore gate = new Semaphore(concurrency);
    ExecutorService executor =
        Executors.newFixedThreadPool(
            concurrency,
            new ThreadFactoryBuilder().setNameFormat("extract-%d").setDaemon(true).build());

    log.info("Fetching {} targets with concurrency {}", total, concurrency);
    try {
      boolean first = true;
      for (int i = 0; i < total; i++) {
        Target target = targets.get(i);
        int index = i + 1;
        if (!refetch && sink.exists(target.id())) {
          progress.info("[{}/{}] Skipping {} (already exists)", index, total, target.id());
          skipped.incrementAndGet();
          counter.incrementAndLog(total);
          continue;
        }

        if (!first && !Utils.sleepQuietly(pacingMillis)) {
          throw new InterruptedException("Interrupted while pacing requests");
        }
        first = false;

        gate.acquire();
        executor.submit(
            () -> {
              try {
                if (process(target, index, total)) {
                  succeeded.incrementAndGet();
                } else {
                  failed.incrementAndGet();
                }
              } catch (RuntimeException e) {
                // nobody reads the future, so every target must land in the summary here
                log.error("[{}/{}] {} failed unexpectedly", index, total, target.id(), e);
                failed.incrementAndGet();
              } finally {
                gate.release();
                counter.incrementAndLog(total);
              }
            });
      }
    } finally {
      executor.shutdown();
      if (Thread.currentThread().isInterrupted()) {
        executor.shutdownNow();
      }
    }
    while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
      log.info("Waiting for {} running extractions", concurrency - gate.availablePermits());
    }

    BulkSummary summary = new BulkSummary(total, succeeded.get(), skipped.get(), failed.get());
    progress.info(
        "Done: {} succeeded, {} skipped, {} failed of {}",
        summary.succeeded(),
        summary.skipped(),
        summary.failed(),
        summary.total());
    return summary;
  }

  /** @return true if the target succeeded */
  boolean process(Target target, int index, int total) {
    String id = target.id();
    progress.info("[{}/{}] Fetching {}", index, total, id);
    ExtractionResult result;
    try {
      result = runner.runExtraction(id);
    } catch (RuntimeException e) {
      log.error("[{}/{}] {} extraction crashed", index, total, id, e);
      return false;
    }

    UserRecord record = result.record();
    record.setUserAddress(id);
    record.getSourceAttributes().putAll(target.attributes());
    record.setFetchedAt(clock.instant().toString());

    try {
      if (!result.messages().isEmpty()) {
        sink.dump(id, result.messages());
      }
      sink.write(id, record);
    } catch (IOException e) {
      log.error("[{}/{}] {} could not be saved", index, total, id, e);
      return false;
    }

    if (result.success()) {
      progress.info(
          "[{}/{}] Saved {} ({} frames, {} fields{})",
          index,
          total,
          id,
          result.framesProcessed(),
          record.getPopulatedFieldCount(),
          result.completed() ? "" : ", partial");
      return true;
    }
    progress.warn("[{}/{}] Failed {}: {}", index, total, id, result.error());
    return false;
  }
}
