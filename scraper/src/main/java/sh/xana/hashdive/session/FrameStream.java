package sh.xana.hashdive.session;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy sequence of inbound frames. Ends without throwing when any limit is hit or the session goes
 * away, so callers always keep whatever arrived so far.
 *
 * <p>A per-frame timeout alone does not end the stream: the session is pinged first and the
 * stream only stops if that fails too.
 */
public class FrameStream implements Iterator<Frame> {
  private static final Logger log = LoggerFactory.getLogger(FrameStream.class);

  private final StreamSession session;
  private final int maxFrames;
  @Nullable private final Duration perFrameTimeout;
  @Nullable private final Duration totalTimeout;
  private final long startNanos;

  private int frameCount = 0;
  @Nullable private Frame buffered;
  @Nullable private StopReason stopReason;

  FrameStream(
      StreamSession session,
      int maxFrames,
      @Nullable Duration perFrameTimeout,
      @Nullable Duration totalTimeout) {
    this.session = session;
    this.maxFrames = maxFrames;
    this.perFrameTimeout = perFrameTimeout;
    this.totalTimeout = totalTimeout;
    this.startNanos = System.nanoTime();
  }

  @Override
  public boolean hasNext() {
    if (buffered != null) {
      return true;
    }
    while (stopReason == null) {
      if (maxFrames > 0 && frameCount >= maxFrames) {
        log.debug("{} reached max frames limit {}", session.name(), maxFrames);
        stop(StopReason.MAX_FRAMES);
        break;
      }

      Duration remaining = remaining();
      if (remaining != null && (remaining.isZero() || remaining.isNegative())) {
        log.debug("{} reached total timeout {}", session.name(), totalTimeout);
        stop(StopReason.TOTAL_TIMEOUT);
        break;
      }

      Duration wait = shortest(perFrameTimeout, remaining);
      Frame frame = session.receive(wait);
      if (frame != null) {
        frameCount++;
        log.trace(
            "{} received frame #{} ({}, {} bytes)",
            session.name(),
            frameCount,
            frame.kind(),
            frame.size());
        buffered = frame;
        return true;
      }

      if (Thread.currentThread().isInterrupted()) {
        stop(StopReason.INTERRUPTED);
      } else if (!session.isAlive()) {
        log.debug("{} closed after {} frames", session.name(), frameCount);
        stop(StopReason.SESSION_CLOSED);
      } else if (isTotalTimeoutElapsed()) {
        stop(StopReason.TOTAL_TIMEOUT);
      } else if (keepalive()) {
        log.debug("{} slow frame, keepalive ok, still waiting", session.name());
      } else if (isTotalTimeoutElapsed()) {
        stop(StopReason.TOTAL_TIMEOUT);
      } else {
        log.warn(
            "{} no frame within {} and keepalive failed, ending stream",
            session.name(),
            perFrameTimeout);
        stop(StopReason.KEEPALIVE_FAILED);
      }
    }
    return false;
  }

  @Override
  public Frame next() {
    if (!hasNext()) {
      throw new NoSuchElementException("stream ended: " + stopReason);
    }
    Frame frame = buffered;
    buffered = null;
    return frame;
  }

  /** Stop reading early, eg once the terminal frame arrived */
  public void abandon() {
    buffered = null;
    if (stopReason == null) {
      stop(StopReason.ABANDONED);
    }
  }

  /** Ping bounded by whatever is left of the total timeout */
  private boolean keepalive() {
    Duration remaining = remaining();
    return remaining == null ? session.ping() : session.ping(remaining);
  }

  private void stop(StopReason reason) {
    this.stopReason = reason;
  }

  @Nullable
  private Duration remaining() {
    if (totalTimeout == null) {
      return null;
    }
    return totalTimeout.minus(elapsed());
  }

  private boolean isTotalTimeoutElapsed() {
    return totalTimeout != null && elapsed().compareTo(totalTimeout) >= 0;
  }

  public Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  @Nullable
  private static Duration shortest(@Nullable Duration a, @Nullable Duration b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.compareTo(b) <= 0 ? a : b;
  }

  public int frameCount() {
    return frameCount;
  }

  /** @return null while the stream is still live */
  @Nullable
  public StopReason stopReason() {
    return stopReason;
  }
}
