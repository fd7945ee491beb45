package sh.xana.hashdive.session;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.Utils;

/**
 * One logical connection to the remote endpoint. Owned by exactly one caller at a time, either the
 * pool while idle or the lessee while leased, so only the transport callbacks touch it
 * concurrently.
 */
public class StreamSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamSession.class);
  private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();
  /** Queued after the last real frame once the transport is gone */
  private static final Frame CLOSED_MARKER = Frame.binary(new byte[0], Instant.EPOCH);

  private final String name;
  private final Transport transport;
  private final Duration pingTimeout;
  private final BlockingQueue<Frame> inbox = new LinkedBlockingQueue<>();
  private volatile SessionState state = SessionState.CONNECTING;
  private final AtomicBoolean released = new AtomicBoolean();

  public StreamSession(Transport transport, Duration pingTimeout) {
    this.name = "session-" + INSTANCE_COUNTER.incrementAndGet();
    this.transport = transport;
    this.pingTimeout = pingTimeout;
  }

  /**
   * Connect with linear backoff between attempts
   *
   * @return false once every attempt failed
   */
  public boolean open(Duration timeout, int maxRetries, Duration backoffBase) {
    if (state == SessionState.CLOSED) {
      throw new IllegalStateException(name + " is closed and cannot be reopened");
    }
    if (state == SessionState.OPEN) {
      return true;
    }

    for (int attempt = 0; attempt < maxRetries; attempt++) {
      if (attempt > 0) {
        long delay = backoffBase.toMillis() * attempt;
        log.info(
            "{} retry attempt {}/{} connecting to {} in {}ms",
            name,
            attempt + 1,
            maxRetries,
            transport.describe(),
            delay);
        if (!Utils.sleepQuietly(delay)) {
          log.warn("{} interrupted while waiting to reconnect", name);
          return false;
        }
      } else {
        log.info("{} connecting to {}", name, transport.describe());
      }

      try {
        transport.open(timeout, new InboxListener());
        state = SessionState.OPEN;
        log.info("{} connection established", name);
        return true;
      } catch (TransportException e) {
        log.warn("{} connection attempt {} failed: {}", name, attempt + 1, e.getMessage());
        log.debug("{} connection attempt failure", name, e);
        if (Thread.currentThread().isInterrupted()) {
          log.warn("{} interrupted, abandoning remaining attempts", name);
          return false;
        }
      }
    }
    log.error("{} all {} connection attempts failed", name, maxRetries);
    return false;
  }

  public boolean open(OpenPolicy policy) {
    return open(policy.connectTimeout(), policy.maxRetries(), policy.backoffBase());
  }

  /** No automatic reconnect or resend, a failed write means the connection is already gone */
  public boolean send(byte[] data) {
    if (!isAlive()) {
      log.error("{} send of {} bytes on a session that is not open ({})", name, data.length, state);
      return false;
    }
    try {
      transport.send(data);
      log.debug("{} sent binary data ({} bytes)", name, data.length);
      return true;
    } catch (TransportException e) {
      log.error("{} failed to send binary data: {}", name, e.getMessage());
      return false;
    }
  }

  /**
   * @param timeout null to wait forever
   * @return null on timeout, once closed, or when interrupted
   */
  @Nullable
  public Frame receive(@Nullable Duration timeout) {
    Frame frame;
    try {
      if (timeout == null) {
        frame = inbox.take();
      } else {
        frame = inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("{} interrupted while receiving", name);
      return null;
    }

    if (frame == null) {
      log.trace("{} receive timeout", name);
      return null;
    }
    if (frame == CLOSED_MARKER) {
      // leave it for the next reader
      inbox.offer(CLOSED_MARKER);
      return null;
    }
    return frame;
  }

  /**
   * Drop frames left over from an earlier request so they are not read as replies to the next
   * one
   *
   * @return number of frames dropped
   */
  public int discardPending() {
    int dropped = 0;
    Frame frame;
    while ((frame = inbox.poll()) != null) {
      if (frame == CLOSED_MARKER) {
        inbox.offer(CLOSED_MARKER);
        break;
      }
      dropped++;
    }
    if (dropped > 0) {
      log.debug("{} discarded {} stale frames", name, dropped);
    }
    return dropped;
  }

  public FrameStream receiveStream(
      int maxFrames, @Nullable Duration perFrameTimeout, @Nullable Duration totalTimeout) {
    return new FrameStream(this, maxFrames, perFrameTimeout, totalTimeout);
  }

  public FrameStream receiveStream(StreamLimits limits) {
    return receiveStream(limits.maxFrames(), limits.perFrameTimeout(), limits.totalTimeout());
  }

  /** Keepalive probe */
  public boolean ping() {
    return ping(pingTimeout);
  }

  /** Keepalive probe waiting at most the shorter of {@code limit} and the ping timeout */
  public boolean ping(Duration limit) {
    if (!isAlive()) {
      log.debug("{} ping on a session that is not open", name);
      return false;
    }
    Duration wait = limit.compareTo(pingTimeout) < 0 ? limit : pingTimeout;
    if (wait.isNegative() || wait.isZero()) {
      log.debug("{} no time left to ping", name);
      return false;
    }
    boolean answered = transport.ping(wait);
    if (answered) {
      log.debug("{} ping answered", name);
    } else {
      log.warn("{} ping not answered within {}", name, wait);
    }
    return answered;
  }

  /** Transport state only, not whether anything was exchanged recently */
  public boolean isAlive() {
    return state == SessionState.OPEN && transport.isOpen();
  }

  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    synchronized (this) {
      state = SessionState.CLOSED;
    }
    try {
      transport.close();
    } catch (RuntimeException e) {
      log.warn("{} error while closing transport", name, e);
    }
    inbox.offer(CLOSED_MARKER);
    log.info("{} connection closed", name);
  }

  public String name() {
    return name;
  }

  public SessionState state() {
    return state;
  }

  @Override
  public String toString() {
    return name + "[" + state + "]";
  }

  private class InboxListener implements TransportListener {
    @Override
    public void onFrame(Frame frame) {
      inbox.offer(frame);
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      log.info("{} closed by remote, status {} reason '{}'", name, statusCode, reason);
      markClosed();
    }

    @Override
    public void onError(Throwable error) {
      log.warn("{} transport error: {}", name, error.toString());
      markClosed();
    }

    private void markClosed() {
      synchronized (StreamSession.this) {
        if (state == SessionState.CLOSED) {
          return;
        }
        state = SessionState.CLOSED;
      }
      inbox.offer(CLOSED_MARKER);
    }
  }
}
