package sh.xana.hashdive.session;

/** Why a {@link FrameStream} ended */
public enum StopReason {
  MAX_FRAMES,
  TOTAL_TIMEOUT,
  SESSION_CLOSED,
  KEEPALIVE_FAILED,
  INTERRUPTED,
  /** Caller stopped reading, eg on the terminal frame */
  ABANDONED
}
