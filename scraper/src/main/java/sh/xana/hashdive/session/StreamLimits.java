package sh.xana.hashdive.session;

import java.time.Duration;
import org.jetbrains.annotations.Nullable;

/**
 * Bounds of one receive loop. Null durations mean unbounded.
 *
 * @param maxFrames 0 or less for no frame limit
 */
public record StreamLimits(
    int maxFrames, @Nullable Duration perFrameTimeout, @Nullable Duration totalTimeout) {
  public static final StreamLimits DEFAULT =
      new StreamLimits(300, Duration.ofSeconds(10), Duration.ofSeconds(120));
}
