package sh.xana.hashdive.session;

import java.time.Duration;

/**
 * How hard to try when opening a session.
 *
 * @param connectTimeout bound of each individual attempt
 * @param maxRetries total number of attempts
 * @param backoffBase delay before attempt N is {@code backoffBase * N}
 * @param pingTimeout how long a keepalive ping may wait for its pong
 */
public record OpenPolicy(
    Duration connectTimeout, int maxRetries, Duration backoffBase, Duration pingTimeout) {
  public static final OpenPolicy DEFAULT =
      new OpenPolicy(Duration.ofSeconds(45), 3, Duration.ofSeconds(2), Duration.ofSeconds(10));

  public OpenPolicy {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1, was " + maxRetries);
    }
  }
}
