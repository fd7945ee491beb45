package sh.xana.hashdive;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.CommonConfig;
import sh.xana.hashdive.common.SetupException;
import sh.xana.hashdive.io.Credentials;
import sh.xana.hashdive.session.OpenPolicy;
import sh.xana.hashdive.session.SessionConfig;
import sh.xana.hashdive.session.StreamLimits;

public class ScraperConfig extends CommonConfig {
  private static final Logger log = LoggerFactory.getLogger(ScraperConfig.class);
  public static final Path DEFAULT_PATH = Path.of("config-scraper.properties");

  public static final String ARG_ENDPOINT = "endpoint";
  public static final String ARG_ORIGIN = "origin";
  public static final String ARG_USER_AGENT = "userAgent";

  public static final String ARG_CREDENTIALS_DIR = "credentials.dir";
  public static final String ARG_CREDENTIALS_DOMAIN = "credentials.domain";

  public static final String ARG_CONNECT_TIMEOUT = "session.connectTimeoutMs";
  public static final String ARG_MAX_RETRIES = "session.maxRetries";
  public static final String ARG_BACKOFF_BASE = "session.backoffBaseMs";
  public static final String ARG_PING_TIMEOUT = "session.pingTimeoutMs";
  public static final String ARG_MAX_FRAME_BYTES = "session.maxFrameBytes";

  public static final String ARG_MAX_FRAMES = "stream.maxFrames";
  public static final String ARG_PER_FRAME_TIMEOUT = "stream.perFrameTimeoutMs";
  public static final String ARG_TOTAL_TIMEOUT = "stream.totalTimeoutMs";

  public static final String ARG_POOL_SIZE = "pool.size";
  public static final String ARG_POOL_TTL = "pool.ttlMs";
  public static final String ARG_POOL_SWEEP_INTERVAL = "pool.sweepIntervalMs";

  public static final String ARG_CONCURRENCY = "bulk.concurrency";
  public static final String ARG_PACING = "bulk.pacingMs";
  public static final String ARG_INPUT = "input";
  public static final String ARG_OFFSET = "offset";
  public static final String ARG_LIMIT = "limit";
  public static final String ARG_REFETCH = "refetch";

  public static final String ARG_OUTPUT_DIR = "output.dir";
  public static final String ARG_DUMP_ENABLED = "dump.enabled";
  public static final String ARG_DUMP_DIR = "dump.dir";

  public static final String ARG_CODEC_ENCODER = "codec.encoder";
  public static final String ARG_CODEC_DECODER = "codec.decoder";
  public static final String ARG_CODEC_TIMEOUT = "codec.timeoutMs";

  public static final String ARG_REQUEST_TEMPLATE = "request.template";

  private static final String DEFAULT_USER_AGENT =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko)"
          + " Chrome/120.0.0.0 Safari/537.36";

  public ScraperConfig(Properties properties) {
    super(properties);
  }

  /** Missing file means defaults for everything */
  public static ScraperConfig load(Path path) {
    if (!Files.exists(path)) {
      log.warn("Config {} not found, using defaults", path);
      return new ScraperConfig(new Properties());
    }
    try {
      CommonConfig loaded = new CommonConfig(path);
      log.info("Loaded config {}", path);
      return new ScraperConfig(loaded.properties());
    } catch (IOException e) {
      throw new SetupException("Cannot read config " + path, e);
    }
  }

  public URI getEndpoint() {
    String value = getOrDefault(ARG_ENDPOINT, "wss://hashdive.com/_stcore/stream");
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      throw new SetupException("Invalid " + ARG_ENDPOINT + " " + value, e);
    }
  }

  public String getOrigin() {
    return getOrDefault(ARG_ORIGIN, "https://hashdive.com");
  }

  public String getUserAgent() {
    return getOrDefault(ARG_USER_AGENT, DEFAULT_USER_AGENT);
  }

  public Path getCredentialsDir() {
    return Path.of(getOrDefault(ARG_CREDENTIALS_DIR, "credentials"));
  }

  public String getCredentialsDomain() {
    return getOrDefault(ARG_CREDENTIALS_DOMAIN, Credentials.DOMAIN);
  }

  public int getMaxFrameBytes() {
    return getInt(ARG_MAX_FRAME_BYTES, SessionConfig.DEFAULT_MAX_FRAME_BYTES);
  }

  public OpenPolicy getOpenPolicy() {
    OpenPolicy defaults = OpenPolicy.DEFAULT;
    return new OpenPolicy(
        required(ARG_CONNECT_TIMEOUT, defaults.connectTimeout()),
        getInt(ARG_MAX_RETRIES, defaults.maxRetries()),
        required(ARG_BACKOFF_BASE, defaults.backoffBase()),
        required(ARG_PING_TIMEOUT, defaults.pingTimeout()));
  }

  public StreamLimits getStreamLimits() {
    StreamLimits defaults = StreamLimits.DEFAULT;
    return new StreamLimits(
        getInt(ARG_MAX_FRAMES, defaults.maxFrames()),
        getDuration(ARG_PER_FRAME_TIMEOUT, defaults.perFrameTimeout()),
        getDuration(ARG_TOTAL_TIMEOUT, defaults.totalTimeout()));
  }

  public int getPoolSize() {
    return getInt(ARG_POOL_SIZE, 10);
  }

  public Duration getPoolTtl() {
    return required(ARG_POOL_TTL, Duration.ofMinutes(5));
  }

  public Duration getPoolSweepInterval() {
    return required(ARG_POOL_SWEEP_INTERVAL, Duration.ofMinutes(1));
  }

  public int getConcurrency() {
    return getInt(ARG_CONCURRENCY, 3);
  }

  public long getPacingMillis() {
    Duration pacing = getDuration(ARG_PACING, Duration.ofSeconds(2));
    return pacing == null ? 0 : pacing.toMillis();
  }

  @Nullable
  public Path getInput() {
    return hasArg(ARG_INPUT) ? Path.of(get(ARG_INPUT).trim()) : null;
  }

  public int getOffset() {
    return getInt(ARG_OFFSET, 0);
  }

  public int getLimit() {
    return getInt(ARG_LIMIT, 0);
  }

  public boolean isRefetch() {
    return getBoolean(ARG_REFETCH, false);
  }

  public Path getOutputDir() {
    return Path.of(getOrDefault(ARG_OUTPUT_DIR, "data/users"));
  }

  public boolean isDumpEnabled() {
    return getBoolean(ARG_DUMP_ENABLED, false);
  }

  public Path getDumpDir() {
    return Path.of(getOrDefault(ARG_DUMP_DIR, "logs/messages"));
  }

  public List<String> getEncoderCommand() {
    return command(ARG_CODEC_ENCODER, "node codec/protobuf_encoder.js");
  }

  public List<String> getDecoderCommand() {
    return command(ARG_CODEC_DECODER, "node codec/protobuf_decoder.js");
  }

  public Duration getCodecTimeout() {
    return required(ARG_CODEC_TIMEOUT, Duration.ofSeconds(30));
  }

  @Nullable
  public Path getRequestTemplate() {
    return hasArg(ARG_REQUEST_TEMPLATE) ? Path.of(get(ARG_REQUEST_TEMPLATE).trim()) : null;
  }

  private List<String> command(String key, String defaultValue) {
    return Arrays.asList(StringUtils.split(getOrDefault(key, defaultValue)));
  }

  /** Durations that cannot be unbounded */
  private Duration required(String key, Duration defaultValue) {
    Duration value = getDuration(key, defaultValue);
    if (value == null) {
      throw new SetupException(key + " must be a positive number of milliseconds");
    }
    return value;
  }
}
