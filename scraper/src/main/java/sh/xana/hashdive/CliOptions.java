package sh.xana.hashdive;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.Nullable;

/**
 * Command line: {@code <fetch|replay> [flags]}. Flags override the matching config properties.
 */
public class CliOptions {
  public static final String USAGE =
      """
      scraper <fetch|replay> [options]
        --config <file>      properties file (default config-scraper.properties)
        --input <csv>        list of targets with a user_address column
        --target <id>        single target instead of --input
        --output <dir>       record output directory
        --limit <n>          at most n targets
        --offset <n>         skip the first n targets
        --refetch            fetch targets that already have an output file
        --pool-size <n>      maximum open sessions
        --dump               keep decoded messages of every run
        --dump-dir <dir>     where message dumps are written and replayed from
      """;

  public enum Mode {
    FETCH,
    REPLAY
  }

  private final Mode mode;
  private final Path configPath;
  @Nullable private final String target;
  private final Map<String, String> overrides;

  private CliOptions(
      Mode mode, Path configPath, @Nullable String target, Map<String, String> overrides) {
    this.mode = mode;
    this.configPath = configPath;
    this.target = target;
    this.overrides = overrides;
  }

  /** @throws IllegalArgumentException on unknown modes or flags, or malformed values */
  public static CliOptions parse(String[] args) {
    if (args.length == 0) {
      throw new IllegalArgumentException("missing mode");
    }
    Mode mode;
    switch (args[0]) {
      case "fetch" -> mode = Mode.FETCH;
      case "replay" -> mode = Mode.REPLAY;
      default -> throw new IllegalArgumentException("unknown mode " + args[0]);
    }
    args = ArrayUtils.subarray(args, 1, args.length);

    Path configPath = ScraperConfig.DEFAULT_PATH;
    String target = null;
    Map<String, String> overrides = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String flag = args[i];
      switch (flag) {
        case "--config" -> configPath = Path.of(value(args, ++i, flag));
        case "--input" -> overrides.put(ScraperConfig.ARG_INPUT, value(args, ++i, flag));
        case "--target" -> target = value(args, ++i, flag);
        case "--output" -> overrides.put(ScraperConfig.ARG_OUTPUT_DIR, value(args, ++i, flag));
        case "--limit" -> overrides.put(ScraperConfig.ARG_LIMIT, number(args, ++i, flag));
        case "--offset" -> overrides.put(ScraperConfig.ARG_OFFSET, number(args, ++i, flag));
        case "--pool-size" -> overrides.put(ScraperConfig.ARG_POOL_SIZE, number(args, ++i, flag));
        case "--refetch" -> overrides.put(ScraperConfig.ARG_REFETCH, "true");
        case "--dump" -> overrides.put(ScraperConfig.ARG_DUMP_ENABLED, "true");
        case "--dump-dir" -> overrides.put(ScraperConfig.ARG_DUMP_DIR, value(args, ++i, flag));
        default -> throw new IllegalArgumentException("unknown option " + flag);
      }
    }
    return new CliOptions(mode, configPath, target, overrides);
  }

  private static String value(String[] args, int index, String flag) {
    if (index >= args.length || StringUtils.startsWith(args[index], "--")) {
      throw new IllegalArgumentException(flag + " needs a value");
    }
    return args[index];
  }

  private static String number(String[] args, int index, String flag) {
    String value = value(args, index, flag);
    if (!NumberUtils.isDigits(value)) {
      throw new IllegalArgumentException(flag + " needs a non-negative number, got " + value);
    }
    return value;
  }

  public void applyTo(ScraperConfig config) {
    overrides.forEach(config::set);
  }

  public Mode mode() {
    return mode;
  }

  public Path configPath() {
    return configPath;
  }

  @Nullable
  public String target() {
    return target;
  }

  public Map<String, String> overrides() {
    return overrides;
  }
}
