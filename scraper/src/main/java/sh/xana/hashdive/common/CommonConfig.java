package sh.xana.hashdive.common;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

public class CommonConfig {
  private final Properties map;

  public CommonConfig(Path specificPropertiesFile) throws IOException {
    this.map = new Properties();
    try (Reader reader = Files.newBufferedReader(specificPropertiesFile)) {
      map.load(reader);
    }
  }

  public CommonConfig(Properties properties) {
    this.map = properties;
  }

  public boolean hasArg(String key) {
    String value = map.getProperty(key);
    return StringUtils.isNotBlank(value);
  }

  public String get(String key) {
    return map.getProperty(key);
  }

  public void set(String key, String value) {
    map.setProperty(key, value);
  }

  public String getRequiredArg(String key) {
    String value = map.getProperty(key);
    if (StringUtils.isBlank(value)) {
      throw new NoSuchElementException(key + " in properties files");
    }
    return value;
  }

  public String getOrDefault(String key, String defaultValue) {
    String value = map.getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    return value.trim();
  }

  public int getInt(String key, int defaultValue) {
    String value = getOrDefault(key, null);
    if (value == null) {
      return defaultValue;
    }
    if (!NumberUtils.isCreatable(value)) {
      throw new SetupException(key + " is not a number: " + value);
    }
    return NumberUtils.toInt(value);
  }

  /** Durations are stored as milliseconds. 0 or negative means "no limit" and returns null */
  public Duration getDuration(String key, Duration defaultValue) {
    String value = getOrDefault(key, null);
    if (value == null) {
      return defaultValue;
    }
    if (!NumberUtils.isDigits(StringUtils.removeStart(value, "-"))) {
      throw new SetupException(key + " is not a millisecond value: " + value);
    }
    long millis = Long.parseLong(value);
    return millis <= 0 ? null : Duration.ofMillis(millis);
  }

  public Properties properties() {
    return map;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getOrDefault(key, null);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
