package sh.xana.hashdive.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Cookies exported to {@code <directory>/<domain>.properties}, one {@code name=value} per line */
public class PropertiesCredentialSource implements CredentialSource {
  private static final Logger log = LoggerFactory.getLogger(PropertiesCredentialSource.class);
  private final Path directory;

  public PropertiesCredentialSource(Path directory) {
    this.directory = directory;
  }

  @Override
  public Map<String, String> getCredentials(String domain, Collection<String> names) {
    Path file = pathFor(domain);
    Map<String, String> result = new LinkedHashMap<>();
    if (!Files.exists(file)) {
      log.warn("No credential file {}", file);
      return result;
    }

    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(file)) {
      properties.load(reader);
    } catch (IOException e) {
      log.error("Cannot read credential file {}", file, e);
      return result;
    }

    for (String name : names) {
      String value = properties.getProperty(name);
      if (StringUtils.isNotBlank(value)) {
        result.put(name, value.trim());
      }
    }
    log.info("Loaded credentials {} for {}", result.keySet(), domain);
    return result;
  }

  public Path pathFor(String domain) {
    return directory.resolve(domain + ".properties");
  }
}
