package sh.xana.hashdive.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.SetupException;

/**
 * Reads the input list: a CSV file with a header row containing {@value #ID_COLUMN}. Quoting is
 * not supported, values are plain identifiers and numbers.
 */
public class TargetListReader {
  private static final Logger log = LoggerFactory.getLogger(TargetListReader.class);
  public static final String ID_COLUMN = "user_address";

  /**
   * @param offset rows to skip
   * @param limit maximum rows to return, 0 or less for all
   */
  public List<Target> read(Path csv, int offset, int limit) {
    List<Target> targets = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
      String headerLine = reader.readLine();
      if (headerLine == null) {
        throw new SetupException("Input list " + csv + " is empty");
      }
      String[] header = split(StringUtils.removeStart(headerLine, "\uFEFF"));
      int idIndex = ArrayUtils.indexOf(header, ID_COLUMN);
      if (idIndex == ArrayUtils.INDEX_NOT_FOUND) {
        throw new SetupException("Input list " + csv + " has no " + ID_COLUMN + " column");
      }

      int row = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        if (StringUtils.isBlank(line)) {
          continue;
        }
        if (row++ < offset) {
          continue;
        }
        if (limit > 0 && targets.size() >= limit) {
          break;
        }

        String[] values = split(line);
        String id = idIndex < values.length ? values[idIndex] : "";
        if (id.isEmpty()) {
          log.warn("Skipping row {} of {} without {}", row, csv, ID_COLUMN);
          continue;
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < header.length && i < values.length; i++) {
          if (i != idIndex && !header[i].isEmpty()) {
            attributes.put(header[i], values[i]);
          }
        }
        targets.add(new Target(id, attributes));
      }
    } catch (IOException e) {
      throw new SetupException("Cannot read input list " + csv, e);
    }
    log.info("Loaded {} targets from {} (offset {}, limit {})", targets.size(), csv, offset, limit);
    return targets;
  }

  private static String[] split(String line) {
    String[] values = StringUtils.splitPreserveAllTokens(line, ',');
    for (int i = 0; i < values.length; i++) {
      values[i] = values[i].trim();
    }
    return values;
  }
}
