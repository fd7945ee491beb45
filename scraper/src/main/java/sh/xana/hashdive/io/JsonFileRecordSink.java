package sh.xana.hashdive.io;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.Utils;
import sh.xana.hashdive.extract.UserRecord;

/**
 * Writes {@code <outputDir>/<target>.json}, and when a dump directory is set the run's messages
 * to {@code <dumpDir>/<target>/message_<n>.json}
 */
public class JsonFileRecordSink implements RecordSink {
  private static final Logger log = LoggerFactory.getLogger(JsonFileRecordSink.class);
  private static final Pattern DUMP_FILE = Pattern.compile("message_(\\d+)\\.json");
  private final Path outputDir;
  @Nullable private final Path dumpDir;

  public JsonFileRecordSink(Path outputDir, @Nullable Path dumpDir) {
    this.outputDir = outputDir;
    this.dumpDir = dumpDir;
  }

  public Path recordPath(String targetId) {
    return outputDir.resolve(targetId + ".json");
  }

  @Override
  public boolean exists(String targetId) {
    return Files.exists(recordPath(targetId));
  }

  @Override
  public void write(String targetId, UserRecord record) throws IOException {
    Files.createDirectories(outputDir);
    Path path = recordPath(targetId);
    Utils.jsonMapper.writeValue(path.toFile(), record);
    log.debug("Wrote {}", path);
  }

  @Override
  public void dump(String targetId, List<JsonNode> messages) throws IOException {
    if (dumpDir == null) {
      return;
    }
    Path dir = dumpDir.resolve(targetId);
    if (Files.exists(dir)) {
      // stale messages from an earlier, longer run would mix into a replay
      FileUtils.cleanDirectory(dir.toFile());
    }
    Files.createDirectories(dir);
    for (int i = 0; i < messages.size(); i++) {
      Utils.jsonMapper.writeValue(dir.resolve("message_" + i + ".json").toFile(), messages.get(i));
    }
    log.debug("Dumped {} messages to {}", messages.size(), dir);
  }

  /** @return messages of a dump directory in arrival order */
  public static List<JsonNode> readDump(Path dir) throws IOException {
    List<Path> files = new ArrayList<>();
    try (Stream<Path> list = Files.list(dir)) {
      list.filter(p -> DUMP_FILE.matcher(p.getFileName().toString()).matches())
          .forEach(files::add);
    }
    files.sort((a, b) -> Integer.compare(dumpIndex(a), dumpIndex(b)));

    List<JsonNode> messages = new ArrayList<>(files.size());
    for (Path file : files) {
      messages.add(Utils.jsonMapper.readTree(file.toFile()));
    }
    return messages;
  }

  private static int dumpIndex(Path file) {
    Matcher matcher = DUMP_FILE.matcher(file.getFileName().toString());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Not a dump file " + file);
    }
    return Integer.parseInt(matcher.group(1));
  }
}
