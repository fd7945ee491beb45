package sh.xana.hashdive.run;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.extract.UserRecord;
import sh.xana.hashdive.io.JsonFileRecordSink;

/** Rebuilds a record from saved messages without touching the network */
public class DumpReplayer {
  private static final Logger log = LoggerFactory.getLogger(DumpReplayer.class);

  public UserRecord replay(String targetId, List<JsonNode> messages) {
    ExtractionPipeline pipeline = new ExtractionPipeline(targetId);
    for (JsonNode message : messages) {
      pipeline.accept(message);
      if (pipeline.isComplete()) {
        break;
      }
    }
    pipeline.logSummary();
    return pipeline.record();
  }

  /** @param dumpDir directory holding one sub directory of messages per target */
  public UserRecord replay(Path dumpDir, String targetId) throws IOException {
    Path dir = dumpDir.resolve(targetId);
    List<JsonNode> messages = JsonFileRecordSink.readDump(dir);
    log.info("Replaying {} messages from {}", messages.size(), dir);
    return replay(targetId, messages);
  }
}
