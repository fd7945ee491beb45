package sh.xana.hashdive.io;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import sh.xana.hashdive.extract.UserRecord;

/** Destination of finished records, keyed by target identifier */
public interface RecordSink {
  boolean exists(String targetId);

  void write(String targetId, UserRecord record) throws IOException;

  /** Keep the decoded messages of one run for offline replay */
  void dump(String targetId, List<JsonNode> messages) throws IOException;
}
