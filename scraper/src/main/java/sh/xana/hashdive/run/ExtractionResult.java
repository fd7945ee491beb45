package sh.xana.hashdive.run;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import sh.xana.hashdive.extract.UserRecord;
import sh.xana.hashdive.session.StopReason;

/**
 * Outcome of one run. The record is returned even on failure, holding whatever was assembled.
 *
 * @param success the request went out and at least one message came back
 * @param completed the server signalled the end of the page
 * @param framesProcessed frames read from the stream, including undecodable ones
 * @param stopReason why the frame stream ended, null when it was never started
 * @param messages decoded messages in arrival order
 */
public record ExtractionResult(
    String targetId,
    UserRecord record,
    boolean success,
    boolean completed,
    int framesProcessed,
    @Nullable StopReason stopReason,
    @Nullable String error,
    List<JsonNode> messages) {

  public static ExtractionResult failed(String targetId, UserRecord record, String error) {
    return new ExtractionResult(targetId, record, false, false, 0, null, error, List.of());
  }
}
