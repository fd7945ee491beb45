package sh.xana.hashdive.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sh.xana.hashdive.common.Utils;
import sh.xana.hashdive.session.Frame;
import sh.xana.hashdive.session.FrameKind;

/**
 * Boundary to the vendor wire format. Binary frames go through the schema codec, text frames are
 * read as JSON directly.
 */
public interface FrameCodec {
  String BACK_MSG = "BackMsg";
  String FORWARD_MSG = "ForwardMsg";

  /** @throws CodecException when the request cannot be encoded */
  byte[] encode(JsonNode request, String schemaName);

  /** @throws CodecException when the payload is not a valid message of this schema */
  JsonNode decodeBinary(byte[] payload, String schemaName);

  /** Text frames that are not JSON come back wrapped as {@code {"text": ...}} */
  default JsonNode decode(Frame frame, String schemaName) {
    if (frame.kind() == FrameKind.BINARY) {
      return decodeBinary(frame.payload(), schemaName);
    }
    String text = frame.text();
    try {
      return Utils.jsonMapper.readTree(text);
    } catch (JsonProcessingException e) {
      ObjectNode wrapped = Utils.jsonMapper.createObjectNode();
      wrapped.put("text", text);
      return wrapped;
    }
  }
}
