package sh.xana.hashdive.classify;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** @param deltaPath position of the element in the rendered page, empty for control messages */
public record ClassifiedMessage(MessageTag tag, JsonNode message, List<Integer> deltaPath) {

  public ClassifiedMessage {
    deltaPath = List.copyOf(deltaPath);
  }
}
