package sh.xana.hashdive.classify;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** Accessors for the decoded server messages ("ForwardMsg") pushed over the stream */
public class ForwardMessages {
  public static final String SCRIPT_FINISHED = "scriptFinished";
  public static final String FINISHED_SUCCESSFULLY = "FINISHED_SUCCESSFULLY";

  private ForwardMessages() {}

  /** The server is done rendering the page for the current request */
  public static boolean isTerminal(JsonNode message) {
    return FINISHED_SUCCESSFULLY.equals(message.path(SCRIPT_FINISHED).asText(null));
  }

  /** @return the rendered element, or a missing node for control messages */
  public static JsonNode newElement(JsonNode message) {
    return message.path("delta").path("newElement");
  }

  public static List<Integer> deltaPath(JsonNode message) {
    List<Integer> path = new ArrayList<>();
    for (JsonNode index : message.path("metadata").path("deltaPath")) {
      path.add(index.asInt());
    }
    return path;
  }

  public static String markdownBody(JsonNode message) {
    return newElement(message).path("markdown").path("body").asText("");
  }

  public static String metricBody(JsonNode message) {
    return newElement(message).path("metric").path("body").asText("");
  }

  public static String plotlySpec(JsonNode message) {
    return newElement(message).path("plotlyChart").path("spec").asText("");
  }

  public static boolean hasDataFrame(JsonNode element) {
    return element.has("arrowDataFrame");
  }

  /**
   * Every searchable text of an element joined by spaces: markdown body, metric label and body,
   * chart spec and data frame column config
   */
  public static String searchableContent(JsonNode element) {
    List<String> parts = new ArrayList<>();
    if (element.has("markdown")) {
      parts.add(element.path("markdown").path("body").asText(""));
    }
    if (element.has("metric")) {
      JsonNode metric = element.path("metric");
      parts.add(metric.path("label").asText(""));
      parts.add(metric.path("body").asText(""));
    }
    if (element.has("plotlyChart")) {
      parts.add(element.path("plotlyChart").path("spec").asText(""));
    }
    if (hasDataFrame(element)) {
      JsonNode columns = element.path("arrowDataFrame").path("columns");
      parts.add(columns.isTextual() ? columns.asText() : columns.toString());
    }
    return String.join(" ", parts);
  }
}
