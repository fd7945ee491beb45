package sh.xana.hashdive.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.Utils;

/** Series pulled out of the plotly figure JSON embedded as a string in chart elements */
public class ChartSpecs {
  private static final Logger log = LoggerFactory.getLogger(ChartSpecs.class);

  private ChartSpecs() {}

  /** @return first trace of the figure, or null when the spec is absent or not JSON */
  @Nullable
  public static JsonNode firstTrace(String spec) {
    if (StringUtils.isBlank(spec)) {
      return null;
    }
    try {
      JsonNode trace = Utils.jsonMapper.readTree(spec).path("data").path(0);
      return trace.isObject() ? trace : null;
    } catch (JsonProcessingException e) {
      log.debug("Chart spec is not valid JSON: {}", Utils.preview(spec, 120));
      return null;
    }
  }

  /** Bar chart x labels to y values rounded to 2 decimals */
  @Nullable
  public static Map<String, Double> barSeries(String spec) {
    JsonNode trace = firstTrace(spec);
    if (trace == null) {
      return null;
    }
    JsonNode x = trace.path("x");
    JsonNode y = trace.path("y");
    Map<String, Double> series = new LinkedHashMap<>();
    for (int i = 0; i < x.size() && i < y.size(); i++) {
      if (y.get(i).isNumber()) {
        series.put(x.get(i).asText(), MarkupPatterns.round2(y.get(i).asDouble()));
      }
    }
    return series;
  }

  /**
   * Polar chart categories to values. Radar traces repeat the first point at the end to close
   * the shape, that duplicate is dropped
   */
  @Nullable
  public static Map<String, Double> radarSeries(String spec) {
    JsonNode trace = firstTrace(spec);
    if (trace == null) {
      return null;
    }
    JsonNode theta = trace.path("theta");
    JsonNode r = trace.path("r");
    int size = Math.min(theta.size(), r.size());
    if (size > 1 && theta.get(0).asText().equals(theta.get(theta.size() - 1).asText())) {
      size = Math.min(size, theta.size() - 1);
    }
    Map<String, Double> series = new LinkedHashMap<>();
    for (int i = 0; i < size; i++) {
      if (r.get(i).isNumber()) {
        series.put(theta.get(i).asText(), r.get(i).asDouble());
      }
    }
    return series;
  }
}
