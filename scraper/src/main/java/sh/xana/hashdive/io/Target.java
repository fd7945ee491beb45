package sh.xana.hashdive.io;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** One row of the input list. Columns other than the identifier are carried as attributes */
public record Target(String id, Map<String, String> attributes) {

  public Target {
    attributes = ImmutableMap.copyOf(attributes);
  }

  public static Target of(String id) {
    return new Target(id, Map.of());
  }
}
