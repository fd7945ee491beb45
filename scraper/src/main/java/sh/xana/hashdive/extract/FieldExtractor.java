package sh.xana.hashdive.extract;

import com.fasterxml.jackson.databind.JsonNode;

/** Pulls the fields of one element type into a partial record, leaving unparseable ones null */
@FunctionalInterface
public interface FieldExtractor {
  void extract(JsonNode message, UserRecord partial);
}
