package sh.xana.hashdive.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.message.BasicNameValuePair;
import sh.xana.hashdive.common.SetupException;
import sh.xana.hashdive.common.Utils;

/**
 * The page request sent to start rendering. Only the query string changes between targets, the
 * page name and context block come from the template file.
 *
 * @param backMsg template of the client message, must contain a {@code rerunScript} object
 * @param queryKey query parameter carrying the target identifier
 */
public record RequestTemplate(ObjectNode backMsg, String queryKey) {
  public static final String DEFAULT_RESOURCE = "requests/analyze_user.json";

  public RequestTemplate {
    if (!backMsg.path("rerunScript").isObject()) {
      throw new SetupException("Request template has no rerunScript object");
    }
  }

  public ObjectNode toBackMsg(String targetId) {
    ObjectNode message = backMsg.deepCopy();
    ((ObjectNode) message.get("rerunScript")).put("queryString", queryString(targetId));
    return message;
  }

  public String queryString(String targetId) {
    return URLEncodedUtils.format(
        List.of(new BasicNameValuePair(queryKey, targetId)), StandardCharsets.UTF_8);
  }

  public String pageName() {
    return backMsg.path("rerunScript").path("pageName").asText();
  }

  public static RequestTemplate load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, path.toString());
    } catch (IOException e) {
      throw new SetupException("Cannot read request template " + path, e);
    }
  }

  public static RequestTemplate loadResource(String resource) {
    try (InputStream in = RequestTemplate.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new SetupException("Request template resource " + resource + " not found");
      }
      return parse(in, resource);
    } catch (IOException e) {
      throw new SetupException("Cannot read request template " + resource, e);
    }
  }

  private static RequestTemplate parse(InputStream in, String source) throws IOException {
    JsonNode root = Utils.jsonMapper.readTree(in);
    JsonNode backMsg = root.path("backMsg");
    String queryKey = root.path("queryKey").asText("");
    if (!backMsg.isObject() || queryKey.isEmpty()) {
      throw new SetupException("Request template " + source + " needs backMsg and queryKey");
    }
    return new RequestTemplate((ObjectNode) backMsg, queryKey);
  }
}
