package sh.xana.hashdive.io;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.testng.Assert;
import org.testng.annotations.Test;
import sh.xana.hashdive.common.SetupException;
import sh.xana.hashdive.common.Utils;

@Test
public class RequestTemplateTest {
  private final RequestTemplate template =
      RequestTemplate.loadResource(RequestTemplate.DEFAULT_RESOURCE);

  @Test
  public void onlyQueryStringChanges() {
    ObjectNode first = template.toBackMsg("0xabc");
    ObjectNode second = template.toBackMsg("0xdef");

    Assert.assertEquals(
        first.path("rerunScript").path("queryString").asText(), "user_address=0xabc");
    Assert.assertEquals(
        second.path("rerunScript").path("queryString").asText(), "user_address=0xdef");
    Assert.assertEquals(template.pageName(), "Analyze_User");
    Assert.assertEquals(
        template.backMsg().path("rerunScript").path("queryString").asText(), "",
        "template must not be modified");

    ((ObjectNode) second.get("rerunScript")).remove("queryString");
    ((ObjectNode) first.get("rerunScript")).remove("queryString");
    Assert.assertEquals(first, second);
  }

  @Test
  public void queryValueIsEncoded() {
    Assert.assertEquals(template.queryString("a b&c"), "user_address=a+b%26c");
  }

  @Test
  public void loadsFromFile() throws IOException {
    Path file = Files.createTempFile("template", ".json");
    try {
      Files.writeString(
          file,
          "{\"queryKey\": \"id\", \"backMsg\": {\"rerunScript\": {\"pageName\": \"Other\"}}}",
          StandardCharsets.UTF_8);
      RequestTemplate loaded = RequestTemplate.load(file);
      Assert.assertEquals(loaded.pageName(), "Other");
      Assert.assertEquals(loaded.queryString("7"), "id=7");
    } finally {
      Files.delete(file);
    }
  }

  @Test(expectedExceptions = SetupException.class)
  public void rejectsTemplateWithoutRerun() {
    new RequestTemplate(Utils.jsonMapper.createObjectNode(), "id");
  }

  @Test(expectedExceptions = SetupException.class)
  public void missingResourceFails() {
    RequestTemplate.loadResource("requests/nope.json");
  }
}
