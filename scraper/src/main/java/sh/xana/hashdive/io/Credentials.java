package sh.xana.hashdive.io;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import sh.xana.hashdive.common.SetupException;

public class Credentials {
  public static final String DOMAIN = "hashdive.com";
  public static final List<String> REQUIRED_COOKIES =
      List.of("ajs_anonymous_id", "_streamlit_user", "_streamlit_xsrf");

  private Credentials() {}

  /** @throws SetupException unless every name was found */
  public static Map<String, String> require(
      CredentialSource source, String domain, List<String> names) {
    Map<String, String> found = source.getCredentials(domain, names);
    List<String> missing =
        names.stream().filter(name -> !found.containsKey(name)).collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw new SetupException("Missing credentials for " + domain + ": " + missing);
    }
    return found;
  }
}
