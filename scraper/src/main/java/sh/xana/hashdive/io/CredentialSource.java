package sh.xana.hashdive.io;

import java.util.Collection;
import java.util.Map;

/** Where the session cookies come from */
public interface CredentialSource {
  /** @return the requested values that were found, possibly none */
  Map<String, String> getCredentials(String domain, Collection<String> names);
}
