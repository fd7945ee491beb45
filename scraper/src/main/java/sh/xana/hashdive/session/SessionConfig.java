package sh.xana.hashdive.session;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Everything needed to open a connection. Built once from the credentials and shared by every
 * session, never changed afterwards
 */
public record SessionConfig(
    URI endpoint, Map<String, String> headers, List<String> subprotocols, int maxFrameBytes) {
  public static final String XSRF_COOKIE = "_streamlit_xsrf";
  public static final String BASE_SUBPROTOCOL = "streamlit";
  public static final int DEFAULT_MAX_FRAME_BYTES = 20 * 1024 * 1024;

  public SessionConfig {
    headers = ImmutableMap.copyOf(headers);
    subprotocols = ImmutableList.copyOf(subprotocols);
  }

  /**
   * The app authenticates through its cookies and echoes the xsrf cookie back as the second
   * websocket sub-protocol
   */
  public static SessionConfig forCookies(
      URI endpoint,
      String origin,
      String userAgent,
      Map<String, String> cookies,
      int maxFrameBytes) {
    String cookieHeader =
        cookies.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("; "));

    ImmutableMap.Builder<String, String> headers = ImmutableMap.builder();
    headers.put("User-Agent", userAgent);
    headers.put("Origin", origin);
    headers.put("Cookie", cookieHeader);

    ImmutableList.Builder<String> subprotocols = ImmutableList.builder();
    subprotocols.add(BASE_SUBPROTOCOL);
    String xsrf = cookies.get(XSRF_COOKIE);
    if (StringUtils.isNotBlank(xsrf)) {
      subprotocols.add(xsrf);
    }
    return new SessionConfig(endpoint, headers.build(), subprotocols.build(), maxFrameBytes);
  }

  @Override
  public String toString() {
    // keep cookie values out of logs
    return "SessionConfig{" + endpoint + ", headers " + headers.keySet() + "}";
  }
}
