package sh.xana.hashdive.session;

import com.google.common.collect.ImmutableMap;
import java.net.URI;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.Test;

@Test
public class SessionConfigTest {
  private static final URI ENDPOINT = URI.create("wss://hashdive.com/_stcore/stream");

  @Test
  public void cookiesBecomeHeadersAndSubprotocol() {
    SessionConfig config =
        SessionConfig.forCookies(
            ENDPOINT,
            "https://hashdive.com",
            "agent/1.0",
            ImmutableMap.of("ajs_anonymous_id", "anon", "_streamlit_xsrf", "tok"),
            1024);

    Assert.assertEquals(
        config.headers().get("Cookie"), "ajs_anonymous_id=anon; _streamlit_xsrf=tok");
    Assert.assertEquals(config.headers().get("Origin"), "https://hashdive.com");
    Assert.assertEquals(config.headers().get("User-Agent"), "agent/1.0");
    Assert.assertEquals(config.subprotocols(), List.of("streamlit", "tok"));
    Assert.assertFalse(config.toString().contains("anon"));
  }

  @Test
  public void noXsrfMeansBaseProtocolOnly() {
    SessionConfig config =
        SessionConfig.forCookies(ENDPOINT, "o", "ua", ImmutableMap.of("a", "b"), 1024);
    Assert.assertEquals(config.subprotocols(), List.of("streamlit"));
  }
}
