package sh.xana.hashdive.common;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

public class Utils {
  private Utils() {}

  public static final ObjectMapper jsonMapper =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.INDENT_OUTPUT, true);

  public static void closeThread(Logger log, Thread thread) {
    if (thread.isAlive()) {
      log.debug("Closing active thread {}", thread.getName());
      thread.interrupt();
    } else {
      log.debug("Thread {} not alive", thread.getName());
    }
  }

  /** @return false if interrupted */
  public static boolean sleepQuietly(long millis) {
    if (millis <= 0) {
      return true;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public static String newlinePlaceholder(String message) {
    int start = StringUtils.indexOfAny(message, '\r', '\n');
    if (start == -1) {
      return message;
    } else {
      return message.substring(0, start) + "(...newline clipped)";
    }
  }

  /** Clip long payloads before logging them */
  public static String preview(String message, int maxLength) {
    return StringUtils.abbreviate(newlinePlaceholder(message), maxLength);
  }
}
