package sh.xana.hashdive.session;

import java.net.URI;

public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransportException(URI uri, String action, Throwable cause) {
    super(action + " failed on " + uri + (cause != null ? ": " + cause.getMessage() : ""), cause);
  }
}
