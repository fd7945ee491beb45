package sh.xana.hashdive.common;

/** Unrecoverable problem found before any session work started */
public class SetupException extends RuntimeException {

  public SetupException(String message) {
    super(message);
  }

  public SetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
