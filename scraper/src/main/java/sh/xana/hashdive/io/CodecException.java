package sh.xana.hashdive.io;

public class CodecException extends RuntimeException {

  public CodecException(String message, String schemaName) {
    this(message, schemaName, null);
  }

  public CodecException(String message, String schemaName, Throwable cause) {
    super((message != null ? message + " " : "") + "schema " + schemaName, cause);
  }
}
