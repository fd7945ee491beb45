package sh.xana.hashdive.session;

public enum SessionState {
  CONNECTING,
  OPEN,
  CLOSED
}
