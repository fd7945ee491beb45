package sh.xana.hashdive.session;

public enum FrameKind {
  BINARY,
  TEXT
}
