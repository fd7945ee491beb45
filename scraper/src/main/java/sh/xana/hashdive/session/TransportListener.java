package sh.xana.hashdive.session;

/** Callbacks from the transport's I/O threads. Implementations must not block */
public interface TransportListener {
  void onFrame(Frame frame);

  void onClosed(int statusCode, String reason);

  void onError(Throwable error);
}
