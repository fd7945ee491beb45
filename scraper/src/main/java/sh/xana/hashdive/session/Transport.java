package sh.xana.hashdive.session;

import java.time.Duration;

/**
 * One physical connection to the remote endpoint. A transport may be opened again after a failed
 * attempt, each successful open replaces the listener.
 */
public interface Transport {
  /**
   * Block until the connection is open
   *
   * @throws TransportException on failure or when {@code timeout} elapses
   */
  void open(Duration timeout, TransportListener listener);

  /** Write one complete binary frame */
  void send(byte[] data);

  /** @return true if the remote answered within {@code timeout} */
  boolean ping(Duration timeout);

  boolean isOpen();

  void close();

  String describe();
}
