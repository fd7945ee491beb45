package sh.xana.hashdive.session;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Transport} over the JDK websocket client */
public class WebSocketTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final HttpClient httpClient;
  private final SessionConfig config;
  private final Clock clock;
  private volatile WebSocket webSocket;
  private volatile CompletableFuture<Void> pendingPong;

  public WebSocketTransport(HttpClient httpClient, SessionConfig config) {
    this(httpClient, config, Clock.systemUTC());
  }

  public WebSocketTransport(HttpClient httpClient, SessionConfig config, Clock clock) {
    this.httpClient = httpClient;
    this.config = config;
    this.clock = clock;
  }

  @Override
  public void open(Duration timeout, TransportListener listener) {
    WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(timeout);
    config.headers().forEach(builder::header);
    List<String> subprotocols = config.subprotocols();
    if (!subprotocols.isEmpty()) {
      builder.subprotocols(
          subprotocols.get(0),
          subprotocols.subList(1, subprotocols.size()).toArray(new String[0]));
    }

    CompletableFuture<WebSocket> future =
        builder.buildAsync(config.endpoint(), new FrameAssembler(listener));
    try {
      webSocket = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Opened {} with sub-protocol '{}'", config.endpoint(), webSocket.getSubprotocol());
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TransportException(config.endpoint(), "Open timed out after " + timeout, e);
    } catch (ExecutionException e) {
      throw new TransportException(config.endpoint(), "Open", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new TransportException(config.endpoint(), "Open interrupted", e);
    }
  }

  @Override
  public void send(byte[] data) {
    WebSocket socket = requireSocket();
    try {
      socket
          .sendBinary(ByteBuffer.wrap(data), true)
          .get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new TransportException(config.endpoint(), "Send", e.getCause());
    } catch (TimeoutException e) {
      throw new TransportException(config.endpoint(), "Send timed out", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(config.endpoint(), "Send interrupted", e);
    }
  }

  @Override
  public boolean ping(Duration timeout) {
    WebSocket socket = webSocket;
    if (socket == null || !isOpen()) {
      return false;
    }
    CompletableFuture<Void> pong = new CompletableFuture<>();
    pendingPong = pong;
    // one deadline covers both the write and the pong
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      socket.sendPing(ByteBuffer.allocate(0)).get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      long left = Math.max(0, deadline - System.nanoTime());
      pong.get(left, TimeUnit.NANOSECONDS);
      return true;
    } catch (ExecutionException | TimeoutException e) {
      log.debug("Ping on {} failed", config.endpoint(), e);
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public boolean isOpen() {
    WebSocket socket = webSocket;
    return socket != null && !socket.isInputClosed() && !socket.isOutputClosed();
  }

  @Override
  public void close() {
    WebSocket socket = webSocket;
    if (socket == null) {
      return;
    }
    try {
      if (!socket.isOutputClosed()) {
        socket
            .sendClose(WebSocket.NORMAL_CLOSURE, "")
            .get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (ExecutionException | TimeoutException e) {
      log.debug("Graceful close of {} failed, aborting", config.endpoint(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      socket.abort();
    }
  }

  private WebSocket requireSocket() {
    WebSocket socket = webSocket;
    if (socket == null) {
      throw new TransportException("Transport to " + config.endpoint() + " was never opened");
    }
    return socket;
  }

  @Override
  public String describe() {
    return config.endpoint().toString();
  }

  /** Joins partial messages into whole frames, enforcing the frame size cap */
  private class FrameAssembler implements WebSocket.Listener {
    private final TransportListener listener;
    private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();
    private final StringBuilder textBuffer = new StringBuilder();

    private FrameAssembler(TransportListener listener) {
      this.listener = listener;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
      byte[] chunk = new byte[data.remaining()];
      data.get(chunk);
      binaryBuffer.write(chunk, 0, chunk.length);
      if (binaryBuffer.size() > config.maxFrameBytes()) {
        tooLarge(webSocket, binaryBuffer.size());
        return null;
      }
      if (last) {
        listener.onFrame(Frame.binary(binaryBuffer.toByteArray(), clock.instant()));
        binaryBuffer.reset();
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      textBuffer.append(data);
      if (textBuffer.length() > config.maxFrameBytes()) {
        tooLarge(webSocket, textBuffer.length());
        return null;
      }
      if (last) {
        listener.onFrame(Frame.text(textBuffer.toString(), clock.instant()));
        textBuffer.setLength(0);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
      CompletableFuture<Void> pong = pendingPong;
      if (pong != null) {
        pong.complete(null);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      listener.onClosed(statusCode, reason);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      listener.onError(error);
    }

    private void tooLarge(WebSocket webSocket, int size) {
      webSocket.abort();
      listener.onError(
          new TransportException(
              "Frame of " + size + " exceeds limit of " + config.maxFrameBytes() + " bytes"));
    }
  }
}
