package sh.xana.hashdive.session;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * One inbound or outbound unit on the wire. The frame takes ownership of the array it is built
 * from and hands out copies, frames are equal when kind, content and receive time match.
 */
public record Frame(@NotNull FrameKind kind, byte[] payload, @NotNull Instant receivedAt) {

  public static Frame binary(byte[] payload, Instant receivedAt) {
    return new Frame(FrameKind.BINARY, payload, receivedAt);
  }

  public static Frame text(String text, Instant receivedAt) {
    return new Frame(FrameKind.TEXT, text.getBytes(StandardCharsets.UTF_8), receivedAt);
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public int size() {
    return payload.length;
  }

  public String text() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Frame)) {
      return false;
    }
    Frame other = (Frame) o;
    return kind == other.kind
        && Arrays.equals(payload, other.payload)
        && receivedAt.equals(other.receivedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, Arrays.hashCode(payload), receivedAt);
  }

  @Override
  public String toString() {
    return "Frame{" + kind + ", " + payload.length + " bytes, " + receivedAt + "}";
  }
}
