package sh.xana.hashdive.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.Utils;

/**
 * Runs the protobuf encoder and decoder scripts as child processes, one per call. The schema
 * name is appended as the last argument. The encoder reads JSON on stdin and writes the binary
 * message, the decoder reads base64 on stdin and writes JSON.
 */
public class ExternalProcessFrameCodec implements FrameCodec {
  private static final Logger log = LoggerFactory.getLogger(ExternalProcessFrameCodec.class);
  private final List<String> encoderCommand;
  private final List<String> decoderCommand;
  private final Duration timeout;

  public ExternalProcessFrameCodec(
      List<String> encoderCommand, List<String> decoderCommand, Duration timeout) {
    this.encoderCommand = List.copyOf(encoderCommand);
    this.decoderCommand = List.copyOf(decoderCommand);
    this.timeout = timeout;
  }

  @Override
  public byte[] encode(JsonNode request, String schemaName) {
    byte[] input;
    try {
      input =
          Utils.jsonMapper
              .writer()
              .without(SerializationFeature.INDENT_OUTPUT)
              .writeValueAsBytes(request);
    } catch (JsonProcessingException e) {
      throw new CodecException("Cannot serialize request", schemaName, e);
    }
    byte[] encoded = run(encoderCommand, input, schemaName);
    if (encoded.length == 0) {
      throw new CodecException("Encoder produced no output", schemaName);
    }
    log.debug("Encoded {} request into {} bytes", schemaName, encoded.length);
    return encoded;
  }

  @Override
  public JsonNode decodeBinary(byte[] payload, String schemaName) {
    byte[] base64 = Base64.getEncoder().encode(payload);
    byte[] output = run(decoderCommand, base64, schemaName);
    try {
      return Utils.jsonMapper.readTree(output);
    } catch (IOException e) {
      throw new CodecException(
          "Decoder output is not JSON: "
              + Utils.preview(new String(output, StandardCharsets.UTF_8), 200),
          schemaName,
          e);
    }
  }

  private byte[] run(List<String> command, byte[] input, String schemaName) {
    List<String> fullCommand = new ArrayList<>(command);
    fullCommand.add(schemaName);

    Process process;
    try {
      process = new ProcessBuilder(fullCommand).start();
    } catch (IOException e) {
      throw new CodecException("Cannot start " + fullCommand, schemaName, e);
    }

    try {
      // pipes are pumped off this thread so a stuck child cannot outlast the timeout
      CompletableFuture<String> stderr =
          CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));
      CompletableFuture<byte[]> stdout =
          CompletableFuture.supplyAsync(() -> readOutput(process.getInputStream()));
      CompletableFuture<Void> stdin =
          CompletableFuture.runAsync(() -> writeInput(process.getOutputStream(), input));

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new CodecException("Timed out after " + timeout + " running " + command, schemaName);
      }
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new CodecException(
            "Exit code " + exitCode + " from " + command + ": " + stderr.join().trim(), schemaName);
      }
      stdin.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new CodecException("I/O with " + command + " failed", schemaName, e.getCause());
    } catch (TimeoutException e) {
      throw new CodecException(
          "Output of " + command + " still open after the process exited", schemaName, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CodecException("Interrupted running " + command, schemaName, e);
    } finally {
      process.destroyForcibly();
    }
  }

  private static byte[] readOutput(InputStream in) {
    try (in) {
      return IOUtils.toByteArray(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeInput(OutputStream out, byte[] input) {
    try (out) {
      out.write(input);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static String readQuietly(InputStream in) {
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      return "(stderr unavailable: " + e.getMessage() + ")";
    }
  }
}
