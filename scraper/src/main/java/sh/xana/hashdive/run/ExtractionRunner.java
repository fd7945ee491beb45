package sh.xana.hashdive.run;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.common.Utils;
import sh.xana.hashdive.io.CodecException;
import sh.xana.hashdive.io.FrameCodec;
import sh.xana.hashdive.io.RequestTemplate;
import sh.xana.hashdive.pool.SessionFactory;
import sh.xana.hashdive.pool.SessionPool;
import sh.xana.hashdive.session.Frame;
import sh.xana.hashdive.session.FrameStream;
import sh.xana.hashdive.session.StreamLimits;
import sh.xana.hashdive.session.StreamSession;

/**
 * Fetches one target: lease a session, send the page request, then read, decode and fold frames
 * into the record until the page is finished or a stream limit hits.
 */
public class ExtractionRunner {
  private static final Logger log = LoggerFactory.getLogger(ExtractionRunner.class);
  private final SessionPool pool;
  private final SessionFactory sessionFactory;
  private final FrameCodec codec;
  private final RequestTemplate template;
  private final StreamLimits limits;

  public ExtractionRunner(
      SessionPool pool,
      SessionFactory sessionFactory,
      FrameCodec codec,
      RequestTemplate template,
      StreamLimits limits) {
    this.pool = pool;
    this.sessionFactory = sessionFactory;
    this.codec = codec;
    this.template = template;
    this.limits = limits;
  }

  public ExtractionResult runExtraction(String targetId) {
    ExtractionPipeline pipeline = new ExtractionPipeline(targetId);

    byte[] request;
    try {
      request = codec.encode(template.toBackMsg(targetId), FrameCodec.BACK_MSG);
    } catch (CodecException e) {
      log.error("{} failed to encode request", targetId, e);
      return ExtractionResult.failed(targetId, pipeline.record(), "encode: " + e.getMessage());
    }

    boolean pooled = true;
    StreamSession session = pool.lease();
    if (session == null) {
      log.warn("{} no pooled session available, opening a direct session", targetId);
      pooled = false;
      session = sessionFactory.openSession();
      if (session == null) {
        return ExtractionResult.failed(targetId, pipeline.record(), "could not open session");
      }
    }

    try {
      return exchange(targetId, session, request, pipeline);
    } finally {
      if (pooled) {
        pool.release(session);
      } else {
        session.close();
      }
    }
  }

  private ExtractionResult exchange(
      String targetId, StreamSession session, byte[] request, ExtractionPipeline pipeline) {
    session.discardPending();
    if (!session.send(request)) {
      return ExtractionResult.failed(targetId, pipeline.record(), "send failed");
    }
    log.debug("{} request sent on {}, waiting for messages", targetId, session.name());

    List<JsonNode> messages = new ArrayList<>();
    FrameStream stream = session.receiveStream(limits);
    int undecodable = 0;
    while (stream.hasNext()) {
      Frame frame = stream.next();
      JsonNode message;
      try {
        message = codec.decode(frame, FrameCodec.FORWARD_MSG);
      } catch (CodecException e) {
        undecodable++;
        log.debug("{} skipping undecodable {}: {}", targetId, frame, e.getMessage());
        continue;
      }
      messages.add(message);
      if (log.isTraceEnabled()) {
        log.trace(
            "{} message {}: {}",
            targetId,
            messages.size(),
            Utils.preview(message.toString(), 200));
      }

      pipeline.accept(message);
      if (pipeline.isComplete()) {
        stream.abandon();
        break;
      }
    }

    pipeline.logSummary();
    boolean success = !messages.isEmpty();
    String error = null;
    if (!success) {
      error = "no messages received, stream ended with " + stream.stopReason();
    } else if (!pipeline.isComplete()) {
      log.warn(
          "{} stream ended with {} before the page finished, record is partial",
          targetId,
          stream.stopReason());
    }
    log.info(
        "{} received {} frames ({} undecodable) in {}ms",
        targetId,
        stream.frameCount(),
        undecodable,
        stream.elapsed().toMillis());
    return new ExtractionResult(
        targetId,
        pipeline.record(),
        success,
        pipeline.isComplete(),
        stream.frameCount(),
        stream.stopReason(),
        error,
        messages);
  }
}
