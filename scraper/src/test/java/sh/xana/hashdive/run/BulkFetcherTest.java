package sh.xana.hashdive.run;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import sh.xana.hashdive.common.Utils;
import sh.xana.hashdive.extract.UserRecord;
import sh.xana.hashdive.io.FakeFrameCodec;
import sh.xana.hashdive.io.JsonFileRecordSink;
import sh.xana.hashdive.io.RecordSink;
import sh.xana.hashdive.io.RequestTemplate;
import sh.xana.hashdive.io.Target;
import sh.xana.hashdive.pool.SessionFactory;
import sh.xana.hashdive.pool.SessionPool;
import sh.xana.hashdive.session.FakeTransport;
import sh.xana.hashdive.session.Frame;
import sh.xana.hashdive.session.OpenPolicy;
import sh.xana.hashdive.session.StreamLimits;

@Test
public class BulkFetcherTest {
  private static final OpenPolicy POLICY =
      new OpenPolicy(Duration.ofMillis(100), 1, Duration.ofMillis(1), Duration.ofMillis(50));
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

  private Path tempDir;
  private SessionPool pool;
  private JsonFileRecordSink sink;

  @BeforeMethod
  public void setup() throws IOException {
    tempDir = Files.createTempDirectory("bulk-test");
    sink = new JsonFileRecordSink(tempDir.resolve("out"), tempDir.resolve("dump"));
  }

  @AfterMethod
  public void cleanup() throws IOException {
    if (pool != null) {
      pool.closeAll();
      pool = null;
    }
    FileUtils.deleteDirectory(tempDir.toFile());
  }

  private BulkFetcher newFetcher(List<Frame> replies, StreamLimits limits, boolean refetch) {
    return newFetcher(replies, limits, refetch, sink);
  }

  private BulkFetcher newFetcher(
      List<Frame> replies, StreamLimits limits, boolean refetch, RecordSink output) {
    SessionFactory factory =
        new SessionFactory(() -> new FakeTransport().replyWith(replies), POLICY);
    pool = new SessionPool(factory, 2, Duration.ofMinutes(5));
    ExtractionRunner runner =
        new ExtractionRunner(
            pool,
            factory,
            new FakeFrameCodec(),
            RequestTemplate.loadResource(RequestTemplate.DEFAULT_RESOURCE),
            limits);
    return new BulkFetcher(runner, output, 2, 0, refetch, CLOCK);
  }

  private BulkFetcher pageFetcher(boolean refetch) {
    return newFetcher(
        RunFixtures.frames(RunFixtures.contrarianPage()),
        new StreamLimits(300, Duration.ofSeconds(2), Duration.ofSeconds(10)),
        refetch);
  }

  private JsonNode readRecord(String id) throws IOException {
    return Utils.jsonMapper.readTree(sink.recordPath(id).toFile());
  }

  @Test
  public void existingOutputsAreSkipped() throws Exception {
    sink.write("0x2", new UserRecord("0x2"));

    List<Target> targets = List.of(Target.of("0x1"), Target.of("0x2"), Target.of("0x3"));
    BulkSummary summary = pageFetcher(false).fetchAll(targets);

    Assert.assertEquals(summary, new BulkSummary(3, 2, 1, 0));
    Assert.assertEquals(readRecord("0x1").path("trader_types").get(0).asText(), "Contrarian");
    Assert.assertTrue(readRecord("0x2").path("trader_types").isEmpty());
    Assert.assertTrue(Files.exists(sink.recordPath("0x3")));
  }

  @Test
  public void refetchOverwrites() throws Exception {
    sink.write("0x2", new UserRecord("0x2"));

    BulkSummary summary = pageFetcher(true).fetchAll(List.of(Target.of("0x1"), Target.of("0x2")));

    Assert.assertEquals(summary, new BulkSummary(2, 2, 0, 0));
    Assert.assertEquals(readRecord("0x2").path("trader_types").get(0).asText(), "Contrarian");
  }

  @Test
  public void recordCarriesSourceColumnsAndFetchTime() throws Exception {
    Target target = new Target("0x1", Map.of("label", "whale watch"));

    pageFetcher(false).fetchAll(List.of(target));

    JsonNode record = readRecord("0x1");
    Assert.assertEquals(record.path("user_address").asText(), "0x1");
    Assert.assertEquals(record.path("fetched_at").asText(), "2026-01-02T03:04:05Z");
    Assert.assertEquals(record.path("source_attributes").path("label").asText(), "whale watch");
    Assert.assertEquals(record.path("rank_1d").path("place").asInt(), 12);
    Path dump = tempDir.resolve("dump").resolve("0x1");
    Assert.assertEquals(JsonFileRecordSink.readDump(dump).size(), 12);
  }

  @Test
  public void failedTargetsStillGetARecord() throws Exception {
    BulkFetcher fetcher =
        newFetcher(
            List.of(), new StreamLimits(300, Duration.ofMillis(50), Duration.ofMillis(150)), false);

    BulkSummary summary = fetcher.fetchAll(List.of(Target.of("0x1"), Target.of("0x2")));

    Assert.assertEquals(summary, new BulkSummary(2, 0, 0, 2));
    JsonNode record = readRecord("0x1");
    Assert.assertEquals(record.path("user_address").asText(), "0x1");
    Assert.assertTrue(record.has("smart_score"));
    Assert.assertTrue(record.path("smart_score").isNull());
    Assert.assertFalse(Files.exists(tempDir.resolve("dump").resolve("0x1")));
  }

  @Test
  public void crashingSinkCountsAsFailure() throws Exception {
    RecordSink flaky =
        new RecordSink() {
          @Override
          public boolean exists(String targetId) {
            return sink.exists(targetId);
          }

          @Override
          public void write(String targetId, UserRecord record) throws IOException {
            if (targetId.equals("0x2")) {
              throw new IllegalStateException("disk went away");
            }
            sink.write(targetId, record);
          }

          @Override
          public void dump(String targetId, List<JsonNode> messages) throws IOException {
            sink.dump(targetId, messages);
          }
        };
    BulkFetcher fetcher =
        newFetcher(
            RunFixtures.frames(RunFixtures.contrarianPage()),
            new StreamLimits(300, Duration.ofSeconds(2), Duration.ofSeconds(10)),
            false,
            flaky);

    BulkSummary summary = fetcher.fetchAll(List.of(Target.of("0x1"), Target.of("0x2")));

    Assert.assertEquals(summary, new BulkSummary(2, 1, 0, 1));
    Assert.assertTrue(Files.exists(sink.recordPath("0x1")));
    Assert.assertFalse(Files.exists(sink.recordPath("0x2")));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void concurrencyMustBePositive() {
    new BulkFetcher(null, sink, 0, 0, false, CLOCK);
  }
}
