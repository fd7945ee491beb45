package sh.xana.hashdive;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;
import sh.xana.hashdive.common.SetupException;
import sh.xana.hashdive.extract.UserRecord;
import sh.xana.hashdive.io.Credentials;
import sh.xana.hashdive.io.ExternalProcessFrameCodec;
import sh.xana.hashdive.io.FrameCodec;
import sh.xana.hashdive.io.JsonFileRecordSink;
import sh.xana.hashdive.io.PropertiesCredentialSource;
import sh.xana.hashdive.io.RequestTemplate;
import sh.xana.hashdive.io.Target;
import sh.xana.hashdive.io.TargetListReader;
import sh.xana.hashdive.pool.SessionFactory;
import sh.xana.hashdive.pool.SessionPool;
import sh.xana.hashdive.pool.SessionPoolSweeper;
import sh.xana.hashdive.run.BulkFetcher;
import sh.xana.hashdive.run.BulkSummary;
import sh.xana.hashdive.run.DumpReplayer;
import sh.xana.hashdive.run.ExtractionRunner;
import sh.xana.hashdive.session.SessionConfig;
import sh.xana.hashdive.session.WebSocketTransport;

public class ScraperMain {
  private static final Logger log = LoggerFactory.getLogger(ScraperMain.class);

  public static void main(String[] args) {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    System.exit(run(args));
  }

  /** @return process exit code, non zero only when setup failed */
  public static int run(String[] args) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println("error: " + e.getMessage());
      System.err.print(CliOptions.USAGE);
      return 1;
    }

    try {
      ScraperConfig config = ScraperConfig.load(options.configPath());
      options.applyTo(config);
      switch (options.mode()) {
        case FETCH -> fetch(config, options);
        case REPLAY -> replay(config, options);
      }
      return 0;
    } catch (SetupException | IllegalArgumentException e) {
      log.error("Setup failed: {}", e.getMessage(), e);
      return 1;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted, stopping");
      return 1;
    }
  }

  private static void fetch(ScraperConfig config, CliOptions options) throws InterruptedException {
    List<Target> targets = loadTargets(config, options);
    Map<String, String> cookies =
        Credentials.require(
            new PropertiesCredentialSource(config.getCredentialsDir()),
            config.getCredentialsDomain(),
            Credentials.REQUIRED_COOKIES);
    SessionConfig sessionConfig =
        SessionConfig.forCookies(
            config.getEndpoint(),
            config.getOrigin(),
            config.getUserAgent(),
            cookies,
            config.getMaxFrameBytes());
    log.info("Session config {}", sessionConfig);
    RequestTemplate template =
        config.getRequestTemplate() != null
            ? RequestTemplate.load(config.getRequestTemplate())
            : RequestTemplate.loadResource(RequestTemplate.DEFAULT_RESOURCE);
    FrameCodec codec =
        new ExternalProcessFrameCodec(
            config.getEncoderCommand(), config.getDecoderCommand(), config.getCodecTimeout());
    JsonFileRecordSink sink =
        new JsonFileRecordSink(
            config.getOutputDir(), config.isDumpEnabled() ? config.getDumpDir() : null);

    HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(config.getOpenPolicy().connectTimeout()).build();
    SessionFactory sessionFactory =
        new SessionFactory(
            () -> new WebSocketTransport(httpClient, sessionConfig), config.getOpenPolicy());

    try (SessionPool pool =
            new SessionPool(sessionFactory, config.getPoolSize(), config.getPoolTtl());
        SessionPoolSweeper sweeper =
            new SessionPoolSweeper(pool, config.getPoolSweepInterval().toMillis())) {
      sweeper.start();
      ExtractionRunner runner =
          new ExtractionRunner(pool, sessionFactory, codec, template, config.getStreamLimits());
      BulkFetcher fetcher =
          new BulkFetcher(
              runner,
              sink,
              config.getConcurrency(),
              config.getPacingMillis(),
              config.isRefetch(),
              Clock.systemUTC());
      BulkSummary summary = fetcher.fetchAll(targets);
      log.info("Summary {}", summary);
    }
  }

  private static List<Target> loadTargets(ScraperConfig config, CliOptions options) {
    if (options.target() != null) {
      return List.of(Target.of(options.target()));
    }
    Path input = config.getInput();
    if (input == null) {
      throw new SetupException("Either --input or --target is required");
    }
    return new TargetListReader().read(input, config.getOffset(), config.getLimit());
  }

  private static void replay(ScraperConfig config, CliOptions options) {
    Path dumpDir = config.getDumpDir();
    List<String> targetIds = new ArrayList<>();
    if (options.target() != null) {
      targetIds.add(options.target());
    } else {
      try (Stream<Path> dirs = Files.list(dumpDir)) {
        dirs.filter(Files::isDirectory)
            .map(p -> p.getFileName().toString())
            .sorted()
            .forEach(targetIds::add);
      } catch (IOException e) {
        throw new SetupException("Cannot list dump directory " + dumpDir, e);
      }
    }

    JsonFileRecordSink sink = new JsonFileRecordSink(config.getOutputDir(), null);
    DumpReplayer replayer = new DumpReplayer();
    int replayed = 0;
    for (String targetId : targetIds) {
      try {
        UserRecord record = replayer.replay(dumpDir, targetId);
        sink.write(targetId, record);
        replayed++;
      } catch (IOException e) {
        log.error("Failed to replay {}", targetId, e);
      }
    }
    log.info("Replayed {} of {} dumps from {}", replayed, targetIds.size(), dumpDir);
  }
}
