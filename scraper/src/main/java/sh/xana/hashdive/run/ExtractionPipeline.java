package sh.xana.hashdive.run;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.classify.Classification;
import sh.xana.hashdive.classify.ClassifiedMessage;
import sh.xana.hashdive.classify.ClassifierState;
import sh.xana.hashdive.classify.ForwardMessages;
import sh.xana.hashdive.classify.MessageClassifier;
import sh.xana.hashdive.classify.MessageTag;
import sh.xana.hashdive.extract.RecordAggregator;
import sh.xana.hashdive.extract.RecordExtractor;
import sh.xana.hashdive.extract.UserRecord;

/**
 * Classify, extract and merge for a single run. Messages must be fed in arrival order. Not
 * thread safe, every run gets its own instance.
 */
public class ExtractionPipeline {
  private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);
  private final MessageClassifier classifier;
  private final RecordExtractor extractor;
  private final UserRecord record;
  private final Map<MessageTag, Integer> histogram = new EnumMap<>(MessageTag.class);
  private ClassifierState state = ClassifierState.INITIAL;
  private boolean complete = false;
  private int messageCount = 0;

  public ExtractionPipeline(String targetId) {
    this(targetId, new MessageClassifier(), new RecordExtractor());
  }

  public ExtractionPipeline(
      String targetId, MessageClassifier classifier, RecordExtractor extractor) {
    this.classifier = classifier;
    this.extractor = extractor;
    this.record = new UserRecord(targetId);
  }

  public ClassifiedMessage accept(JsonNode message) {
    messageCount++;
    if (ForwardMessages.isTerminal(message)) {
      log.debug("Script finished after {} messages", messageCount);
      complete = true;
    }

    Classification classification = classifier.classify(message, state);
    state = classification.state();
    ClassifiedMessage classified = classification.message();
    histogram.merge(classified.tag(), 1, Integer::sum);

    UserRecord partial = extractor.extract(classified);
    RecordAggregator.merge(record, partial);
    return classified;
  }

  /** The server signalled it finished rendering */
  public boolean isComplete() {
    return complete;
  }

  public UserRecord record() {
    return record;
  }

  public Map<MessageTag, Integer> histogram() {
    return Collections.unmodifiableMap(histogram);
  }

  public int messageCount() {
    return messageCount;
  }

  public void logSummary() {
    log.info("{} message types found: {}", record.getUserAddress(), histogram);
    log.info(
        "{} extracted {} non-null fields from {} messages",
        record.getUserAddress(),
        record.getPopulatedFieldCount(),
        messageCount);
  }
}
