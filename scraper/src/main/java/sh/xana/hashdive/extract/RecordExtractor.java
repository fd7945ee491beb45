package sh.xana.hashdive.extract;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.xana.hashdive.classify.ClassifiedMessage;
import sh.xana.hashdive.classify.MessageTag;

/** Routes each classified element to the routine for its tag */
public class RecordExtractor {
  private static final Logger log = LoggerFactory.getLogger(RecordExtractor.class);
  public static final Map<MessageTag, FieldExtractor> EXTRACTORS =
      ImmutableMap.<MessageTag, FieldExtractor>builder()
          .put(MessageTag.TRADER_TYPE, ProfileExtractors::traderType)
          .put(MessageTag.TRADER_TYPE_DESC, ProfileExtractors::traderTypeDescription)
          .put(MessageTag.STATS_TOTAL_POSITIONS, ProfileExtractors::totalPositions)
          .put(MessageTag.STATS_ACTIVE_SINCE, ProfileExtractors::activeSince)
          .put(MessageTag.STATS_CURRENT_BALANCE, ProfileExtractors::currentBalance)
          .put(MessageTag.VIEW_ON_POLYMARKET, ProfileExtractors::polymarketUrl)
          .put(MessageTag.RANK_1D, ProfileExtractors::rank1d)
          .put(MessageTag.RANK_7D, ProfileExtractors::rank7d)
          .put(MessageTag.RANK_30D, ProfileExtractors::rank30d)
          .put(MessageTag.RANK_ALLTIME, ProfileExtractors::rankAllTime)
          .put(MessageTag.SMART_SCORE_SUMMARY, ProfileExtractors::smartScoreSummary)
          .put(MessageTag.SHARPE_RATIO, ProfileExtractors::sharpeRatio)
          .put(MessageTag.TRADED_VOLUME_30D, ProfileExtractors::tradedVolume)
          .put(MessageTag.ACTIVE_BETS_SUM, ProfileExtractors::activeBets)
          .put(MessageTag.FINISHED_BETS_SUM, ProfileExtractors::finishedBets)
          .put(MessageTag.BEST_TRADE, ProfileExtractors::bestTrade)
          .put(MessageTag.WORST_TRADE, ProfileExtractors::worstTrade)
          .put(MessageTag.WHERE_TRADER_BETS_MOST, ProfileExtractors::whereTraderBetsMost)
          .put(
              MessageTag.MOST_TRADED_CATEGORIES,
              ProfileExtractors.categoryMetric(UserRecord.MOST_TRADED_CATEGORIES))
          .put(
              MessageTag.SMART_SCORE_BY_CATEGORY,
              ProfileExtractors.categoryMetric(UserRecord.SMART_SCORE_CATEGORIES))
          .put(
              MessageTag.WIN_RATE_BY_CATEGORY,
              ProfileExtractors.categoryMetric(UserRecord.WIN_RATE_CATEGORIES))
          .build();

  /**
   * @return the fields found in this element. Empty for tags without a routine, and whatever was
   *     extracted so far if the routine fails
   */
  public UserRecord extract(ClassifiedMessage classified) {
    UserRecord partial = new UserRecord();
    FieldExtractor extractor = EXTRACTORS.get(classified.tag());
    if (extractor == null) {
      return partial;
    }
    try {
      extractor.extract(classified.message(), partial);
    } catch (RuntimeException e) {
      log.warn("Failed to extract {} at {}", classified.tag(), classified.deltaPath(), e);
    }
    return partial;
  }
}
