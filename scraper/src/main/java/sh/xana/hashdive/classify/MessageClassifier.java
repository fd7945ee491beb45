package sh.xana.hashdive.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tags each rendered element of the trader profile page. Most elements carry a unique marker in
 * their markup, the rest are only recognizable by the element before them, which is what {@link
 * ClassifierState} remembers.
 *
 * <p>Only messages carrying a new element take part. Control messages (session info, script
 * finished, etc) are {@link MessageTag#UNKNOWN} and leave the state untouched so they can arrive
 * anywhere in the sequence.
 */
public class MessageClassifier {
  private static final Logger log = LoggerFactory.getLogger(MessageClassifier.class);

  /** Checked in order, first match wins */
  private static final List<Signature> SIGNATURES =
      ImmutableList.of(
          new Signature(MessageTag.TRADER_TYPE, c -> c.contains(":material/")),
          new Signature(MessageTag.STATS_TOTAL_POSITIONS, c -> c.contains(">Total Positions<")),
          new Signature(MessageTag.STATS_ACTIVE_SINCE, c -> c.contains(">Active Since<")),
          new Signature(
              MessageTag.STATS_CURRENT_BALANCE,
              c -> c.contains("Current Balance\n") || c.contains(">Current Balance<")),
          new Signature(
              MessageTag.VIEW_ON_POLYMARKET,
              c -> c.contains("<a href=\"https://polymarket.com/profile/")),
          new Signature(MessageTag.RANK_1D, c -> c.contains(">Rank: ")),
          new Signature(MessageTag.SMART_SCORE_SUMMARY, c -> c.contains("User Smart Score:")),
          new Signature(MessageTag.HISTORICAL_PNL_CHART, c -> c.contains("Historical PnL")),
          new Signature(MessageTag.SHARPE_RATIO, c -> c.contains("Sharpe Ratio:")),
          new Signature(
              MessageTag.TRADED_VOLUME_30D,
              c -> c.contains("Traded USD Volume (Last 30d, daily)")),
          new Signature(
              MessageTag.ACTIVE_BETS_SUM, c -> c.contains("Active Bets") && c.contains("PnL:")),
          new Signature(
              MessageTag.FINISHED_BETS_SUM,
              c -> c.contains("Finished Bets") && c.contains("PnL:")),
          new Signature(MessageTag.BEST_TRADE, c -> c.contains("Best trade (ROI):")),
          new Signature(MessageTag.WORST_TRADE, c -> c.contains("Worst trade (ROI):")),
          new Signature(
              MessageTag.DISTRIBUTION_ROI,
              c -> c.contains("Distribution of ROI weighted by invested capital")),
          new Signature(MessageTag.MOST_TRADED_CATEGORIES, c -> c.contains("Markets traded:")),
          new Signature(
              MessageTag.SMART_SCORE_BY_CATEGORY, c -> c.contains("Smart Score: %{r:.2f}")),
          new Signature(MessageTag.WIN_RATE_BY_CATEGORY, c -> c.contains("Win Rate: %{r:.2%}")),
          new Signature(
              MessageTag.RECENT_TRADES_TABLE,
              c ->
                  c.contains("\"timestamp\": {\"label\": \"Timestamp\"")
                      && c.contains("\"question\": {\"label\": \"Question\"")),
          new Signature(
              MessageTag.WHERE_TRADER_BETS_MOST, c -> c.contains("Where This Trader Bets Most")));

  private static final List<MessageTag> RANK_SEQUENCE =
      ImmutableList.of(
          MessageTag.RANK_1D, MessageTag.RANK_7D, MessageTag.RANK_30D, MessageTag.RANK_ALLTIME);

  /**
   * Pure function of the message and the state, the same inputs always give the same tag and
   * successor state
   */
  public Classification classify(JsonNode message, ClassifierState state) {
    List<Integer> deltaPath = ForwardMessages.deltaPath(message);
    JsonNode element = ForwardMessages.newElement(message);
    if (!element.isObject()) {
      return new Classification(
          new ClassifiedMessage(MessageTag.UNKNOWN, message, deltaPath), state);
    }

    Classification result;
    try {
      result = classifyElement(element, message, deltaPath, state);
    } catch (RuntimeException e) {
      log.error("Error classifying element at {}", deltaPath, e);
      result =
          new Classification(
              new ClassifiedMessage(MessageTag.UNKNOWN, message, deltaPath),
              state.withLastTag(MessageTag.UNKNOWN));
    }
    log.trace("Classified element {} as {}", deltaPath, result.tag());
    return result;
  }

  private Classification classifyElement(
      JsonNode element, JsonNode message, List<Integer> deltaPath, ClassifierState state) {
    MessageTag lastTag = state.lastTag();

    if (lastTag == MessageTag.TRADER_TYPE) {
      return result(MessageTag.TRADER_TYPE_DESC, message, deltaPath, state);
    }

    if (state.inRankSequence()) {
      int index = state.rankIndex();
      MessageTag tag = RANK_SEQUENCE.get(index);
      int next = index + 1 == RANK_SEQUENCE.size() ? 0 : index + 1;
      return result(tag, message, deltaPath, state.withRankIndex(next));
    }

    // The element right after a bets summary is its table, once per category. Anything else
    // in that slot still uses up the one-shot and is classified by content
    if (lastTag == MessageTag.ACTIVE_BETS_SUM && !state.activeBetsTableSeen()) {
      state = state.withActiveBetsTableSeen();
      if (ForwardMessages.hasDataFrame(element)) {
        return result(MessageTag.ACTIVE_BETS_TABLE, message, deltaPath, state);
      }
    } else if (lastTag == MessageTag.FINISHED_BETS_SUM && !state.finishedBetsTableSeen()) {
      state = state.withFinishedBetsTableSeen();
      if (ForwardMessages.hasDataFrame(element)) {
        return result(MessageTag.FINISHED_BETS_TABLE, message, deltaPath, state);
      }
    }

    MessageTag tag = matchContent(ForwardMessages.searchableContent(element));
    if (tag == MessageTag.RANK_1D) {
      state = state.withRankIndex(1);
    }
    return result(tag, message, deltaPath, state);
  }

  static MessageTag matchContent(String content) {
    for (Signature signature : SIGNATURES) {
      if (signature.matcher().test(content)) {
        return signature.tag();
      }
    }
    return MessageTag.UNKNOWN;
  }

  private static Classification result(
      MessageTag tag, JsonNode message, List<Integer> deltaPath, ClassifierState state) {
    return new Classification(
        new ClassifiedMessage(tag, message, deltaPath), state.withLastTag(tag));
  }

  private record Signature(MessageTag tag, Predicate<String> matcher) {}
}
