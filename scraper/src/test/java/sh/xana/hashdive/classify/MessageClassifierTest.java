package sh.xana.hashdive.classify;

import static sh.xana.hashdive.classify.TestMessages.activeBets;
import static sh.xana.hashdive.classify.TestMessages.dataFrame;
import static sh.xana.hashdive.classify.TestMessages.finishedBets;
import static sh.xana.hashdive.classify.TestMessages.markdown;
import static sh.xana.hashdive.classify.TestMessages.rank;
import static sh.xana.hashdive.classify.TestMessages.traderType;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

@Test
public class MessageClassifierTest {
  private final MessageClassifier classifier = new MessageClassifier();

  private List<MessageTag> classifyAll(List<? extends JsonNode> messages) {
    ClassifierState state = ClassifierState.INITIAL;
    List<MessageTag> tags = new ArrayList<>();
    for (JsonNode message : messages) {
      Classification result = classifier.classify(message, state);
      tags.add(result.tag());
      state = result.state();
    }
    return tags;
  }

  @Test
  public void sameSequenceGivesSameTags() {
    List<JsonNode> messages =
        List.of(
            markdown(traderType("Whale")),
            markdown("Bets big and often."),
            markdown(rank(5, "1.2k")),
            markdown(rank(9, "3.4k")),
            TestMessages.sessionStatus(),
            markdown(rank(12, "10k")),
            markdown(rank(40, "1.1m")),
            markdown(activeBets("1,000", "50")),
            dataFrame("{}"),
            markdown("something new on the page"),
            TestMessages.scriptFinished());

    List<MessageTag> first = classifyAll(messages);
    List<MessageTag> second = classifyAll(messages);

    Assert.assertEquals(second, first);
    Assert.assertEquals(
        first,
        List.of(
            MessageTag.TRADER_TYPE,
            MessageTag.TRADER_TYPE_DESC,
            MessageTag.RANK_1D,
            MessageTag.RANK_7D,
            MessageTag.UNKNOWN,
            MessageTag.RANK_30D,
            MessageTag.RANK_ALLTIME,
            MessageTag.ACTIVE_BETS_SUM,
            MessageTag.ACTIVE_BETS_TABLE,
            MessageTag.UNKNOWN,
            MessageTag.UNKNOWN));
  }

  @Test
  public void rankWindowsFollowArrivalOrderAndReset() {
    ClassifierState state = ClassifierState.INITIAL;
    List<MessageTag> tags = new ArrayList<>();
    for (JsonNode message :
        List.of(
            markdown(rank(1, "5k")),
            markdown(rank(2, "6k")),
            markdown(rank(3, "7k")),
            markdown(rank(4, "8k")),
            markdown("<p>Unrelated</p>"))) {
      Classification result = classifier.classify(message, state);
      tags.add(result.tag());
      state = result.state();
    }

    Assert.assertEquals(
        tags,
        List.of(
            MessageTag.RANK_1D,
            MessageTag.RANK_7D,
            MessageTag.RANK_30D,
            MessageTag.RANK_ALLTIME,
            MessageTag.UNKNOWN));
    Assert.assertEquals(state.rankIndex(), 0);
  }

  @Test
  public void rankSequenceCanStartAgain() {
    List<MessageTag> tags =
        classifyAll(
            List.of(
                markdown(rank(1, "5k")),
                markdown(rank(2, "6k")),
                markdown(rank(3, "7k")),
                markdown(rank(4, "8k")),
                markdown(rank(7, "1k"))));
    Assert.assertEquals(tags.get(4), MessageTag.RANK_1D);
  }

  @Test
  public void descriptionOnlyFollowsTypeLabel() {
    Assert.assertEquals(
        classifyAll(
            List.of(markdown(traderType("Contrarian")), markdown("Bets against the crowd"))),
        List.of(MessageTag.TRADER_TYPE, MessageTag.TRADER_TYPE_DESC));
    Assert.assertEquals(
        classifyAll(List.of(markdown("Bets against the crowd"))), List.of(MessageTag.UNKNOWN));
  }

  @Test
  public void controlMessagesDoNotBreakPairing() {
    Assert.assertEquals(
        classifyAll(
            List.of(
                markdown(traderType("Contrarian")),
                TestMessages.sessionStatus(),
                markdown("Bets against the crowd"))),
        List.of(MessageTag.TRADER_TYPE, MessageTag.UNKNOWN, MessageTag.TRADER_TYPE_DESC));
  }

  @Test
  public void betsTableIsTaggedOncePerCategory() {
    List<MessageTag> tags =
        classifyAll(
            List.of(
                markdown(activeBets("1,200", "30")),
                dataFrame("{\"market\": {\"label\": \"Market\"}}"),
                markdown(finishedBets("800", "−$20")),
                dataFrame("{\"market\": {\"label\": \"Market\"}}"),
                markdown(activeBets("1,200", "30")),
                dataFrame("{\"market\": {\"label\": \"Market\"}}")));

    Assert.assertEquals(
        tags,
        List.of(
            MessageTag.ACTIVE_BETS_SUM,
            MessageTag.ACTIVE_BETS_TABLE,
            MessageTag.FINISHED_BETS_SUM,
            MessageTag.FINISHED_BETS_TABLE,
            MessageTag.ACTIVE_BETS_SUM,
            MessageTag.UNKNOWN));
  }

  @Test
  public void nonTableAfterSummaryUsesUpTheSlot() {
    ClassifierState state = ClassifierState.INITIAL;
    Classification summary = classifier.classify(markdown(activeBets("10", "1")), state);
    Classification next =
        classifier.classify(markdown("<b>Best trade (ROI):</b> >12%<"), summary.state());

    Assert.assertEquals(next.tag(), MessageTag.BEST_TRADE);
    Assert.assertTrue(next.state().activeBetsTableSeen());
  }

  @Test
  public void unknownElementsDoNotDisturbLaterOnes() {
    List<JsonNode> messages = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      messages.add(markdown("<p>filler " + i + "</p>"));
    }
    messages.add(markdown("<div>Sharpe Ratio: <span>1.5</span></div>"));
    messages.add(markdown(traderType("Whale")));
    messages.add(markdown("desc"));

    List<MessageTag> tags = classifyAll(messages);
    Assert.assertEquals(tags.subList(0, 50), Collections.nCopies(50, MessageTag.UNKNOWN));
    Assert.assertEquals(
        tags.subList(50, 53),
        List.of(MessageTag.SHARPE_RATIO, MessageTag.TRADER_TYPE, MessageTag.TRADER_TYPE_DESC));
  }

  @Test
  public void controlMessageKeepsState() {
    ClassifierState state = new ClassifierState(MessageTag.TRADER_TYPE, 0, false, false);
    Classification result = classifier.classify(TestMessages.scriptFinished(), state);

    Assert.assertEquals(result.tag(), MessageTag.UNKNOWN);
    Assert.assertSame(result.state(), state);
    Assert.assertTrue(result.message().deltaPath().isEmpty());
  }

  @Test
  public void deltaPathIsCarried() {
    JsonNode message = markdown("<p>x</p>");
    Classification result = classifier.classify(message, ClassifierState.INITIAL);
    Assert.assertEquals(result.message().deltaPath().size(), 2);
    Assert.assertSame(result.message().message(), message);
  }

  @DataProvider
  public Object[][] signatures() {
    return new Object[][] {
      {"Total Positions", MessageTag.UNKNOWN},
      {"<div>>Total Positions<</div>", MessageTag.STATS_TOTAL_POSITIONS},
      {"<div class=\"label\">Total Positions</div><div>42</div>", MessageTag.STATS_TOTAL_POSITIONS},
      {"<div style=\"x\">Active Since</div>", MessageTag.STATS_ACTIVE_SINCE},
      {"Current Balance\n$1,000", MessageTag.STATS_CURRENT_BALANCE},
      {"<a href=\"https://polymarket.com/profile/0xabc\">View</a>", MessageTag.VIEW_ON_POLYMARKET},
      {"<h3>User Smart Score: 7</h3>", MessageTag.SMART_SCORE_SUMMARY},
      {"{\"title\": \"Historical PnL\"}", MessageTag.HISTORICAL_PNL_CHART},
      {"Traded USD Volume (Last 30d, daily) $1,000", MessageTag.TRADED_VOLUME_30D},
      {"<b>Worst trade (ROI):</b>", MessageTag.WORST_TRADE},
      {"Distribution of ROI weighted by invested capital", MessageTag.DISTRIBUTION_ROI},
      {"hovertemplate: Markets traded: %{r}", MessageTag.MOST_TRADED_CATEGORIES},
      {"hovertemplate: Smart Score: %{r:.2f}", MessageTag.SMART_SCORE_BY_CATEGORY},
      {"hovertemplate: Win Rate: %{r:.2%}", MessageTag.WIN_RATE_BY_CATEGORY},
      {
        "{\"timestamp\": {\"label\": \"Timestamp\"}, \"question\": {\"label\": \"Question\"}}",
        MessageTag.RECENT_TRADES_TABLE
      },
      {"{\"title\": \"Where This Trader Bets Most\"}", MessageTag.WHERE_TRADER_BETS_MOST},
      {"Active Bets without a result", MessageTag.UNKNOWN},
    };
  }

  @Test(dataProvider = "signatures")
  public void contentSignature(String content, MessageTag expected) {
    Assert.assertEquals(MessageClassifier.matchContent(content), expected);
  }

  @Test
  public void metricLabelIsSearched() {
    Classification result =
        classifier.classify(
            TestMessages.metric("Traded USD Volume (Last 30d, daily)", "$12,345"),
            ClassifierState.INITIAL);
    Assert.assertEquals(result.tag(), MessageTag.TRADED_VOLUME_30D);
  }

  @Test
  public void terminalMessageIsDetected() {
    Assert.assertTrue(ForwardMessages.isTerminal(TestMessages.scriptFinished()));
    Assert.assertFalse(ForwardMessages.isTerminal(markdown("FINISHED_SUCCESSFULLY")));
  }
}
