package sh.xana.hashdive.extract;

import static sh.xana.hashdive.classify.TestMessages.markdown;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.testng.Assert;
import org.testng.annotations.Test;
import sh.xana.hashdive.classify.ClassifiedMessage;
import sh.xana.hashdive.classify.MessageTag;
import sh.xana.hashdive.classify.TestMessages;
import sh.xana.hashdive.extract.UserRecord.ActiveSince;
import sh.xana.hashdive.extract.UserRecord.BetSummary;
import sh.xana.hashdive.extract.UserRecord.RankWindow;
import sh.xana.hashdive.extract.UserRecord.TradeRoi;

@Test
public class ProfileExtractorsTest {
  private final RecordExtractor extractor = new RecordExtractor();

  private UserRecord extract(MessageTag tag, JsonNode message) {
    return extractor.extract(new ClassifiedMessage(tag, message, List.of(0, 1)));
  }

  @Test
  public void traderTypeLabelDropsIconAndCount() {
    String badge = ":violet-badge[:material/trending_down: Contrarian (12)]";
    Assert.assertEquals(ProfileExtractors.traderTypeLabel(badge), "Contrarian");
    Assert.assertEquals(ProfileExtractors.traderTypeLabel(":blue-badge[Whale]"), "Whale");
    Assert.assertNull(ProfileExtractors.traderTypeLabel("no badge here"));
  }

  @Test
  public void traderTypeAndDescription() {
    UserRecord type =
        extract(MessageTag.TRADER_TYPE, markdown(TestMessages.traderType("Contrarian")));
    Assert.assertEquals(type.getTraderTypes(), List.of("Contrarian"));

    UserRecord desc =
        extract(
            MessageTag.TRADER_TYPE_DESC,
            markdown("<p>Often bets <b>against</b> the crowd.</p>"));
    Assert.assertEquals(desc.getTraderTypeDescriptions(), List.of("Often bets against the crowd."));
  }

  @Test
  public void statsCards() {
    UserRecord positions =
        extract(
            MessageTag.STATS_TOTAL_POSITIONS,
            markdown("<div class=\"label\">Total Positions</div><div class=\"value\">42</div>"));
    Assert.assertEquals(positions.getTotalPositions(), Integer.valueOf(42));

    UserRecord since =
        extract(
            MessageTag.STATS_ACTIVE_SINCE,
            markdown(
                "<div>Active Since</div><div style=\"color: #312e81;\">March 2024</div>"
                    + "<div style=\"color: #1e1b4b;\">215 days</div>"));
    Assert.assertEquals(since.getActiveSince(), new ActiveSince("March 2024", 215));

    UserRecord balance =
        extract(
            MessageTag.STATS_CURRENT_BALANCE,
            markdown("Current Balance\n<span>12,345.67</span>"));
    Assert.assertEquals(balance.getCurrentBalance(), 12345.67, 0.0001);
  }

  @Test
  public void polymarketLink() {
    UserRecord record =
        extract(
            MessageTag.VIEW_ON_POLYMARKET,
            markdown(
                "<a href=\"https://example.com\">Other</a>"
                    + "<a href=\"https://polymarket.com/profile/0xabc\">View on Polymarket</a>"));
    Assert.assertEquals(record.getPolymarketUrl(), "https://polymarket.com/profile/0xabc");
  }

  @Test
  public void rankWithSuffixedAmount() {
    UserRecord record =
        extract(MessageTag.RANK_7D, markdown(TestMessages.rank(12, "1.5k")));
    Assert.assertEquals(record.getRank7d(), new RankWindow(12, 1500.0));
    Assert.assertNull(record.getRank1d());

    UserRecord millions =
        extract(MessageTag.RANK_ALLTIME, markdown(TestMessages.rank(3, "2.25M")));
    Assert.assertEquals(millions.getRankAllTime(), new RankWindow(3, 2_250_000.0));
  }

  @Test
  public void smartScoreWithNegativePnl() {
    UserRecord record =
        extract(
            MessageTag.SMART_SCORE_SUMMARY,
            markdown(
                "<h3>User Smart Score: <strong>7.5</strong></h3>"
                    + "<p>Total PnL: <strong>−$1,234.50</strong></p>"));
    Assert.assertEquals(record.getSmartScore(), 7.5, 0.0001);
    Assert.assertEquals(record.getTotalPnl(), -1234.5, 0.0001);
  }

  @Test
  public void sharpeAndVolume() {
    UserRecord sharpe =
        extract(MessageTag.SHARPE_RATIO, markdown("<div>Sharpe Ratio: <span>-0.42</span></div>"));
    Assert.assertEquals(sharpe.getSharpeRatio(), -0.42, 0.0001);

    UserRecord volume =
        extract(
            MessageTag.TRADED_VOLUME_30D,
            TestMessages.metric("Traded USD Volume (Last 30d, daily)", "$98,765"));
    Assert.assertEquals(volume.getTradedVolume30d(), 98765.0, 0.0001);
  }

  @Test
  public void betSummaries() {
    UserRecord active =
        extract(MessageTag.ACTIVE_BETS_SUM, markdown(TestMessages.activeBets("1,200.50", "30")));
    Assert.assertEquals(active.getActiveBets(), new BetSummary(1200.5, 30.0));

    UserRecord finished =
        extract(MessageTag.FINISHED_BETS_SUM, markdown(TestMessages.finishedBets("800", "−$20")));
    Assert.assertEquals(finished.getFinishedBets(), new BetSummary(800.0, -20.0));
  }

  @Test
  public void tradeRoiWithUnicodeMinus() {
    UserRecord record =
        extract(
            MessageTag.WORST_TRADE,
            markdown("<b>Worst trade (ROI):</b> <span>−85.5%</span> (−$1,000)"));
    Assert.assertEquals(record.getWorstTrade(), new TradeRoi(-85.5, -1000.0));

    UserRecord best =
        extract(
            MessageTag.BEST_TRADE,
            markdown("<b>Best trade (ROI):</b> <span>+310%</span> ($2,500.25)"));
    Assert.assertEquals(best.getBestTrade(), new TradeRoi(310.0, 2500.25));
  }

  @Test
  public void barChartValuesAreRounded() {
    UserRecord record =
        extract(
            MessageTag.WHERE_TRADER_BETS_MOST,
            TestMessages.plotly(
                "{\"data\": [{\"type\": \"bar\", \"x\": [\"Politics\", \"Sports\", \"Crypto\"],"
                    + " \"y\": [12.3456, 3, \"n/a\"]}]}"));
    Assert.assertEquals(record.getWhereTraderBetsMost(), Map.of("Politics", 12.35, "Sports", 3.0));
  }

  @Test
  public void radarDropsClosingPoint() {
    UserRecord record =
        extract(
            MessageTag.WIN_RATE_BY_CATEGORY,
            TestMessages.plotly(
                "{\"data\": [{\"type\": \"scatterpolar\", \"theta\": [\"A\", \"B\", \"C\", \"A\"],"
                    + " \"r\": [0.5, 0.25, 0.75, 0.5]}]}"));
    Map<String, Double> series = record.getCategoryMetrics().get(UserRecord.WIN_RATE_CATEGORIES);
    Assert.assertEquals(series, Map.of("A", 0.5, "B", 0.25, "C", 0.75));
    Assert.assertEquals(List.copyOf(series.keySet()), List.of("A", "B", "C"));
  }

  @Test
  public void oversizedCountsOnlyDropThatField() {
    UserRecord rank =
        extract(
            MessageTag.RANK_1D,
            markdown(
                "<div style=\"font-weight: 600\">Rank: #99999999999</div><div>$1.5k</div>"));
    Assert.assertEquals(rank.getRank1d(), new RankWindow(null, 1500.0));

    UserRecord since =
        extract(
            MessageTag.STATS_ACTIVE_SINCE,
            markdown(
                "<div>Active Since</div><div style=\"color: #312e81;\">March 2024</div>"
                    + "<div style=\"color: #1e1b4b;\">3000000000 days</div>"));
    Assert.assertEquals(since.getActiveSince(), new ActiveSince("March 2024", null));

    Assert.assertEquals(MarkupPatterns.parseInteger("2,147,483,647"), Integer.valueOf(2147483647));
    Assert.assertNull(MarkupPatterns.parseInteger("2147483648"));
    Assert.assertEquals(MarkupPatterns.parseInteger("007"), Integer.valueOf(7));
    Assert.assertEquals(MarkupPatterns.parseInteger("0"), Integer.valueOf(0));
  }

  @Test
  public void malformedElementsLeaveFieldsEmpty() {
    Assert.assertNull(
        extract(MessageTag.RANK_1D, markdown("<div>Rank: unranked</div>")).getRank1d());
    UserRecord score =
        extract(
            MessageTag.SMART_SCORE_SUMMARY,
            markdown("User Smart Score: <strong>n/a</strong>"));
    Assert.assertNull(score.getSmartScore());
    Assert.assertNull(score.getTotalPnl());
    Assert.assertNull(
        extract(MessageTag.WHERE_TRADER_BETS_MOST, TestMessages.plotly("{not json"))
            .getWhereTraderBetsMost());
    Assert.assertTrue(
        extract(MessageTag.SMART_SCORE_BY_CATEGORY, TestMessages.plotly(""))
            .getCategoryMetrics()
            .isEmpty());
  }

  @Test
  public void tagsWithoutRoutineGiveEmptyRecord() {
    Assert.assertEquals(
        extract(MessageTag.RECENT_TRADES_TABLE, TestMessages.dataFrame("{}"))
            .getPopulatedFieldCount(),
        0);
    Assert.assertEquals(extract(MessageTag.UNKNOWN, markdown("x")).getPopulatedFieldCount(), 0);
  }
}
