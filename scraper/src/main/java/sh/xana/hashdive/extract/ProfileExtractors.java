package sh.xana.hashdive.extract;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import sh.xana.hashdive.classify.ForwardMessages;
import sh.xana.hashdive.extract.UserRecord.ActiveSince;
import sh.xana.hashdive.extract.UserRecord.BetSummary;
import sh.xana.hashdive.extract.UserRecord.RankWindow;
import sh.xana.hashdive.extract.UserRecord.TradeRoi;

/**
 * One routine per element type. Each only reads its own element and fills the fields it can
 * find, so a changed page layout breaks single fields instead of the whole record
 */
public class ProfileExtractors {
  private static final Pattern TRADER_TYPE = Pattern.compile(":.*?\\[(.*?)\\]");
  private static final Pattern MATERIAL_ICON = Pattern.compile(":material/\\S+\\s*");
  private static final Pattern PARENTHESIZED = Pattern.compile("\\s*\\([^)]+\\)\\s*");
  private static final Pattern TOTAL_POSITIONS = Pattern.compile(">(\\d+)</div>");
  private static final Pattern ACTIVE_SINCE_MONTH =
      Pattern.compile("color: #312e81;\">([A-Za-z]+ \\d{4})</div>");
  private static final Pattern ACTIVE_SINCE_DAYS =
      Pattern.compile("color: #1e1b4b;\">(\\d+) days</div>");
  private static final Pattern CURRENT_BALANCE = Pattern.compile("<span>([\\d,]+\\.?\\d*)</span>");
  private static final Pattern RANK_PLACE = Pattern.compile("Rank: #(\\d+)");
  private static final Pattern RANK_AMOUNT = Pattern.compile("\\$([\\d.]+[kKmM]?)");
  private static final Pattern SMART_SCORE =
      Pattern.compile("Smart Score: <strong>([\\d.]+)</strong>");
  private static final Pattern TOTAL_PNL =
      Pattern.compile("Total PnL: <strong>([+−-]?)\\$([\\d,]+\\.?\\d*)</strong>");
  private static final Pattern SHARPE_RATIO =
      Pattern.compile("Sharpe Ratio: <span>([+−-]?[\\d.]+)</span>");
  private static final Pattern TRADED_VOLUME = Pattern.compile("\\$([\\d,]+)");
  private static final Pattern BETS_AMOUNT =
      Pattern.compile("font-size: 26px[^>]*>\\s*\\$([\\d,]+\\.?\\d*)");
  private static final Pattern BETS_PNL =
      Pattern.compile("PnL:.*?<span[^>]*>\\s*([+−-]?)\\$([\\d,]+\\.?\\d*)");
  private static final Pattern TRADE_ROI_PERCENT = Pattern.compile(">([+−-]?[\\d,]+\\.?\\d*)%<");
  private static final Pattern TRADE_ROI_AMOUNT =
      Pattern.compile("\\(([+−-]?)\\$([\\d,]+\\.?\\d*)\\)");
  private static final String POLYMARKET_PROFILE = "https://polymarket.com/profile/";

  private ProfileExtractors() {}

  public static void traderType(JsonNode message, UserRecord partial) {
    String label = traderTypeLabel(ForwardMessages.markdownBody(message));
    if (StringUtils.isNotEmpty(label)) {
      partial.getTraderTypes().add(label);
    }
  }

  /** ":violet-badge[:material/trending_down: Contrarian (12)]" to "Contrarian" */
  @Nullable
  static String traderTypeLabel(String body) {
    String label = MarkupPatterns.firstGroup(TRADER_TYPE, body);
    if (label == null) {
      return null;
    }
    label = MATERIAL_ICON.matcher(label).replaceAll("");
    label = PARENTHESIZED.matcher(label).replaceAll("");
    return label.trim();
  }

  public static void traderTypeDescription(JsonNode message, UserRecord partial) {
    String body = ForwardMessages.markdownBody(message);
    if (StringUtils.isBlank(body)) {
      return;
    }
    String text = Jsoup.parseBodyFragment(body).text();
    partial.getTraderTypeDescriptions().add(StringUtils.isNotBlank(text) ? text : body.trim());
  }

  public static void totalPositions(JsonNode message, UserRecord partial) {
    partial.setTotalPositions(
        MarkupPatterns.parseInteger(
            MarkupPatterns.firstGroup(TOTAL_POSITIONS, ForwardMessages.markdownBody(message))));
  }

  public static void activeSince(JsonNode message, UserRecord partial) {
    String body = ForwardMessages.markdownBody(message);
    String month = MarkupPatterns.firstGroup(ACTIVE_SINCE_MONTH, body);
    Integer days = MarkupPatterns.parseInteger(MarkupPatterns.firstGroup(ACTIVE_SINCE_DAYS, body));
    if (month != null || days != null) {
      partial.setActiveSince(new ActiveSince(month, days));
    }
  }

  public static void currentBalance(JsonNode message, UserRecord partial) {
    partial.setCurrentBalance(
        MarkupPatterns.parseDecimal(
            MarkupPatterns.firstGroup(CURRENT_BALANCE, ForwardMessages.markdownBody(message))));
  }

  public static void polymarketUrl(JsonNode message, UserRecord partial) {
    Document doc = Jsoup.parseBodyFragment(ForwardMessages.markdownBody(message));
    Element link = doc.selectFirst("a[href^=" + POLYMARKET_PROFILE + "]");
    if (link != null) {
      partial.setPolymarketUrl(link.attr("href"));
    }
  }

  @Nullable
  static RankWindow rankWindow(JsonNode message) {
    String body = ForwardMessages.markdownBody(message);
    Integer place = MarkupPatterns.parseInteger(MarkupPatterns.firstGroup(RANK_PLACE, body));
    Double amount = MarkupPatterns.parseAbbreviated(MarkupPatterns.firstGroup(RANK_AMOUNT, body));
    if (place == null && amount == null) {
      return null;
    }
    return new RankWindow(place, amount);
  }

  public static void rank1d(JsonNode message, UserRecord partial) {
    partial.setRank1d(rankWindow(message));
  }

  public static void rank7d(JsonNode message, UserRecord partial) {
    partial.setRank7d(rankWindow(message));
  }

  public static void rank30d(JsonNode message, UserRecord partial) {
    partial.setRank30d(rankWindow(message));
  }

  public static void rankAllTime(JsonNode message, UserRecord partial) {
    partial.setRankAllTime(rankWindow(message));
  }

  public static void smartScoreSummary(JsonNode message, UserRecord partial) {
    String body = ForwardMessages.markdownBody(message);
    partial.setSmartScore(
        MarkupPatterns.parseDecimal(MarkupPatterns.firstGroup(SMART_SCORE, body)));
    Matcher pnl = MarkupPatterns.find(TOTAL_PNL, body);
    if (pnl != null) {
      partial.setTotalPnl(
          MarkupPatterns.signed(pnl.group(1), MarkupPatterns.parseDecimal(pnl.group(2))));
    }
  }

  public static void sharpeRatio(JsonNode message, UserRecord partial) {
    partial.setSharpeRatio(
        MarkupPatterns.parseDecimal(
            MarkupPatterns.firstGroup(SHARPE_RATIO, ForwardMessages.markdownBody(message))));
  }

  public static void tradedVolume(JsonNode message, UserRecord partial) {
    partial.setTradedVolume30d(
        MarkupPatterns.parseDecimal(
            MarkupPatterns.firstGroup(TRADED_VOLUME, ForwardMessages.metricBody(message))));
  }

  @Nullable
  static BetSummary betSummary(JsonNode message) {
    String body = ForwardMessages.markdownBody(message);
    Double amount = MarkupPatterns.parseDecimal(MarkupPatterns.firstGroup(BETS_AMOUNT, body));
    Double pnl = null;
    Matcher pnlMatch = MarkupPatterns.find(BETS_PNL, body);
    if (pnlMatch != null) {
      pnl =
          MarkupPatterns.signed(
              pnlMatch.group(1), MarkupPatterns.parseDecimal(pnlMatch.group(2)));
    }
    if (amount == null && pnl == null) {
      return null;
    }
    return new BetSummary(amount, pnl);
  }

  public static void activeBets(JsonNode message, UserRecord partial) {
    partial.setActiveBets(betSummary(message));
  }

  public static void finishedBets(JsonNode message, UserRecord partial) {
    partial.setFinishedBets(betSummary(message));
  }

  @Nullable
  static TradeRoi tradeRoi(JsonNode message) {
    String body = ForwardMessages.markdownBody(message);
    Double percent =
        MarkupPatterns.parseDecimal(MarkupPatterns.firstGroup(TRADE_ROI_PERCENT, body));
    Double amount = null;
    Matcher amountMatch = MarkupPatterns.find(TRADE_ROI_AMOUNT, body);
    if (amountMatch != null) {
      amount =
          MarkupPatterns.signed(
              amountMatch.group(1), MarkupPatterns.parseDecimal(amountMatch.group(2)));
    }
    if (percent == null && amount == null) {
      return null;
    }
    return new TradeRoi(percent, amount);
  }

  public static void bestTrade(JsonNode message, UserRecord partial) {
    partial.setBestTrade(tradeRoi(message));
  }

  public static void worstTrade(JsonNode message, UserRecord partial) {
    partial.setWorstTrade(tradeRoi(message));
  }

  public static void whereTraderBetsMost(JsonNode message, UserRecord partial) {
    partial.setWhereTraderBetsMost(ChartSpecs.barSeries(ForwardMessages.plotlySpec(message)));
  }

  public static FieldExtractor categoryMetric(String metricName) {
    return (message, partial) -> {
      Map<String, Double> series = ChartSpecs.radarSeries(ForwardMessages.plotlySpec(message));
      if (series != null && !series.isEmpty()) {
        partial.getCategoryMetrics().put(metricName, series);
      }
    };
  }
}
