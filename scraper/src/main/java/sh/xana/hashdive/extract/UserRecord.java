package sh.xana.hashdive.extract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Trader profile assembled from the rendered page. Every field stays null until some element
 * supplies it, so a partial record still serializes with all keys present.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserRecord {
  public static final String MOST_TRADED_CATEGORIES = "most_traded_categories";
  public static final String SMART_SCORE_CATEGORIES = "smart_score_categories";
  public static final String WIN_RATE_CATEGORIES = "win_rate_categories";

  private String userAddress;
  private List<String> traderTypes = new ArrayList<>();
  private List<String> traderTypeDescriptions = new ArrayList<>();
  private Integer totalPositions;
  private ActiveSince activeSince;
  private Double currentBalance;
  private String polymarketUrl;

  @JsonProperty("rank_1d")
  private RankWindow rank1d;

  @JsonProperty("rank_7d")
  private RankWindow rank7d;

  @JsonProperty("rank_30d")
  private RankWindow rank30d;

  private RankWindow rankAllTime;
  private Double smartScore;
  private Double totalPnl;
  private Double sharpeRatio;

  @JsonProperty("traded_usd_volume_last_30d")
  private Double tradedVolume30d;

  private BetSummary activeBets;
  private BetSummary finishedBets;
  private TradeRoi bestTrade;
  private TradeRoi worstTrade;
  private Map<String, Double> whereTraderBetsMost;
  private Map<String, Map<String, Double>> categoryMetrics = new LinkedHashMap<>();
  private Map<String, String> sourceAttributes = new LinkedHashMap<>();
  private String fetchedAt;

  public UserRecord() {}

  public UserRecord(String userAddress) {
    this.userAddress = userAddress;
  }

  /** @param month eg "March 2024" */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ActiveSince(String month, Integer days) {}

  /** @param place leaderboard position, {@code #12} on the page */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RankWindow(Integer place, Double amount) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record BetSummary(Double amount, Double pnl) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record TradeRoi(Double roiPercent, Double roiAmount) {}

  /** Fields that hold a value, empty collections do not count */
  @JsonIgnore
  public int getPopulatedFieldCount() {
    Object[] values = {
      userAddress,
      traderTypes,
      traderTypeDescriptions,
      totalPositions,
      activeSince,
      currentBalance,
      polymarketUrl,
      rank1d,
      rank7d,
      rank30d,
      rankAllTime,
      smartScore,
      totalPnl,
      sharpeRatio,
      tradedVolume30d,
      activeBets,
      finishedBets,
      bestTrade,
      worstTrade,
      whereTraderBetsMost,
      categoryMetrics,
      sourceAttributes,
      fetchedAt
    };
    int count = 0;
    for (Object value : values) {
      if (value == null
          || (value instanceof Collection<?> c && c.isEmpty())
          || (value instanceof Map<?, ?> m && m.isEmpty())) {
        continue;
      }
      count++;
    }
    return count;
  }

  public String getUserAddress() {
    return userAddress;
  }

  public void setUserAddress(String userAddress) {
    this.userAddress = userAddress;
  }

  public List<String> getTraderTypes() {
    return traderTypes;
  }

  public void setTraderTypes(List<String> traderTypes) {
    this.traderTypes = traderTypes;
  }

  public List<String> getTraderTypeDescriptions() {
    return traderTypeDescriptions;
  }

  public void setTraderTypeDescriptions(List<String> traderTypeDescriptions) {
    this.traderTypeDescriptions = traderTypeDescriptions;
  }

  public Integer getTotalPositions() {
    return totalPositions;
  }

  public void setTotalPositions(Integer totalPositions) {
    this.totalPositions = totalPositions;
  }

  public ActiveSince getActiveSince() {
    return activeSince;
  }

  public void setActiveSince(ActiveSince activeSince) {
    this.activeSince = activeSince;
  }

  public Double getCurrentBalance() {
    return currentBalance;
  }

  public void setCurrentBalance(Double currentBalance) {
    this.currentBalance = currentBalance;
  }

  public String getPolymarketUrl() {
    return polymarketUrl;
  }

  public void setPolymarketUrl(String polymarketUrl) {
    this.polymarketUrl = polymarketUrl;
  }

  public RankWindow getRank1d() {
    return rank1d;
  }

  public void setRank1d(RankWindow rank1d) {
    this.rank1d = rank1d;
  }

  public RankWindow getRank7d() {
    return rank7d;
  }

  public void setRank7d(RankWindow rank7d) {
    this.rank7d = rank7d;
  }

  public RankWindow getRank30d() {
    return rank30d;
  }

  public void setRank30d(RankWindow rank30d) {
    this.rank30d = rank30d;
  }

  public RankWindow getRankAllTime() {
    return rankAllTime;
  }

  public void setRankAllTime(RankWindow rankAllTime) {
    this.rankAllTime = rankAllTime;
  }

  public Double getSmartScore() {
    return smartScore;
  }

  public void setSmartScore(Double smartScore) {
    this.smartScore = smartScore;
  }

  public Double getTotalPnl() {
    return totalPnl;
  }

  public void setTotalPnl(Double totalPnl) {
    this.totalPnl = totalPnl;
  }

  public Double getSharpeRatio() {
    return sharpeRatio;
  }

  public void setSharpeRatio(Double sharpeRatio) {
    this.sharpeRatio = sharpeRatio;
  }

  public Double getTradedVolume30d() {
    return tradedVolume30d;
  }

  public void setTradedVolume30d(Double tradedVolume30d) {
    this.tradedVolume30d = tradedVolume30d;
  }

  public BetSummary getActiveBets() {
    return activeBets;
  }

  public void setActiveBets(BetSummary activeBets) {
    this.activeBets = activeBets;
  }

  public BetSummary getFinishedBets() {
    return finishedBets;
  }

  public void setFinishedBets(BetSummary finishedBets) {
    this.finishedBets = finishedBets;
  }

  public TradeRoi getBestTrade() {
    return bestTrade;
  }

  public void setBestTrade(TradeRoi bestTrade) {
    this.bestTrade = bestTrade;
  }

  public TradeRoi getWorstTrade() {
    return worstTrade;
  }

  public void setWorstTrade(TradeRoi worstTrade) {
    this.worstTrade = worstTrade;
  }

  public Map<String, Double> getWhereTraderBetsMost() {
    return whereTraderBetsMost;
  }

  public void setWhereTraderBetsMost(Map<String, Double> whereTraderBetsMost) {
    this.whereTraderBetsMost = whereTraderBetsMost;
  }

  public Map<String, Map<String, Double>> getCategoryMetrics() {
    return categoryMetrics;
  }

  public void setCategoryMetrics(Map<String, Map<String, Double>> categoryMetrics) {
    this.categoryMetrics = categoryMetrics;
  }

  public Map<String, String> getSourceAttributes() {
    return sourceAttributes;
  }

  public void setSourceAttributes(Map<String, String> sourceAttributes) {
    this.sourceAttributes = sourceAttributes;
  }

  public String getFetchedAt() {
    return fetchedAt;
  }

  public void setFetchedAt(String fetchedAt) {
    this.fetchedAt = fetchedAt;
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(this);
  }

  @Override
  public String toString() {
    return ToStringBuilder.reflectionToString(this, ToStringStyle.SHORT_PREFIX_STYLE);
  }
}
