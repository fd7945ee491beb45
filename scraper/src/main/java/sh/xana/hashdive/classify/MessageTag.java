package sh.xana.hashdive.classify;

/** Semantic meaning of one rendered page element of the trader profile */
public enum MessageTag {
  TRADER_TYPE,
  /** Only valid right after {@link #TRADER_TYPE} */
  TRADER_TYPE_DESC,
  STATS_TOTAL_POSITIONS,
  STATS_ACTIVE_SINCE,
  STATS_CURRENT_BALANCE,
  VIEW_ON_POLYMARKET,
  RANK_1D,
  RANK_7D,
  RANK_30D,
  RANK_ALLTIME,
  SMART_SCORE_SUMMARY,
  HISTORICAL_PNL_CHART,
  SHARPE_RATIO,
  TRADED_VOLUME_30D,
  ACTIVE_BETS_SUM,
  ACTIVE_BETS_TABLE,
  FINISHED_BETS_SUM,
  FINISHED_BETS_TABLE,
  BEST_TRADE,
  WORST_TRADE,
  DISTRIBUTION_ROI,
  MOST_TRADED_CATEGORIES,
  SMART_SCORE_BY_CATEGORY,
  WIN_RATE_BY_CATEGORY,
  RECENT_TRADES_TABLE,
  WHERE_TRADER_BETS_MOST,
  UNKNOWN
}
