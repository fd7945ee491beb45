package sh.xana.hashdive.extract;

import org.jetbrains.annotations.Nullable;
import sh.xana.hashdive.extract.UserRecord.ActiveSince;
import sh.xana.hashdive.extract.UserRecord.BetSummary;
import sh.xana.hashdive.extract.UserRecord.RankWindow;
import sh.xana.hashdive.extract.UserRecord.TradeRoi;

/**
 * Folds partial records into the run's record. Values present in the partial overwrite, except
 * trader types (union, first seen order), descriptions (appended) and category metrics (merged by
 * metric name). Absent values never erase what is already there.
 */
public class RecordAggregator {
  private RecordAggregator() {}

  public static UserRecord merge(UserRecord record, UserRecord partial) {
    if (partial.getUserAddress() != null) {
      record.setUserAddress(partial.getUserAddress());
    }
    for (String type : partial.getTraderTypes()) {
      if (!record.getTraderTypes().contains(type)) {
        record.getTraderTypes().add(type);
      }
    }
    record.getTraderTypeDescriptions().addAll(partial.getTraderTypeDescriptions());
    record.setTotalPositions(pick(partial.getTotalPositions(), record.getTotalPositions()));
    record.setActiveSince(mergeActiveSince(record.getActiveSince(), partial.getActiveSince()));
    record.setCurrentBalance(pick(partial.getCurrentBalance(), record.getCurrentBalance()));
    record.setPolymarketUrl(pick(partial.getPolymarketUrl(), record.getPolymarketUrl()));
    record.setRank1d(mergeRank(record.getRank1d(), partial.getRank1d()));
    record.setRank7d(mergeRank(record.getRank7d(), partial.getRank7d()));
    record.setRank30d(mergeRank(record.getRank30d(), partial.getRank30d()));
    record.setRankAllTime(mergeRank(record.getRankAllTime(), partial.getRankAllTime()));
    record.setSmartScore(pick(partial.getSmartScore(), record.getSmartScore()));
    record.setTotalPnl(pick(partial.getTotalPnl(), record.getTotalPnl()));
    record.setSharpeRatio(pick(partial.getSharpeRatio(), record.getSharpeRatio()));
    record.setTradedVolume30d(pick(partial.getTradedVolume30d(), record.getTradedVolume30d()));
    record.setActiveBets(mergeBets(record.getActiveBets(), partial.getActiveBets()));
    record.setFinishedBets(mergeBets(record.getFinishedBets(), partial.getFinishedBets()));
    record.setBestTrade(mergeTrade(record.getBestTrade(), partial.getBestTrade()));
    record.setWorstTrade(mergeTrade(record.getWorstTrade(), partial.getWorstTrade()));
    record.setWhereTraderBetsMost(
        pick(partial.getWhereTraderBetsMost(), record.getWhereTraderBetsMost()));
    record.getCategoryMetrics().putAll(partial.getCategoryMetrics());
    record.getSourceAttributes().putAll(partial.getSourceAttributes());
    record.setFetchedAt(pick(partial.getFetchedAt(), record.getFetchedAt()));
    return record;
  }

  @Nullable
  private static <T> T pick(@Nullable T newValue, @Nullable T oldValue) {
    return newValue != null ? newValue : oldValue;
  }

  @Nullable
  private static ActiveSince mergeActiveSince(
      @Nullable ActiveSince current, @Nullable ActiveSince update) {
    if (current == null || update == null) {
      return pick(update, current);
    }
    return new ActiveSince(
        pick(update.month(), current.month()), pick(update.days(), current.days()));
  }

  @Nullable
  private static RankWindow mergeRank(@Nullable RankWindow current, @Nullable RankWindow update) {
    if (current == null || update == null) {
      return pick(update, current);
    }
    return new RankWindow(
        pick(update.place(), current.place()), pick(update.amount(), current.amount()));
  }

  @Nullable
  private static BetSummary mergeBets(@Nullable BetSummary current, @Nullable BetSummary update) {
    if (current == null || update == null) {
      return pick(update, current);
    }
    return new BetSummary(
        pick(update.amount(), current.amount()), pick(update.pnl(), current.pnl()));
  }

  @Nullable
  private static TradeRoi mergeTrade(@Nullable TradeRoi current, @Nullable TradeRoi update) {
    if (current == null || update == null) {
      return pick(update, current);
    }
    return new TradeRoi(
        pick(update.roiPercent(), current.roiPercent()),
        pick(update.roiAmount(), current.roiAmount()));
  }
}
