package sh.xana.hashdive.classify;

import org.jetbrains.annotations.Nullable;

/**
 * Memory carried from one element to the next within a single extraction run. Immutable, every
 * classification returns the successor state.
 *
 * @param lastTag tag of the previous page element, null before the first one
 * @param rankIndex how many windows of the ranked sequence have been seen, 0 when not inside one
 * @param activeBetsTableSeen the element after the active bets summary was already consumed
 * @param finishedBetsTableSeen the element after the finished bets summary was already consumed
 */
public record ClassifierState(
    @Nullable MessageTag lastTag,
    int rankIndex,
    boolean activeBetsTableSeen,
    boolean finishedBetsTableSeen) {
  public static final ClassifierState INITIAL = new ClassifierState(null, 0, false, false);

  public ClassifierState withLastTag(@Nullable MessageTag tag) {
    return new ClassifierState(tag, rankIndex, activeBetsTableSeen, finishedBetsTableSeen);
  }

  public ClassifierState withRankIndex(int index) {
    return new ClassifierState(lastTag, index, activeBetsTableSeen, finishedBetsTableSeen);
  }

  public ClassifierState withActiveBetsTableSeen() {
    return new ClassifierState(lastTag, rankIndex, true, finishedBetsTableSeen);
  }

  public ClassifierState withFinishedBetsTableSeen() {
    return new ClassifierState(lastTag, rankIndex, activeBetsTableSeen, true);
  }

  public boolean inRankSequence() {
    return rankIndex > 0;
  }
}
