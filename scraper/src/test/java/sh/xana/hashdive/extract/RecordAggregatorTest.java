package sh.xana.hashdive.extract;

import java.util.List;
import java.util.Map;
import org.testng.Assert;
import org.testng.annotations.Test;
import sh.xana.hashdive.extract.UserRecord.BetSummary;
import sh.xana.hashdive.extract.UserRecord.RankWindow;

@Test
public class RecordAggregatorTest {

  @Test
  public void absentValuesDoNotErase() {
    UserRecord record = new UserRecord("0xabc");
    record.setSmartScore(6.0);
    record.setCurrentBalance(100.0);

    UserRecord partial = new UserRecord();
    partial.setCurrentBalance(250.0);
    RecordAggregator.merge(record, partial);

    Assert.assertEquals(record.getUserAddress(), "0xabc");
    Assert.assertEquals(record.getSmartScore(), 6.0, 0.0001);
    Assert.assertEquals(record.getCurrentBalance(), 250.0, 0.0001);
  }

  @Test
  public void typesAreUnionedAndDescriptionsAppended() {
    UserRecord record = new UserRecord();
    record.getTraderTypes().add("Whale");
    record.getTraderTypeDescriptions().add("Big bets");

    UserRecord partial = new UserRecord();
    partial.getTraderTypes().addAll(List.of("Whale", "Contrarian"));
    partial.getTraderTypeDescriptions().add("Against the crowd");
    RecordAggregator.merge(record, partial);

    Assert.assertEquals(record.getTraderTypes(), List.of("Whale", "Contrarian"));
    Assert.assertEquals(
        record.getTraderTypeDescriptions(), List.of("Big bets", "Against the crowd"));
  }

  @Test
  public void nestedValuesMergeByComponent() {
    UserRecord record = new UserRecord();
    record.setRank30d(new RankWindow(4, null));
    record.setActiveBets(new BetSummary(10.0, 2.0));

    UserRecord partial = new UserRecord();
    partial.setRank30d(new RankWindow(null, 9000.0));
    partial.setActiveBets(new BetSummary(null, -3.0));
    RecordAggregator.merge(record, partial);

    Assert.assertEquals(record.getRank30d(), new RankWindow(4, 9000.0));
    Assert.assertEquals(record.getActiveBets(), new BetSummary(10.0, -3.0));
  }

  @Test
  public void categoryMetricsMergeByName() {
    UserRecord record = new UserRecord();
    record.getCategoryMetrics().put(UserRecord.WIN_RATE_CATEGORIES, Map.of("A", 0.1));

    UserRecord partial = new UserRecord();
    partial.getCategoryMetrics().put(UserRecord.SMART_SCORE_CATEGORIES, Map.of("A", 5.0));
    RecordAggregator.merge(record, partial);

    Assert.assertEquals(record.getCategoryMetrics().keySet().size(), 2);
    Assert.assertEquals(
        record.getCategoryMetrics().get(UserRecord.WIN_RATE_CATEGORIES), Map.of("A", 0.1));
  }

  @Test
  public void mergingEmptyPartialChangesNothing() {
    UserRecord record = new UserRecord("0xabc");
    record.setTotalPositions(3);
    record.getTraderTypes().add("Whale");
    UserRecord before = RecordAggregator.merge(new UserRecord(), record);

    RecordAggregator.merge(record, new UserRecord());

    Assert.assertEquals(record, before);
    Assert.assertEquals(record.getPopulatedFieldCount(), 3);
  }
}
