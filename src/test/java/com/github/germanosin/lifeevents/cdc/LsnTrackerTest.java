package com.github.germanosin.lifeevents.cdc;

import java.util.List;
import org.junit.Assert;
import org.junit.Test;
import org.postgresql.replication.LogSequenceNumber;

public class LsnTrackerTest {

  @Test
  public void acknowledgesOnlyWhenPositionMoved() throws Exception {
    ScriptedReplicationSession session = new ScriptedReplicationSession();
    LsnTracker tracker = new LsnTracker();

    Assert.assertFalse(tracker.acknowledge(session));

    tracker.advance(LogSequenceNumber.valueOf(100L));
    Assert.assertTrue(tracker.acknowledge(session));
    Assert.assertFalse(tracker.acknowledge(session));

    Assert.assertEquals(List.of(LogSequenceNumber.valueOf(100L)), session.getAcknowledged());
    Assert.assertEquals(LogSequenceNumber.valueOf(100L), tracker.getAcknowledged());
  }

  @Test
  public void neverRegresses() throws Exception {
    ScriptedReplicationSession session = new ScriptedReplicationSession();
    LsnTracker tracker = new LsnTracker();

    tracker.advance(LogSequenceNumber.valueOf(200L));
    tracker.acknowledge(session);
    tracker.advance(LogSequenceNumber.valueOf(150L));
    tracker.acknowledge(session);
    tracker.advance(LogSequenceNumber.valueOf(300L));
    tracker.acknowledge(session);

    Assert.assertEquals(
        List.of(LogSequenceNumber.valueOf(200L), LogSequenceNumber.valueOf(300L)),
        session.getAcknowledged()
    );
    Assert.assertEquals(LogSequenceNumber.valueOf(300L), tracker.getProcessed());
  }

  @Test
  public void ignoresInvalidPositions() throws Exception {
    ScriptedReplicationSession session = new ScriptedReplicationSession();
    LsnTracker tracker = new LsnTracker();

    tracker.advance(null);
    tracker.advance(LogSequenceNumber.INVALID_LSN);

    Assert.assertFalse(tracker.acknowledge(session));
    Assert.assertTrue(session.getAcknowledged().isEmpty());
  }

  @Test
  public void comparesPositionsAsUnsigned() throws Exception {
    ScriptedReplicationSession session = new ScriptedReplicationSession();
    LsnTracker tracker = new LsnTracker();

    tracker.advance(LogSequenceNumber.valueOf(Long.MAX_VALUE));
    tracker.advance(LogSequenceNumber.valueOf(Long.MIN_VALUE));
    tracker.acknowledge(session);

    Assert.assertEquals(LogSequenceNumber.valueOf(Long.MIN_VALUE), tracker.getAcknowledged());
  }
}
