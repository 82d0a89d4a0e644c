package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReplicationStateMachineTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void startsStopped() {
    assertEquals(ReplicationState.STOPPED, new ReplicationStateMachine(clock).state());
  }

  @Test
  void channelCallbacksToggleActiveAndPaused() {
    ReplicationStateMachine machine = new ReplicationStateMachine(clock);

    machine.onConnect();
    assertEquals(ReplicationState.ACTIVE, machine.state());
    assertNull(machine.pausedAt());

    machine.onDisconnect();
    assertEquals(ReplicationState.PAUSED, machine.state());
    assertEquals(clock.instant(), machine.pausedAt());

    machine.onConnect();
    assertEquals(ReplicationState.ACTIVE, machine.state());
    assertNull(machine.pausedAt());
  }

  @Test
  void subscriptionStartFollowsChannelHealth() {
    ReplicationStateMachine machine = new ReplicationStateMachine(clock);

    machine.beginSubscription(false, 1);
    assertEquals(ReplicationState.PAUSED, machine.state());
    assertNotNull(machine.pausedAt());

    machine.beginSubscription(true, 2);
    assertEquals(ReplicationState.ACTIVE, machine.state());
  }

  @Test
  void notifiesTransitionsWithPreviousStateAndCause() {
    ReplicationStateMachine machine = new ReplicationStateMachine(clock);
    List<ReplicationStateChange> changes = new ArrayList<>();
    ReplicationSubscription subscription = machine.onStateChange(changes::add);
    IllegalStateException failure = new IllegalStateException("slot dropped");

    machine.onConnect();
    machine.onConnect();
    machine.markStopped(failure, 3);
    subscription.cancel();
    machine.onDisconnect();

    assertEquals(2, changes.size());
    assertEquals(ReplicationState.STOPPED, changes.get(0).previousState());
    assertEquals(ReplicationState.ACTIVE, changes.get(0).state());
    assertEquals(ReplicationState.STOPPED, changes.get(1).state());
    assertSame(failure, changes.get(1).cause());
    assertEquals(3, changes.get(1).attempt());
  }

  @Test
  void recordsLastMessage() {
    ReplicationStateMachine machine = new ReplicationStateMachine(clock);

    machine.recordMessage("0/16B3748");

    assertEquals("0/16B3748", machine.lastLsn());
    assertEquals(clock.instant(), machine.lastMessageAt());
  }
}
