package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActivityPipelineTest {

  private static final RetryPolicy FAST = RetryPolicy.bounded(3, Duration.ofMillis(1), 2.0d, Duration.ofMillis(4));

  private final TrackedSchema schema = TrackedSchema.defaults();
  private final InMemoryActivityStore activities = new InMemoryActivityStore();
  private final InMemorySequenceStore sequences = new InMemorySequenceStore();
  private final InMemoryCountStore counts = new InMemoryCountStore();
  private final FakeDeliveryChannel channel = new FakeDeliveryChannel();
  private final ReplicationStateMachine stateMachine = new ReplicationStateMachine();
  private final CdcMetrics metrics = new CdcMetrics();

  private ActivityPipeline pipeline;

  @BeforeEach
  void setUp() {
    channel.setListener(stateMachine);
    pipeline = pipeline(activities);
  }

  private ActivityPipeline pipeline(ActivityStore store) {
    return new ActivityPipeline(
      new MessageRouter(TableRegistry.fromSchema(schema), schema),
      new SequenceAssigner(schema, sequences),
      new ActivityPersistence(store, FAST),
      new CountUpdater(schema, counts),
      channel,
      stateMachine,
      metrics);
  }

  private static ReplicationMessage attachmentInsert(String id, String lsn) {
    return ReplicationMessage.insert("attachments",
      new JsonObject().put("id", id).put("organization_id", "o1").put("created_by", "u1"), lsn);
  }

  @Test
  void insertBecomesSequencedPersistedAndDeliveredActivity() {
    channel.open();

    ProcessingResult result = pipeline.process(attachmentInsert("e1", "0/16B3748"));

    assertEquals(ProcessingResult.Outcome.CREATED, result.outcome());
    assertTrue(result.acknowledge());
    Activity activity = result.activity();
    assertEquals("0-16B3748", activity.id());
    assertEquals("attachment.created", activity.type());
    assertEquals("e1", activity.entityId());
    assertEquals("o1", activity.organizationId());
    assertEquals("u1", activity.userId());
    assertEquals(ActivityAction.CREATE, activity.action());
    assertEquals(1L, activity.seq());

    assertTrue(activities.find("0-16B3748").isPresent());
    assertEquals(1, counts.counts("o1").get("e:attachment"));

    assertEquals(1, channel.sent.size());
    JsonObject payload = channel.sent.get(0);
    assertEquals("0-16B3748", payload.getJsonObject("activity").getString("id"));
    assertEquals("e1", payload.getJsonObject("entity").getString("id"));
    assertTrue(payload.containsKey("cacheToken"));
    assertNull(payload.getValue("cacheToken"));
    assertEquals("0/16B3748", payload.getJsonObject("_trace").getString("lsn"));

    assertEquals("0/16B3748", stateMachine.lastLsn());
    assertEquals(1, metrics.activitiesCreated());
    assertEquals(1, metrics.messagesSent());
  }

  @Test
  void withholdsAcknowledgmentWhileChannelIsDown() {
    channel.open();
    channel.drop();
    assertEquals(ReplicationState.PAUSED, stateMachine.state());

    ProcessingResult held = pipeline.process(attachmentInsert("e1", "0/10"));

    assertEquals(ProcessingResult.Outcome.CREATED, held.outcome());
    assertFalse(held.acknowledge());
    assertFalse(pipeline.acknowledgeHeartbeat("0/10"));
    assertTrue(channel.sent.isEmpty());
    assertEquals(1, metrics.sendFailures());

    channel.open();
    ProcessingResult next = pipeline.process(attachmentInsert("e2", "0/20"));

    assertTrue(next.acknowledge());
    assertTrue(pipeline.acknowledgeHeartbeat("0/20"));
    assertEquals(ReplicationState.ACTIVE, stateMachine.state());
  }

  @Test
  void replayDoesNotCountTwice() {
    channel.open();

    pipeline.process(attachmentInsert("e1", "0/30"));
    ProcessingResult replay = pipeline.process(attachmentInsert("e1", "0/30"));

    assertEquals(ProcessingResult.Outcome.REPLAYED, replay.outcome());
    assertTrue(replay.acknowledge());
    assertEquals(1, activities.activities().size());
    assertEquals(1, counts.counts("o1").get("e:attachment"));
    assertEquals(2, channel.sent.size());
    assertEquals(1L, replay.activity().seq());
    assertEquals(1L, channel.sent.get(1).getJsonObject("activity").getLong("seq").longValue());
  }

  @Test
  void seedRowsAreSkippedButAcknowledged() {
    channel.open();

    ProcessingResult result = pipeline.process(attachmentInsert("gen-42", "0/40"));

    assertEquals(ProcessingResult.Outcome.SKIPPED, result.outcome());
    assertTrue(result.acknowledge());
    assertTrue(activities.activities().isEmpty());
    assertTrue(channel.sent.isEmpty());
  }

  @Test
  void controlMessagesFollowBackpressure() {
    assertFalse(pipeline.process(ReplicationMessage.other("0/50")).acknowledge());
    channel.open();
    assertTrue(pipeline.process(ReplicationMessage.other("0/51")).acknowledge());
  }

  @Test
  void everyNonSeedMessageCountsAsProcessed() {
    channel.open();

    pipeline.process(ReplicationMessage.other("0/52"));
    pipeline.process(attachmentInsert("gen-1", "0/53"));
    pipeline.process(attachmentInsert("e1", "0/54"));

    assertEquals(2, metrics.messagesProcessed());
  }

  @Test
  void noOpUpdateProducesNoActivity() {
    channel.open();
    Map<String, Object> oldRow = Map.of("id", "p1", "title", "same", "modified_at", "2024-01-01");
    Map<String, Object> newRow = Map.of("id", "p1", "title", "same", "modified_at", "2024-01-02");

    ProcessingResult result = pipeline.process(ReplicationMessage.update("pages", newRow, oldRow, "0/60"));

    assertEquals(ProcessingResult.Outcome.SKIPPED, result.outcome());
    assertTrue(result.acknowledge());
    assertTrue(activities.activities().isEmpty());
  }

  @Test
  void unwritableActivityIsDeadLetteredAndTheStreamMovesOn() {
    channel.open();
    InMemoryActivityStore deadLetters = new InMemoryActivityStore();
    ActivityPipeline failing = pipeline(new ActivityStore() {
      @Override
      public InsertOutcome insertIfAbsent(Activity activity) throws Exception {
        if (activity.entityId().equals("bad")) {
          throw new SQLException("insert or update violates foreign key constraint", "23503");
        }
        return deadLetters.insertIfAbsent(activity);
      }

      @Override
      public boolean insertDeadLetter(Activity activity) {
        return deadLetters.insertDeadLetter(activity);
      }
    });

    ProcessingResult result = failing.process(attachmentInsert("bad", "0/70"));

    assertEquals(ProcessingResult.Outcome.DEAD_LETTERED, result.outcome());
    assertTrue(result.acknowledge());
    assertEquals(1, deadLetters.deadLetters().size());
    assertEquals("23503", deadLetters.deadLetters().get(0).error().code());
    assertTrue(channel.sent.isEmpty());
    assertTrue(counts.counts("o1").isEmpty());
    assertEquals(1, metrics.errors());

    ProcessingResult next = failing.process(attachmentInsert("e2", "0/78"));

    assertEquals(ProcessingResult.Outcome.CREATED, next.outcome());
    assertEquals(1, channel.sent.size());
    assertEquals("e2", channel.sent.get(0).getJsonObject("activity").getString("entityId"));
  }

  @Test
  void failingDeadLetterWriteStillLetsTheStreamAdvance() {
    channel.open();
    ActivityPipeline broken = pipeline(new ActivityStore() {
      @Override
      public InsertOutcome insertIfAbsent(Activity activity) throws Exception {
        throw new SQLException("null value in column violates not-null constraint", "23502");
      }

      @Override
      public boolean insertDeadLetter(Activity activity) throws Exception {
        throw new SQLException("null value in column violates not-null constraint", "23502");
      }
    });

    for (int i = 0; i < 3; i++) {
      ProcessingResult result = broken.process(attachmentInsert("e1", "0/70"));
      assertEquals(ProcessingResult.Outcome.DEAD_LETTERED, result.outcome());
      assertTrue(result.acknowledge());
    }
    assertTrue(channel.sent.isEmpty());
  }

  @Test
  void replayOfDeadLetteredIdIsNotDelivered() throws Exception {
    channel.open();
    Activity failed = Activity.builder()
      .id("0-80")
      .action(ActivityAction.CREATE)
      .tableName("attachments")
      .type("attachment.created")
      .entityType("attachment")
      .entityId("e1")
      .seq(1L)
      .error(new DeadLetterError("0/80", "insert or update violates foreign key constraint", "23503", 3, false))
      .build();
    activities.insertDeadLetter(failed);

    ProcessingResult replay = pipeline.process(attachmentInsert("e1", "0/80"));

    assertEquals(ProcessingResult.Outcome.DEAD_LETTERED, replay.outcome());
    assertTrue(replay.acknowledge());
    assertTrue(channel.sent.isEmpty());
    assertTrue(counts.counts("o1").isEmpty());
    assertEquals(0, metrics.errors());
  }

  @Test
  void transientSequenceFailureIsWithheldForRedelivery() {
    channel.open();
    ActivityPipeline unsequenced = new ActivityPipeline(
      new MessageRouter(TableRegistry.fromSchema(schema), schema),
      new SequenceAssigner(schema, scope -> {
        throw new SQLException("terminating connection due to administrator command", "57P01");
      }),
      new ActivityPersistence(activities, FAST),
      new CountUpdater(schema, counts),
      channel,
      stateMachine,
      metrics);

    ProcessingResult result = unsequenced.process(attachmentInsert("e1", "0/90"));

    assertEquals(ProcessingResult.Outcome.FAILED, result.outcome());
    assertFalse(result.acknowledge());
    assertTrue(activities.deadLetters().isEmpty());
    assertTrue(channel.sent.isEmpty());
  }

  @Test
  void permanentSequenceFailureIsDeadLettered() {
    channel.open();
    ActivityPipeline unsequenced = new ActivityPipeline(
      new MessageRouter(TableRegistry.fromSchema(schema), schema),
      new SequenceAssigner(schema, scope -> {
        throw new SQLException("value out of range for type bigint", "22003");
      }),
      new ActivityPersistence(activities, FAST),
      new CountUpdater(schema, counts),
      channel,
      stateMachine,
      metrics);

    ProcessingResult result = unsequenced.process(attachmentInsert("e1", "0/91"));

    assertEquals(ProcessingResult.Outcome.DEAD_LETTERED, result.outcome());
    assertTrue(result.acknowledge());
    assertEquals(1, activities.deadLetters().size());
    assertEquals("22003", activities.deadLetters().get(0).error().code());
    assertTrue(channel.sent.isEmpty());
  }
}
