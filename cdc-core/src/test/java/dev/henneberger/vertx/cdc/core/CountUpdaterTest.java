package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CountUpdaterTest {

  private static final TableRegistryEntry MEMBERSHIPS = TableRegistryEntry.resource("memberships", "membership");
  private static final TableRegistryEntry INACTIVE = TableRegistryEntry.resource("inactive_memberships", "inactive_membership");
  private static final TableRegistryEntry ATTACHMENTS = TableRegistryEntry.entity("attachments", "attachment");

  private final InMemoryCountStore store = new InMemoryCountStore();
  private final CountUpdater updater = new CountUpdater(TrackedSchema.defaults(), store);

  @Test
  void membershipCreateAndDeleteAdjustRoleAndTotal() {
    Map<String, Object> row = Map.of("organizationId", "o1", "role", "admin");

    CountDelta created = updater.deltasFor(MEMBERSHIPS, ActivityAction.CREATE, row, null).orElseThrow();
    assertEquals("o1", created.contextKey());
    assertEquals(Map.of("m:admin", 1, "m:total", 1), created.deltas());

    CountDelta deleted = updater.deltasFor(MEMBERSHIPS, ActivityAction.DELETE, row, row).orElseThrow();
    assertEquals(Map.of("m:admin", -1, "m:total", -1), deleted.deltas());
  }

  @Test
  void roleChangeMovesOneCount() {
    CountDelta delta = updater.deltasFor(MEMBERSHIPS, ActivityAction.UPDATE,
      Map.of("organizationId", "o1", "role", "member"),
      Map.of("organizationId", "o1", "role", "admin")).orElseThrow();

    assertEquals(Map.of("m:admin", -1, "m:member", 1), delta.deltas());
  }

  @Test
  void unchangedRoleOrMissingOldRoleProducesNothing() {
    Map<String, Object> row = Map.of("organizationId", "o1", "role", "admin");

    assertTrue(updater.deltasFor(MEMBERSHIPS, ActivityAction.UPDATE, row, row).isEmpty());
    assertTrue(updater.deltasFor(MEMBERSHIPS, ActivityAction.UPDATE, row, Map.of()).isEmpty());
  }

  @Test
  void rowsWithoutOrganizationAreNotCounted() {
    assertTrue(updater.deltasFor(MEMBERSHIPS, ActivityAction.CREATE, Map.of("role", "admin"), null).isEmpty());
  }

  @Test
  void pendingFollowsRejectedAtEdges() {
    Map<String, Object> pending = new HashMap<>();
    pending.put("organizationId", "o1");
    pending.put("rejectedAt", null);
    Map<String, Object> rejected = Map.of("organizationId", "o1", "rejectedAt", "2024-05-01T00:00:00Z");

    assertEquals(Map.of("m:pending", 1),
      updater.deltasFor(INACTIVE, ActivityAction.CREATE, pending, null).orElseThrow().deltas());
    assertTrue(updater.deltasFor(INACTIVE, ActivityAction.CREATE, rejected, null).isEmpty());
    assertEquals(Map.of("m:pending", -1),
      updater.deltasFor(INACTIVE, ActivityAction.UPDATE, rejected, pending).orElseThrow().deltas());
    assertEquals(Map.of("m:pending", 1),
      updater.deltasFor(INACTIVE, ActivityAction.UPDATE, pending, rejected).orElseThrow().deltas());
    assertTrue(updater.deltasFor(INACTIVE, ActivityAction.UPDATE, pending, pending).isEmpty());
    assertEquals(Map.of("m:pending", -1),
      updater.deltasFor(INACTIVE, ActivityAction.DELETE, pending, pending).orElseThrow().deltas());
    assertTrue(updater.deltasFor(INACTIVE, ActivityAction.DELETE, rejected, rejected).isEmpty());
  }

  @Test
  void productEntitiesCountOnCreateAndDeleteOnly() {
    Map<String, Object> row = Map.of("id", "a1", "organizationId", "o1");

    assertEquals(Map.of("e:attachment", 1),
      updater.deltasFor(ATTACHMENTS, ActivityAction.CREATE, row, null).orElseThrow().deltas());
    assertEquals(Map.of("e:attachment", -1),
      updater.deltasFor(ATTACHMENTS, ActivityAction.DELETE, row, row).orElseThrow().deltas());
    assertTrue(updater.deltasFor(ATTACHMENTS, ActivityAction.UPDATE, row, row).isEmpty());
    assertTrue(updater.deltasFor(TableRegistryEntry.entity("users", "user"), ActivityAction.CREATE, row, null).isEmpty());
  }

  @Test
  void applyNeverDropsBelowZero() throws Exception {
    updater.apply(new CountDelta("o1", Map.of("m:admin", 1, "m:total", 1)));
    updater.apply(new CountDelta("o1", Map.of("m:admin", -1, "m:total", -1)));
    updater.apply(new CountDelta("o1", Map.of("m:admin", -1, "m:total", -1)));

    assertEquals(0, store.counts("o1").get("m:admin"));
    assertEquals(0, store.counts("o1").get("m:total"));

    updater.apply(new CountDelta("o1", Map.of("m:admin", 1)));
    assertEquals(1, store.counts("o1").get("m:admin"));
  }
}
