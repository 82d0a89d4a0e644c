package dev.henneberger.vertx.cdc.core;

/**
 * Durable activity log keyed by the deterministic activity id.
 */
public interface ActivityStore {

  /**
   * Inserts the row unless its id exists. An existing row is reported with the seq it was stored
   * with, and a dead-letter row under that id is reported as {@link InsertOutcome.Status#DEAD_LETTERED}.
   */
  InsertOutcome insertIfAbsent(Activity activity) throws Exception;

  /**
   * Writes an activity carrying its {@link Activity#error()} record, ignoring duplicates.
   */
  boolean insertDeadLetter(Activity activity) throws Exception;
}
