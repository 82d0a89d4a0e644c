package dev.henneberger.vertx.cdc.core;

/**
 * Durable per-scope counters. Implementations must increment atomically under concurrent callers.
 */
public interface SequenceStore {
  long increment(SeqScope scope) throws Exception;
}
