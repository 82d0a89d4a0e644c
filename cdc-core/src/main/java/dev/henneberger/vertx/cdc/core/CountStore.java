package dev.henneberger.vertx.cdc.core;

/**
 * Applies a delta as one atomic upsert, flooring every resulting counter at zero.
 */
public interface CountStore {
  void apply(CountDelta delta) throws Exception;
}
