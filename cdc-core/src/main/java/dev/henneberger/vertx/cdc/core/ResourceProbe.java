package dev.henneberger.vertx.cdc.core;

/**
 * Blocking reads of the quantities the {@link ResourceGuard} watches.
 */
public interface ResourceProbe {

  /**
   * WAL bytes between the server's current position and the slot's restart position.
   */
  long walRetainedBytes() throws Exception;

  long freeDiskBytes() throws Exception;
}
