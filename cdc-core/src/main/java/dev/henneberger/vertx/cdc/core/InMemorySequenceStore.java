package dev.henneberger.vertx.cdc.core;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemorySequenceStore implements SequenceStore {
  private final ConcurrentMap<SeqScope, AtomicLong> counters = new ConcurrentHashMap<>();

  @Override
  public long increment(SeqScope scope) {
    return counters.computeIfAbsent(scope, ignored -> new AtomicLong()).incrementAndGet();
  }

  public long current(SeqScope scope) {
    AtomicLong counter = counters.get(scope);
    return counter == null ? 0L : counter.get();
  }
}
