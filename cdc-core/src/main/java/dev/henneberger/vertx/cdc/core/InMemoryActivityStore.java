package dev.henneberger.vertx.cdc.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryActivityStore implements ActivityStore {
  private final Map<String, Activity> rows = new ConcurrentHashMap<>();

  @Override
  public InsertOutcome insertIfAbsent(Activity activity) {
    Activity existing = rows.putIfAbsent(activity.id(), activity);
    if (existing == null) {
      return InsertOutcome.inserted();
    }
    return existing.error() == null
      ? InsertOutcome.alreadyPresent(existing.seq())
      : InsertOutcome.deadLetterPresent(existing.seq());
  }

  @Override
  public boolean insertDeadLetter(Activity activity) {
    return rows.putIfAbsent(activity.id(), activity) == null;
  }

  public Optional<Activity> find(String id) {
    return Optional.ofNullable(rows.get(id));
  }

  public List<Activity> activities() {
    List<Activity> out = new ArrayList<>();
    for (Activity activity : rows.values()) {
      if (activity.error() == null) {
        out.add(activity);
      }
    }
    return out;
  }

  public List<Activity> deadLetters() {
    List<Activity> out = new ArrayList<>();
    for (Activity activity : rows.values()) {
      if (activity.error() != null) {
        out.add(activity);
      }
    }
    return out;
  }
}
