package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * Counter that orders activities: a context key (organization id or {@code public:{type}}) and the
 * counter column within it.
 */
public final class SeqScope {

  public enum Column {
    SEQ("seq"),
    MEMBERSHIP_SEQ("m_seq");

    private final String columnName;

    Column(String columnName) {
      this.columnName = columnName;
    }

    public String columnName() {
      return columnName;
    }
  }

  private final String contextKey;
  private final Column column;

  public SeqScope(String contextKey, Column column) {
    OptionValidation.require("contextKey", contextKey);
    this.contextKey = contextKey;
    this.column = Objects.requireNonNull(column, "column");
  }

  public static String publicContextKey(String type) {
    return "public:" + type;
  }

  public String contextKey() {
    return contextKey;
  }

  public Column column() {
    return column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeqScope)) {
      return false;
    }
    SeqScope that = (SeqScope) o;
    return contextKey.equals(that.contextKey) && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(contextKey, column);
  }

  @Override
  public String toString() {
    return contextKey + '/' + column.columnName();
  }
}
