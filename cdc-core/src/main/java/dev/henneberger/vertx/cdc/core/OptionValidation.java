package dev.henneberger.vertx.cdc.core;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requirePort(String fieldName, int port) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException(fieldName + " must be between 1 and 65535");
    }
  }

  public static void requireMin(String fieldName, long value, long minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requireOrdered(String lowerName, long lower, String upperName, long upper) {
    if (lower > upper) {
      throw new IllegalArgumentException(lowerName + " must be <= " + upperName);
    }
  }
}
