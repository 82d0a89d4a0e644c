package dev.henneberger.vertx.cdc.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Host schema metadata the pipeline routes against: which physical tables are tracked, what type each
 * represents, and the parts of the entity hierarchy activities depend on.
 */
public final class TrackedSchema {

  public static final String DEFAULT_USER_TYPE = "user";
  public static final String DEFAULT_VOLATILE_COLUMN = "modified_at";

  private final Map<String, String> entityTables = new LinkedHashMap<>();
  private final Map<String, String> resourceTables = new LinkedHashMap<>();
  private final Set<String> productTypes = new LinkedHashSet<>();
  private final Set<String> relatableContextTypes = new LinkedHashSet<>();
  private String userType = DEFAULT_USER_TYPE;
  private String membershipType = "membership";
  private String inactiveMembershipType = "inactive_membership";
  private String volatileColumn = DEFAULT_VOLATILE_COLUMN;

  public TrackedSchema() {
  }

  /**
   * The schema of the host application: users, organizations and two product entities, plus the
   * resource tables that carry activities.
   */
  public static TrackedSchema defaults() {
    return new TrackedSchema()
      .entityTable("users", "user")
      .entityTable("organizations", "organization")
      .entityTable("attachments", "attachment")
      .entityTable("pages", "page")
      .resourceTable("requests", "request")
      .resourceTable("memberships", "membership")
      .resourceTable("inactive_memberships", "inactive_membership")
      .resourceTable("tenants", "tenant")
      .productTypes("attachment", "page")
      .relatableContextTypes("organization");
  }

  public TrackedSchema entityTable(String table, String type) {
    entityTables.put(requireName("table", table), requireName("type", type));
    return this;
  }

  public TrackedSchema resourceTable(String table, String type) {
    resourceTables.put(requireName("table", table), requireName("type", type));
    return this;
  }

  public TrackedSchema productTypes(String... types) {
    productTypes.addAll(List.of(types));
    return this;
  }

  public TrackedSchema relatableContextTypes(String... types) {
    relatableContextTypes.addAll(List.of(types));
    return this;
  }

  public TrackedSchema setUserType(String userType) {
    this.userType = requireName("userType", userType);
    return this;
  }

  public TrackedSchema setMembershipType(String membershipType) {
    this.membershipType = requireName("membershipType", membershipType);
    return this;
  }

  public TrackedSchema setInactiveMembershipType(String inactiveMembershipType) {
    this.inactiveMembershipType = requireName("inactiveMembershipType", inactiveMembershipType);
    return this;
  }

  public TrackedSchema setVolatileColumn(String volatileColumn) {
    this.volatileColumn = volatileColumn;
    return this;
  }

  public Map<String, String> entityTables() {
    return Collections.unmodifiableMap(entityTables);
  }

  public Map<String, String> resourceTables() {
    return Collections.unmodifiableMap(resourceTables);
  }

  public boolean isProductType(String type) {
    return productTypes.contains(type);
  }

  public Set<String> productTypes() {
    return Collections.unmodifiableSet(productTypes);
  }

  public Set<String> relatableContextTypes() {
    return Collections.unmodifiableSet(relatableContextTypes);
  }

  public String userType() {
    return userType;
  }

  public String membershipType() {
    return membershipType;
  }

  public String inactiveMembershipType() {
    return inactiveMembershipType;
  }

  public String volatileColumn() {
    return volatileColumn;
  }

  private static String requireName(String field, String value) {
    OptionValidation.require(field, value);
    return Objects.requireNonNull(value);
  }
}
