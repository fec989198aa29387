package relay.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, all sharing one configurable prefix.
 *
 * <p>Every name is validated as a plain SQL identifier because it is concatenated into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "relay_";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames defaults() {
    return withPrefix(DEFAULT_PREFIX);
  }

  /**
   * @param prefix table prefix, may be empty
   * @throws IllegalArgumentException if the prefixed names are not valid identifiers
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    TableNames names = new TableNames(prefix);
    validate(names.deliveries());
    return names;
  }

  public String deliveries() {
    return prefix + "connector_delivery";
  }

  public String attempts() {
    return prefix + "delivery_attempt";
  }

  public String auditEvents() {
    return prefix + "audit_event";
  }

  public String policies() {
    return prefix + "backpressure_policy";
  }

  public String drafts() {
    return prefix + "backpressure_draft";
  }

  public String guardianPolicies() {
    return prefix + "guardian_policy";
  }

  public String prefix() {
    return prefix;
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
