package relay.jdbc.store;

import relay.jdbc.TableNames;

import java.util.List;

/**
 * H2 delivery store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcDeliveryStore}.
 */
public final class H2DeliveryStore extends AbstractJdbcDeliveryStore {

  public H2DeliveryStore() {
    super();
  }

  public H2DeliveryStore(TableNames tables) {
    super(tables);
  }

  @Override
  public AbstractJdbcDeliveryStore withTables(TableNames tables) {
    return new H2DeliveryStore(tables);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
