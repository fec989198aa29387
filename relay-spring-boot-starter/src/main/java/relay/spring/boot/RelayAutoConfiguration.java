package relay.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import relay.ConnectorControlPlane;
import relay.ControlPlaneConfig;
import relay.backpressure.BackpressureSettings;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.JdbcAuditLog;
import relay.jdbc.JdbcPolicyStore;
import relay.jdbc.TableNames;
import relay.jdbc.store.AbstractJdbcDeliveryStore;
import relay.jdbc.store.JdbcDeliveryStores;
import relay.spi.AuditLog;
import relay.spi.ConnectionProvider;
import relay.spi.DeliveryStore;
import relay.spi.MetricsExporter;
import relay.spi.PolicyStore;
import relay.spi.TransportRegistry;
import relay.transport.ConnectorConfigProvider;
import relay.transport.ConnectorConfigs;
import relay.transport.DefaultTransportRegistry;
import relay.transport.StaticConnectorConfigProvider;
import relay.util.JsonCodec;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Wires a {@link ConnectorControlPlane} over the application's {@link DataSource}.
 *
 * <p>The control plane starts its pump and guardian loops once the bean is created, after any
 * schema scripts have run, and stops them on shutdown. Every collaborator backs off when the application declares its own.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ConnectorControlPlane.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TableNames relayTableNames(RelayProperties properties) {
    return TableNames.withPrefix(properties.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionProvider relayConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryStore.class)
  public AbstractJdbcDeliveryStore relayDeliveryStore(DataSource dataSource, TableNames tables) {
    return JdbcDeliveryStores.detect(dataSource, tables);
  }

  @Bean
  @ConditionalOnMissingBean
  public PolicyStore relayPolicyStore(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcPolicyStore(connectionProvider, tables, JsonCodec.getDefault(), Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditLog relayAuditLog(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcAuditLog(connectionProvider, tables, JsonCodec.getDefault(), Clock.systemUTC());
  }

  /**
   * Connector endpoints from {@code relay.connectors.<type>.*}; an unusable entry fails startup.
   */
  @Bean
  @ConditionalOnMissingBean
  public ConnectorConfigProvider relayConnectorConfigs(RelayProperties properties) {
    StaticConnectorConfigProvider provider = new StaticConnectorConfigProvider();
    for (Map.Entry<String, Map<String, String>> entry : properties.getConnectors().entrySet()) {
      provider.register(ConnectorConfigs.parse(entry.getKey(), normalizeKeys(entry.getValue())));
    }
    return provider;
  }

  @Bean
  @ConditionalOnMissingBean
  public TransportRegistry relayTransports(ConnectorConfigProvider configs, RelayProperties properties) {
    return DefaultTransportRegistry.http(configs, Duration.ofMillis(properties.getPump().getAttemptTimeoutMs()));
  }

  @Bean
  @ConditionalOnMissingBean
  public ControlPlaneConfig relayControlPlaneConfig(RelayProperties properties) {
    RelayProperties.Backpressure bp = properties.getBackpressure();
    RelayProperties.Retry retry = properties.getRetry();
    RelayProperties.Pump pump = properties.getPump();
    RelayProperties.Guardian guardian = properties.getGuardian();
    return new ControlPlaneConfig()
        .setDefaultBackpressure(
            new BackpressureSettings(bp.isEnabled(), bp.getMaxRetrying(), bp.getMaxDueNow(), bp.getMinLimit()))
        .setDefaultRequiredApprovals(bp.getRequiredApprovals())
        .setDefaultMaxAttempts(retry.getMaxAttempts())
        .setRetryBaseDelayMs(retry.getBaseDelayMs())
        .setRetryMaxDelayMs(retry.getMaxDelayMs())
        .setRetryJitter(retry.getJitter())
        .setAttemptTimeoutMs(pump.getAttemptTimeoutMs())
        .setPumpIntervalMs(pump.getIntervalMs())
        .setPumpRequestedLimit(pump.getRequestedLimit())
        .setPumpWorkers(pump.getWorkerCount())
        .setGuardianIntervalMs(guardian.getIntervalMs())
        .setGuardianLookbackHours(guardian.getLookbackHours())
        .setGuardianRiskThreshold(guardian.getRiskThreshold())
        .setGuardianMaxActions(guardian.getMaxActions())
        .setGuardianActionLimit(guardian.getActionLimit())
        .setGuardianCooldownMinutes(guardian.getCooldownMinutes())
        .setGuardianMinDeadLetterMinutes(guardian.getMinDeadLetterMinutes());
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @DependsOnDatabaseInitialization
  public ConnectorControlPlane connectorControlPlane(
      ConnectionProvider connectionProvider,
      DeliveryStore deliveryStore,
      PolicyStore policyStore,
      AuditLog auditLog,
      TransportRegistry transports,
      ControlPlaneConfig config,
      RelayProperties properties,
      ObjectProvider<MetricsExporter> metricsExporter) {
    ConnectorControlPlane.Builder builder = ConnectorControlPlane.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(deliveryStore)
        .policyStore(policyStore)
        .auditLog(auditLog)
        .transports(transports)
        .config(config)
        .pumpEnabled(properties.getPump().isEnabled())
        .guardianEnabled(properties.getGuardian().isEnabled());

    MetricsExporter metrics = metricsExporter.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }

    RelayProperties.ClaimLocking claimLocking = properties.getClaimLocking();
    if (claimLocking.isEnabled()) {
      String ownerId = claimLocking.getOwnerId();
      if (ownerId == null || ownerId.isBlank()) {
        ownerId = "relay-" + UUID.randomUUID();
      }
      builder.claimLocking(ownerId, claimLocking.getLockTimeout());
    }
    return builder.build();
  }

  /**
   * Maps relaxed {@code target-url} style keys onto the {@code targetUrl} form the connector
   * parsers read. Header entries keep their name.
   */
  static Map<String, String> normalizeKeys(Map<String, String> settings) {
    Map<String, String> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : settings.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(ConnectorConfigs.HEADER_PREFIX)) {
        key = camelCase(key);
      }
      normalized.put(key, entry.getValue());
    }
    return normalized;
  }

  private static String camelCase(String key) {
    StringBuilder sb = new StringBuilder(key.length());
    boolean upper = false;
    for (char c : key.toCharArray()) {
      if (c == '-' || c == '_') {
        upper = true;
      } else if (upper) {
        sb.append(Character.toUpperCase(c));
        upper = false;
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
