package relay.transport;

import relay.model.ConnectorKind;
import relay.spi.ConnectorTransport;
import relay.spi.TransportRegistry;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link TransportRegistry}. Types are normalized on registration and lookup, so
 * aliases resolve to the canonical type's transport.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultTransportRegistry implements TransportRegistry {
  private final Map<String, ConnectorTransport> transports = new ConcurrentHashMap<>();

  /**
   * Registry with an {@link HttpConnectorTransport} for every connector type it supports.
   */
  public static DefaultTransportRegistry http(ConnectorConfigProvider configs, Duration requestTimeout) {
    return http(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), configs, requestTimeout);
  }

  public static DefaultTransportRegistry http(HttpClient client, ConnectorConfigProvider configs,
      Duration requestTimeout) {
    return http(client, configs, requestTimeout, Clock.systemUTC());
  }

  public static DefaultTransportRegistry http(HttpClient client, ConnectorConfigProvider configs,
      Duration requestTimeout, Clock clock) {
    HttpConnectorTransport transport = new HttpConnectorTransport(client, configs, requestTimeout, clock);
    DefaultTransportRegistry registry = new DefaultTransportRegistry();
    for (ConnectorKind kind : HttpConnectorTransport.SUPPORTED) {
      registry.register(kind.key(), transport);
    }
    return registry;
  }

  public DefaultTransportRegistry register(String connectorType, ConnectorTransport transport) {
    Objects.requireNonNull(transport, "transport");
    transports.put(ConnectorKind.normalize(connectorType), transport);
    return this;
  }

  @Override
  public Optional<ConnectorTransport> transportFor(String connectorType) {
    return Optional.ofNullable(transports.get(ConnectorKind.normalize(connectorType)));
  }
}
