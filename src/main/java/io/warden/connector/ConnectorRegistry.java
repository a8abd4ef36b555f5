package io.warden.connector;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ConnectorRegistry {
    private final Map<String, Connector> connectors = new ConcurrentHashMap<>();

    public ConnectorRegistry register(Connector connector) {
        if (connector.id() == null || connector.id().isBlank()) {
            throw new IllegalArgumentException("connector id cannot be empty");
        }
        connectors.put(connector.id(), connector);
        return this;
    }

    public Optional<Connector> findById(String connectorId) {
        return connectorId == null ? Optional.empty() : Optional.ofNullable(connectors.get(connectorId));
    }

    public Collection<String> listConnectorIds() {
        return new TreeSet<>(connectors.keySet());
    }

    public static ConnectorRegistry withDefaults() {
        return new ConnectorRegistry()
                .register(new EchoConnector())
                .register(new FailConnector());
    }
}
