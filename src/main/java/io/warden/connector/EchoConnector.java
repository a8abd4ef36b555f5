package io.warden.connector;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns its payload. Useful for dry runs of a playbook's wiring.
 */
public final class EchoConnector implements Connector {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public Map<String, Object> call(String operation, Map<String, Object> payload) {
        Map<String, Object> out = new LinkedHashMap<>(payload == null ? Map.of() : payload);
        out.put("operation", operation);
        out.put("status", "success");
        out.put("echoed_at", Instant.now().toString());
        return out;
    }
}
