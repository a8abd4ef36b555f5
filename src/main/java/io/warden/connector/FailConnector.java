package io.warden.connector;

import java.util.Map;

public final class FailConnector implements Connector {
    @Override
    public String id() {
        return "fail";
    }

    @Override
    public Map<String, Object> call(String operation, Map<String, Object> payload) {
        throw new IllegalStateException("intentional failure from fail connector (" + operation + ")");
    }
}
