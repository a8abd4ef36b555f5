package io.warden.connector;

import java.util.Map;

/**
 * Adapter for one external system. The engine treats any exception thrown by {@link #call} as a
 * task failure.
 */
public interface Connector {
    String id();

    Map<String, Object> call(String operation, Map<String, Object> payload) throws Exception;
}
