package io.warden.policy;

import java.util.Map;

/**
 * Optional allow/deny layer consulted after the {@link PolicyGate} rules. Throwing counts as a
 * denial.
 */
@FunctionalInterface
public interface PolicyChecker {
    boolean allows(String taskType, String taskName, Map<String, Object> inputs) throws Exception;
}
