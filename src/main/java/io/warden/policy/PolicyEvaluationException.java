package io.warden.policy;

/**
 * A rule or checker that threw instead of answering. Treated as a denial.
 */
public class PolicyEvaluationException extends PolicyViolationException {
    public PolicyEvaluationException(String rule, String reason, Throwable cause) {
        super(rule, reason);
        initCause(cause);
    }
}
