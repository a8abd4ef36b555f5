package io.warden.policy;

public class PolicyViolationException extends RuntimeException {
    private final String rule;
    private final String reason;

    public PolicyViolationException(String rule, String reason) {
        super(rule + ": " + reason);
        this.rule = rule;
        this.reason = reason;
    }

    public String rule() {
        return rule;
    }

    public String reason() {
        return reason;
    }
}
