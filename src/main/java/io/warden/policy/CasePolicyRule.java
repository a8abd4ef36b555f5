package io.warden.policy;

import io.warden.model.Case;

import java.util.function.Predicate;

public record CasePolicyRule(String name, Predicate<Case> predicate, String message) {
    public CasePolicyRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("policy rule name cannot be empty");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("policy rule predicate cannot be null: " + name);
        }
    }
}
