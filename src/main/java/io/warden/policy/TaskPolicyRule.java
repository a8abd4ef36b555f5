package io.warden.policy;

import io.warden.model.Case;
import io.warden.model.TaskView;

import java.util.function.BiPredicate;

public record TaskPolicyRule(
        String name,
        PolicyPhase phase,
        BiPredicate<Case, TaskView> predicate,
        String message
) {
    public TaskPolicyRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("policy rule name cannot be empty");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("policy rule predicate cannot be null: " + name);
        }
        phase = phase == null ? PolicyPhase.PRE_DISPATCH : phase;
    }
}
