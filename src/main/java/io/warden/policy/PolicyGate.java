package io.warden.policy;

import io.warden.model.Case;
import io.warden.model.TaskView;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Ordered guard rules evaluated against a case, or a case and one of its tasks. Rules run in
 * registration order and the first failing predicate raises {@link PolicyViolationException}.
 * A predicate that throws counts as failing and raises {@link PolicyEvaluationException}.
 */
public final class PolicyGate {
    private final List<CasePolicyRule> caseRules = new CopyOnWriteArrayList<>();
    private final List<TaskPolicyRule> taskRules = new CopyOnWriteArrayList<>();

    public static PolicyGate permissive() {
        return new PolicyGate();
    }

    public static PolicyGate defaults() {
        PolicyGate gate = new PolicyGate();
        gate.registerCaseRule(
                "case-title-present",
                c -> c.title() != null && !c.title().isBlank(),
                "Case title is required."
        );
        gate.registerTaskRule(
                "outputs-after-approval",
                PolicyPhase.PRE_COMPLETION,
                (c, task) -> task.approver() == null || hasOutput(task.output()),
                "Approved tasks must emit outputs before completion."
        );
        return gate;
    }

    public PolicyGate registerCaseRule(String name, Predicate<Case> predicate, String message) {
        caseRules.add(new CasePolicyRule(name, predicate, message));
        return this;
    }

    public PolicyGate registerTaskRule(String name, PolicyPhase phase, BiPredicate<Case, TaskView> predicate, String message) {
        taskRules.add(new TaskPolicyRule(name, phase, predicate, message));
        return this;
    }

    public PolicyGate registerTaskRule(String name, BiPredicate<Case, TaskView> predicate, String message) {
        return registerTaskRule(name, PolicyPhase.PRE_DISPATCH, predicate, message);
    }

    public void evaluateCase(Case subject) {
        for (CasePolicyRule rule : caseRules) {
            boolean passed;
            try {
                passed = rule.predicate().test(subject);
            } catch (RuntimeException e) {
                throw ruleError(rule.name(), e);
            }
            if (!passed) {
                throw new PolicyViolationException(rule.name(), rule.message());
            }
        }
    }

    public void evaluateTask(Case subject, TaskView task, PolicyPhase phase) {
        for (TaskPolicyRule rule : taskRules) {
            if (rule.phase() != phase) {
                continue;
            }
            boolean passed;
            try {
                passed = rule.predicate().test(subject, task);
            } catch (RuntimeException e) {
                throw ruleError(rule.name(), e);
            }
            if (!passed) {
                throw new PolicyViolationException(rule.name(), rule.message());
            }
        }
    }

    public List<CasePolicyRule> caseRules() {
        return List.copyOf(caseRules);
    }

    public List<TaskPolicyRule> taskRules() {
        return List.copyOf(taskRules);
    }

    private static PolicyEvaluationException ruleError(String rule, RuntimeException e) {
        String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new PolicyEvaluationException(rule, "rule evaluation error: " + detail, e);
    }

    private static boolean hasOutput(Map<String, Object> output) {
        return output != null && !output.isEmpty();
    }
}
