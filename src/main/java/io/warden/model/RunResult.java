package io.warden.model;

import java.util.List;
import java.util.Map;

public record RunResult(
        String caseId,
        String playbookId,
        Map<String, TaskView> tasks,
        Map<String, Map<String, Object>> results,
        List<List<String>> layers,
        String ledgerTip,
        boolean suspended
) {
}
