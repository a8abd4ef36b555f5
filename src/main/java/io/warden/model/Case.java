package io.warden.model;

import java.util.Map;

public record Case(String caseId, String title, Map<String, Object> metadata) {
    public Case {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("case id cannot be empty");
        }
        title = title == null ? "" : title;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Case of(String caseId, String title) {
        return new Case(caseId, title, Map.of());
    }
}
