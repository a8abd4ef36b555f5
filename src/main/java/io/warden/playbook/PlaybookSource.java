package io.warden.playbook;

import io.warden.model.Playbook;

import java.util.Map;

public interface PlaybookSource {
    /**
     * Resolves {@code playbookId} into its task definitions.
     *
     * @throws PlaybookNotFoundException when no playbook has that id
     */
    Playbook resolve(String playbookId, Map<String, Object> context);
}
