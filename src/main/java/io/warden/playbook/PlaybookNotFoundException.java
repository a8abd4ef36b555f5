package io.warden.playbook;

public class PlaybookNotFoundException extends IllegalArgumentException {
    public PlaybookNotFoundException(String playbookId) {
        super("Unknown playbook: " + playbookId);
    }
}
