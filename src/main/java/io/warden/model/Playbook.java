package io.warden.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Playbook {
    private final String id;
    private final Map<String, TaskDefinition> tasks;

    public Playbook(String id, Map<String, TaskDefinition> tasks) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("playbook id cannot be empty");
        }
        this.id = id.trim();
        LinkedHashMap<String, TaskDefinition> copy = new LinkedHashMap<>();
        if (tasks != null) {
            for (Map.Entry<String, TaskDefinition> e : tasks.entrySet()) {
                if (!e.getKey().equals(e.getValue().name())) {
                    throw new IllegalArgumentException(
                            "Task key '" + e.getKey() + "' does not match definition name '" + e.getValue().name() + "'");
                }
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.tasks = Collections.unmodifiableMap(copy);
    }

    public static Playbook of(String id, TaskDefinition... definitions) {
        LinkedHashMap<String, TaskDefinition> tasks = new LinkedHashMap<>();
        for (TaskDefinition def : definitions) {
            if (tasks.putIfAbsent(def.name(), def) != null) {
                throw new IllegalArgumentException("Duplicate task name: " + def.name());
            }
        }
        return new Playbook(id, tasks);
    }

    public String id() {
        return id;
    }

    public Map<String, TaskDefinition> tasks() {
        return tasks;
    }

    public Collection<TaskDefinition> definitions() {
        return tasks.values();
    }
}
