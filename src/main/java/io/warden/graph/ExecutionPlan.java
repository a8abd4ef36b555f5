package io.warden.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiled, validated playbook graph. Layers run in order; tasks inside one layer have no
 * ordering constraint between them.
 */
public final class ExecutionPlan {
    private final List<List<String>> layers;
    private final Map<String, Integer> layerIndex;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;

    ExecutionPlan(List<List<String>> layers, Map<String, List<String>> dependencies) {
        List<List<String>> frozen = new ArrayList<>(layers.size());
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < layers.size(); i++) {
            frozen.add(List.copyOf(layers.get(i)));
            for (String name : layers.get(i)) {
                index.put(name, i);
            }
        }
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (String name : dependencies.keySet()) {
            reverse.put(name, new ArrayList<>());
        }
        for (Map.Entry<String, List<String>> e : dependencies.entrySet()) {
            for (String dep : e.getValue()) {
                reverse.get(dep).add(e.getKey());
            }
        }
        Map<String, List<String>> deps = new LinkedHashMap<>();
        dependencies.forEach((k, v) -> deps.put(k, List.copyOf(v)));
        Map<String, List<String>> dents = new LinkedHashMap<>();
        reverse.forEach((k, v) -> dents.put(k, List.copyOf(v)));
        this.layers = Collections.unmodifiableList(frozen);
        this.layerIndex = Collections.unmodifiableMap(index);
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(dents);
    }

    public List<List<String>> layers() {
        return layers;
    }

    public int layerCount() {
        return layers.size();
    }

    public int taskCount() {
        return layerIndex.size();
    }

    public int layerOf(String taskName) {
        Integer idx = layerIndex.get(taskName);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        return idx;
    }

    public List<String> dependenciesOf(String taskName) {
        List<String> deps = dependencies.get(taskName);
        if (deps == null) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        return deps;
    }

    public List<String> dependentsOf(String taskName) {
        List<String> dents = dependents.get(taskName);
        if (dents == null) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        return dents;
    }

    /**
     * Transitive dependencies of a task: every task that is guaranteed to be terminal before it
     * is dispatched.
     */
    public Set<String> upstreamOf(String taskName) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(dependenciesOf(taskName));
        while (!stack.isEmpty()) {
            String dep = stack.pop();
            if (seen.add(dep)) {
                stack.addAll(dependencies.get(dep));
            }
        }
        return Collections.unmodifiableSet(seen);
    }
}
