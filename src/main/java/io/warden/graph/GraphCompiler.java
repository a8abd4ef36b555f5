package io.warden.graph;

import io.warden.model.TaskDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a task definition set into an {@link ExecutionPlan}. Stateless; one instance may be shared.
 *
 * <p>Validation runs in three passes: every {@code needs} entry must name a known task, the
 * dependency relation must be acyclic (self-dependencies included), and Kahn leveling must place
 * every task. Layers list task names in definition order so plans are reproducible.
 */
public final class GraphCompiler {

    public ExecutionPlan compile(Map<String, TaskDefinition> definitions) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (Map.Entry<String, TaskDefinition> e : definitions.entrySet()) {
            graph.put(e.getKey(), e.getValue().needs());
        }
        for (Map.Entry<String, List<String>> e : graph.entrySet()) {
            for (String dep : e.getValue()) {
                if (!graph.containsKey(dep)) {
                    throw new UnknownDependencyException(e.getKey(), dep);
                }
            }
        }

        Set<String> visited = new HashSet<>();
        for (String name : graph.keySet()) {
            if (!visited.contains(name)) {
                dfsCycleCheck(name, graph, new ArrayDeque<>(), new HashSet<>(), visited);
            }
        }

        return new ExecutionPlan(layer(graph), graph);
    }

    private void dfsCycleCheck(
            String name,
            Map<String, List<String>> graph,
            Deque<String> path,
            Set<String> onPath,
            Set<String> visited
    ) {
        path.addLast(name);
        onPath.add(name);
        for (String dep : graph.get(name)) {
            if (onPath.contains(dep)) {
                throw new CycleDetectedException(cycleFrom(dep, path));
            }
            if (!visited.contains(dep)) {
                dfsCycleCheck(dep, graph, path, onPath, visited);
            }
        }
        onPath.remove(name);
        path.removeLast();
        visited.add(name);
    }

    private List<String> cycleFrom(String start, Deque<String> path) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String step : path) {
            if (step.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(step);
            }
        }
        cycle.add(start);
        return cycle;
    }

    private List<List<String>> layer(Map<String, List<String>> graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String name : graph.keySet()) {
            inDegree.put(name, graph.get(name).size());
            dependents.put(name, new ArrayList<>());
        }
        for (Map.Entry<String, List<String>> e : graph.entrySet()) {
            for (String dep : e.getValue()) {
                dependents.get(dep).add(e.getKey());
            }
        }

        List<List<String>> layers = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<String> frontier = new ArrayList<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                frontier.add(e.getKey());
            }
        }
        while (!frontier.isEmpty()) {
            layers.add(frontier);
            placed.addAll(frontier);
            Set<String> released = new HashSet<>();
            for (String done : frontier) {
                for (String dependent : dependents.get(done)) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        released.add(dependent);
                    }
                }
            }
            List<String> next = new ArrayList<>();
            for (String name : graph.keySet()) {
                if (released.contains(name)) {
                    next.add(name);
                }
            }
            frontier = next;
        }

        if (placed.size() != graph.size()) {
            List<String> stuck = new ArrayList<>();
            for (String name : graph.keySet()) {
                if (!placed.contains(name)) {
                    stuck.add(name);
                }
            }
            throw new CycleDetectedException(stuck);
        }
        return layers;
    }
}
