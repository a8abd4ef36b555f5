package io.warden.graph;

import java.util.List;

public class CycleDetectedException extends CompileException {
    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Playbook contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Task names along the detected cycle; the first name is repeated at the end.
     */
    public List<String> cycle() {
        return cycle;
    }
}
