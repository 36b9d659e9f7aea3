package netlab.provisioner.model;

import java.util.List;

/**
 * Result of setting up command logging for one student.
 */
public record LogCollectorResult(
        List<SnitchNodeInfo> snitchNodes,
        List<String> injectedNodes,
        List<String> skippedNodes,
        List<String> errors,
        boolean reusedExisting) {

    public LogCollectorResult {
        snitchNodes = List.copyOf(snitchNodes);
        injectedNodes = List.copyOf(injectedNodes);
        skippedNodes = List.copyOf(skippedNodes);
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return !snitchNodes.isEmpty();
    }
}
