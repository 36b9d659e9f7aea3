package netlab.provisioner.model;

/**
 * Outcome of running a script that already lives on a node.
 */
public record ScriptExecutionResult(
        String nodeName,
        String host,
        int port,
        String remotePath,
        boolean success,
        Integer exitCode,
        String output,
        String error) {
}
