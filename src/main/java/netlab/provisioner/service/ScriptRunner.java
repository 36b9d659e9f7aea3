package netlab.provisioner.service;

import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.console.CommandResult;
import netlab.provisioner.console.ConsoleConnector;
import netlab.provisioner.console.ConsoleSession;
import netlab.provisioner.console.ConsoleTargetResolver;
import netlab.provisioner.model.ConsoleTarget;
import netlab.provisioner.model.NodeRecord;
import netlab.provisioner.model.ScriptExecutionResult;
import netlab.provisioner.repository.NodeRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs a script already present on a node and reports its exit status.
 */
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    public static final String DEFAULT_SHELL = "sh";

    private final NodeRecordStore store;
    private final ConsoleConnector connector;
    private final ConsoleTargetResolver resolver;
    private final ProvisionerConfig config;

    public ScriptRunner(NodeRecordStore store,
            ConsoleConnector connector,
            ConsoleTargetResolver resolver,
            ProvisionerConfig config) {
        this.store = store;
        this.connector = connector;
        this.resolver = resolver;
        this.config = config;
    }

    /**
     * Execute {@code <shell> <remotePath>} on the node's console.
     * Failures are reported in the result, never thrown.
     *
     * @throws IllegalArgumentException if the node name or path is blank, or the node is unknown
     */
    public ScriptExecutionResult run(String nodeName, String remotePath, String shell, Duration timeout) {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName is required");
        }
        if (remotePath == null || remotePath.isBlank()) {
            throw new IllegalArgumentException("remotePath is required");
        }
        NodeRecord node = store.load().findNode(nodeName)
                .orElseThrow(() -> new IllegalArgumentException("Node '" + nodeName + "' not found"));

        Optional<ConsoleTarget> target = resolver.resolve(node, config.consoleHostOverride());
        if (target.isEmpty()) {
            return new ScriptExecutionResult(node.name(), null, 0, remotePath, false, null, "",
                    "Missing console settings");
        }
        String host = target.get().host();
        int port = target.get().port();

        String command = (shell == null || shell.isBlank() ? DEFAULT_SHELL : shell.trim()) + " " + remotePath;
        try (ConsoleSession console = connector.open(target.get())) {
            CommandResult result = console.runCommandWithStatus(command, timeout);
            boolean ok = result.succeeded();
            String error = null;
            if (!result.completed()) {
                error = "Exit status not received within " + timeout.toMillis() + " ms";
            } else if (!ok) {
                error = "Script exited with code " + result.exitCode();
            }
            log.info("Script {} on {} finished: exit={}", remotePath, node.name(), result.exitCode());
            return new ScriptExecutionResult(node.name(), host, port, remotePath, ok, result.exitCode(),
                    result.output(), error);
        } catch (RuntimeException e) {
            log.warn("Script {} on {} failed: {}", remotePath, node.name(), e.getMessage());
            return new ScriptExecutionResult(node.name(), host, port, remotePath, false, null, "", e.getMessage());
        }
    }

    /**
     * Like {@link #run} but raises when the script did not exit with 0.
     *
     * @throws CommandFailedException on a non-zero or unknown exit code
     */
    public ScriptExecutionResult runOrThrow(String nodeName, String remotePath, String shell, Duration timeout) {
        ScriptExecutionResult result = run(nodeName, remotePath, shell, timeout);
        if (!result.success()) {
            throw new CommandFailedException(
                    "Script " + remotePath + " failed on " + result.nodeName() + ": " + result.error(),
                    result.exitCode(), result.output());
        }
        return result;
    }
}
