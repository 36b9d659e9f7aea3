package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;
import netlab.provisioner.util.Pause;

import java.time.Duration;
import java.util.List;

/**
 * One-shot helpers: open a session, run commands, close.
 */
public class ConsoleCommands {

    /**
     * A command and how long to listen for its output.
     */
    public record CommandStep(String command, Duration readDuration) {
    }

    private final ConsoleConnector connector;

    public ConsoleCommands(ConsoleConnector connector) {
        this.connector = connector;
    }

    public String runCommand(ConsoleTarget target, String command, Duration readDuration) {
        try (ConsoleSession console = connector.open(target)) {
            return console.runCommand(command, readDuration);
        }
    }

    /**
     * Run commands in order on one session and return the concatenated output.
     */
    public String runCommandSequence(ConsoleTarget target, List<CommandStep> steps, Duration interCommandDelay) {
        StringBuilder output = new StringBuilder();
        try (ConsoleSession console = connector.open(target)) {
            for (CommandStep step : steps) {
                output.append(console.runCommand(step.command(), step.readDuration()));
                Pause.sleep(interCommandDelay);
            }
        }
        return output.toString();
    }
}
