package netlab.provisioner.service;

/**
 * A command finished with a non-zero exit code, or its exit code never arrived.
 */
public class CommandFailedException extends RuntimeException {

    private final Integer exitCode;
    private final String output;

    public CommandFailedException(String message, Integer exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    /** Null when the exit status is unknown. */
    public Integer exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
