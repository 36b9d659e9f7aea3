package netlab.provisioner.console;

/**
 * Connection or I/O failure on a node console.
 */
public class ConsoleException extends RuntimeException {

    public ConsoleException(String message) {
        super(message);
    }

    public ConsoleException(String message, Throwable cause) {
        super(message, cause);
    }
}
