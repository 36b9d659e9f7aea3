package netlab.provisioner.service;

/**
 * No free adapter left on a switch.
 */
public class PortAllocationException extends RuntimeException {

    public PortAllocationException(String message) {
        super(message);
    }
}
