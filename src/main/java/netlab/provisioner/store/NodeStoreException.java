package netlab.provisioner.store;

/**
 * The node store could not be read or written.
 */
public class NodeStoreException extends RuntimeException {

    public NodeStoreException(String message) {
        super(message);
    }

    public NodeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
