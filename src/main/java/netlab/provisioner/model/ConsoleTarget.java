package netlab.provisioner.model;

/**
 * Host and port of a node's telnet console. Derived per operation, never persisted.
 */
public record ConsoleTarget(String host, int port) {

    public ConsoleTarget {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port <= 0) {
            throw new IllegalArgumentException("port must be positive: " + port);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
