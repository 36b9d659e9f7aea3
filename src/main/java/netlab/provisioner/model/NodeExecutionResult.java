package netlab.provisioner.model;

import java.util.Objects;

/**
 * Immutable outcome of one console operation against one node.
 */
public final class NodeExecutionResult {
    private final String name;
    private final String host;
    private final int port;
    private final String action;
    private final boolean success;
    private final String output;
    private final String error;
    private final String assignedIp;

    private NodeExecutionResult(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.host = builder.host == null ? "" : builder.host;
        this.port = builder.port;
        this.action = Objects.requireNonNull(builder.action, "action is required");
        this.success = builder.success;
        this.output = builder.output;
        this.error = builder.error;
        this.assignedIp = builder.assignedIp;
    }

    // Getters
    public String name() {
        return name;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String action() {
        return action;
    }

    public boolean success() {
        return success;
    }

    public String output() {
        return output;
    }

    public String error() {
        return error;
    }

    public String assignedIp() {
        return assignedIp;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Failure for a node that was never dialed. */
    public static NodeExecutionResult unreachable(String name, String action, String error) {
        return builder().name(name).action(action).success(false).error(error).build();
    }

    public static final class Builder {
        private String name;
        private String host;
        private int port;
        private String action;
        private boolean success;
        private String output;
        private String error;
        private String assignedIp;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder target(ConsoleTarget target) {
            this.host = target.host();
            this.port = target.port();
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder assignedIp(String assignedIp) {
            this.assignedIp = assignedIp;
            return this;
        }

        public NodeExecutionResult build() {
            return new NodeExecutionResult(this);
        }
    }

    @Override
    public String toString() {
        return "NodeExecutionResult{name='" + name + "', action=" + action + ", success=" + success +
                (error != null ? ", error='" + error + "'" : "") +
                (assignedIp != null ? ", assignedIp=" + assignedIp : "") + "}";
    }
}
