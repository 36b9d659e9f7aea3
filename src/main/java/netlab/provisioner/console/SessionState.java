package netlab.provisioner.console;

/**
 * Lifecycle of a console session. There is no reconnect: a closed session stays closed.
 */
public enum SessionState {
    CLOSED,
    CONNECTING,
    OPEN
}
