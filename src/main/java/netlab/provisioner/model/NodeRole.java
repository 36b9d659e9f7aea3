package netlab.provisioner.model;

/**
 * Role of a node inferred from its operator-chosen name.
 */
public enum NodeRole {
    SWITCH,
    SERVER,
    FIREWALL,
    COLLECTOR,
    PLAIN;

    /** Switches and collectors carry no student traffic of their own. */
    public boolean isInfrastructure() {
        return this == SWITCH || this == COLLECTOR;
    }
}
