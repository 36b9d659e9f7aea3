package netlab.provisioner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A provisioned log collector.
 * The node name is the durable handle; {@code nodeId} is only valid for the current platform session.
 */
public record SnitchNodeInfo(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("name") String name,
        @JsonProperty("ipAddress") String ipAddress,
        @JsonProperty("port") int port,
        @JsonProperty("connectedToSwitch") String connectedToSwitch,
        @JsonProperty("consolePort") Integer consolePort,
        @JsonProperty("consoleHost") String consoleHost) {

    public static final int SYSLOG_PORT = 514;

    /**
     * Short collector type used as key in log listings: it, ot or the lower-cased name.
     * The {@code -IT-}/{@code -OT-} name segment wins over a plain substring so a student
     * prefix such as "Scott" does not decide the type.
     */
    public String collectorType() {
        String upper = name.toUpperCase(Locale.ROOT);
        if (upper.contains("-IT-")) {
            return "it";
        }
        if (upper.contains("-OT-")) {
            return "ot";
        }
        if (upper.contains("IT")) {
            return "it";
        }
        if (upper.contains("OT")) {
            return "ot";
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
