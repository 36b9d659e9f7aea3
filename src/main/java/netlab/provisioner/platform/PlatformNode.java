package netlab.provisioner.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node as reported by the emulation platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformNode(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("name") String name,
        @JsonProperty("console") Integer console,
        @JsonProperty("console_host") String consoleHost,
        @JsonProperty("console_type") String consoleType,
        @JsonProperty("status") String status,
        @JsonProperty("x") int x,
        @JsonProperty("y") int y) {

    public String name() {
        return name == null ? "" : name;
    }

    public boolean hasTelnetConsole() {
        return "telnet".equals(consoleType);
    }
}
