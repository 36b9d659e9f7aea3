package netlab.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One node entry of the generated topology config.
 *
 * The record is owned by the node store. Orchestration only reads the console
 * fields and rewrites {@code assigned_ip}; any other property found on disk is
 * kept as-is so that a write-back does not lose data.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class NodeRecord {

    @JsonProperty("name")
    private String name;

    // Kept raw: the platform writes either a number or a numeric string.
    @JsonProperty("console")
    private Object console;

    @JsonProperty("console_host")
    private String consoleHost;

    @JsonProperty("assigned_ip")
    private String assignedIp;

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("status")
    private String status;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public NodeRecord() {
    }

    public NodeRecord(String name, Object console, String consoleHost) {
        this.name = name;
        this.console = console;
        this.consoleHost = consoleHost;
    }

    public String name() {
        return name == null ? "" : name;
    }

    public Object console() {
        return console;
    }

    public String consoleHost() {
        return consoleHost;
    }

    public String assignedIp() {
        return assignedIp;
    }

    public String nodeId() {
        return nodeId;
    }

    public String status() {
        return status;
    }

    public NodeRecord withAssignedIp(String ip) {
        this.assignedIp = ip;
        return this;
    }

    /**
     * Store a newly observed address.
     *
     * @return true if the stored value actually changed
     */
    public boolean updateAssignedIp(String ip) {
        if (Objects.equals(assignedIp, ip)) {
            return false;
        }
        assignedIp = ip;
        return true;
    }

    @JsonAnySetter
    void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    Map<String, Object> extra() {
        return extra;
    }

    @Override
    public String toString() {
        return "NodeRecord{name='" + name + "', console=" + console + ", consoleHost='" + consoleHost +
                "', assignedIp='" + assignedIp + "'}";
    }
}
