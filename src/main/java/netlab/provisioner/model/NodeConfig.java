package netlab.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level document of the generated topology config: a {@code nodes} list
 * plus whatever else the generator wrote (project name, links, ...).
 */
public final class NodeConfig {

    @JsonProperty("nodes")
    private List<NodeRecord> nodes;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public NodeConfig() {
    }

    public NodeConfig(List<NodeRecord> nodes) {
        this.nodes = new ArrayList<>(nodes);
    }

    /**
     * @return the node list, or null when the document has none
     */
    public List<NodeRecord> nodes() {
        return nodes;
    }

    public boolean hasNodes() {
        return nodes != null;
    }

    /** Case-insensitive lookup by node name. */
    public Optional<NodeRecord> findNode(String name) {
        if (nodes == null || name == null) {
            return Optional.empty();
        }
        String target = name.toLowerCase(Locale.ROOT);
        return nodes.stream()
                .filter(n -> n.name().toLowerCase(Locale.ROOT).equals(target))
                .findFirst();
    }

    @JsonAnySetter
    void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    Map<String, Object> extra() {
        return extra;
    }
}
