package netlab.provisioner.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One side of a link: node plus adapter/port numbers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkEndpoint(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("adapter_number") int adapterNumber,
        @JsonProperty("port_number") int portNumber) {
}
