package netlab.provisioner.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformLink(
        @JsonProperty("link_id") String linkId,
        @JsonProperty("nodes") List<LinkEndpoint> nodes) {

    public List<LinkEndpoint> nodes() {
        return nodes == null ? List.of() : nodes;
    }
}
