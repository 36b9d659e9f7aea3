package netlab.provisioner.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformProject(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("status") String status) {
}
