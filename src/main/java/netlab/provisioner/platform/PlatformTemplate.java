package netlab.provisioner.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformTemplate(
        @JsonProperty("template_id") String templateId,
        @JsonProperty("name") String name) {
}
