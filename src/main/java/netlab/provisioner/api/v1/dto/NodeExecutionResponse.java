package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import netlab.provisioner.model.NodeExecutionResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeExecutionResponse(
        @JsonProperty("name") String name,
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("action") String action,
        @JsonProperty("success") boolean success,
        @JsonProperty("output") String output,
        @JsonProperty("error") String error,
        @JsonProperty("assignedIp") String assignedIp) {

    public static NodeExecutionResponse from(NodeExecutionResult result) {
        return new NodeExecutionResponse(
                result.name(),
                result.host(),
                result.port(),
                result.action(),
                result.success(),
                result.output(),
                result.error(),
                result.assignedIp());
    }
}
