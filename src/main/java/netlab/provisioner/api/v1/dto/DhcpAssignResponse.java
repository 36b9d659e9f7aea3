package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netlab.provisioner.model.DhcpAssignResult;

import java.util.List;

/**
 * Response DTO for a DHCP bring-up run.
 * POST /api/v1/dhcp/assign
 */
public record DhcpAssignResponse(
        @JsonProperty("changed") boolean changed,
        @JsonProperty("backupPath") String backupPath,
        @JsonProperty("changedNodes") List<String> changedNodes,
        @JsonProperty("serverResults") List<NodeExecutionResponse> serverResults,
        @JsonProperty("clientResults") List<NodeExecutionResponse> clientResults) {

    public static DhcpAssignResponse from(DhcpAssignResult result) {
        return new DhcpAssignResponse(
                result.changed(),
                result.backupPath() != null ? result.backupPath().toString() : null,
                result.changedNodes(),
                result.serverResults().stream().map(NodeExecutionResponse::from).toList(),
                result.clientResults().stream().map(NodeExecutionResponse::from).toList());
    }
}
