package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netlab.provisioner.model.LogCollectorResult;
import netlab.provisioner.model.SnitchNodeInfo;

import java.util.List;

/**
 * Response DTO for collector deployment.
 * POST /api/v1/collectors/{student}
 */
public record CollectorSetupResponse(
        @JsonProperty("student") String student,
        @JsonProperty("success") boolean success,
        @JsonProperty("reusedExisting") boolean reusedExisting,
        @JsonProperty("snitchNodes") List<SnitchNodeInfo> snitchNodes,
        @JsonProperty("injectedNodes") List<String> injectedNodes,
        @JsonProperty("skippedNodes") List<String> skippedNodes,
        @JsonProperty("errors") List<String> errors) {

    public static CollectorSetupResponse from(String student, LogCollectorResult result) {
        return new CollectorSetupResponse(
                student,
                result.success(),
                result.reusedExisting(),
                result.snitchNodes(),
                result.injectedNodes(),
                result.skippedNodes(),
                result.errors());
    }
}
