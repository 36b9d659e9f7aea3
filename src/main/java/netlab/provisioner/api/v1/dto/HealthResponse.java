package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("nodeStore") String nodeStore,
        @JsonProperty("platformUrl") String platformUrl,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version) {

    public static HealthResponse healthy(String nodeStore, String platformUrl, String uptime, String version) {
        return new HealthResponse("healthy", nodeStore, platformUrl, uptime, version);
    }

    public static HealthResponse degraded(String nodeStore, String platformUrl, String uptime, String version) {
        return new HealthResponse("degraded", nodeStore, platformUrl, uptime, version);
    }
}
