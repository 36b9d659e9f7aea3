package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for collected command logs.
 * GET /api/v1/collectors/{student}/logs
 */
public record CollectorLogsResponse(
        @JsonProperty("student") String student,
        @JsonProperty("logs") Map<String, String> logs,
        @JsonProperty("errors") List<String> errors) {
}
