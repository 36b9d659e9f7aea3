package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Request DTO for running a script on a node.
 * POST /api/v1/scripts/run
 */
public record ScriptRunRequest(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("remotePath") String remotePath,
        @JsonProperty("shell") String shell,
        @JsonProperty("timeout") Double timeout) {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public void validate() {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName is required");
        }
        if (remotePath == null || remotePath.isBlank()) {
            throw new IllegalArgumentException("remotePath is required");
        }
        if (timeout != null && timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /** Read window for the script, seconds in the request. */
    public Duration timeoutDuration() {
        return timeout == null ? DEFAULT_TIMEOUT : DhcpAssignRequest.seconds(timeout);
    }
}
