package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for deploying a student's collectors.
 * POST /api/v1/collectors/{student}
 */
public record CollectorSetupRequest(
        @JsonProperty("itSwitch") String itSwitch,
        @JsonProperty("otSwitch") String otSwitch) {

    public static CollectorSetupRequest empty() {
        return new CollectorSetupRequest(null, null);
    }

    public String itSwitchOr(String fallback) {
        return itSwitch == null || itSwitch.isBlank() ? fallback : itSwitch.trim();
    }

    public String otSwitchOr(String fallback) {
        return otSwitch == null || otSwitch.isBlank() ? fallback : otSwitch.trim();
    }
}
