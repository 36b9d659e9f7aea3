package netlab.provisioner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netlab.provisioner.service.DhcpOrchestrator;

import java.time.Duration;

/**
 * Request DTO for a DHCP bring-up run.
 * POST /api/v1/dhcp/assign
 *
 * Durations are in seconds; absent fields fall back to the configured defaults.
 */
public record DhcpAssignRequest(
        @JsonProperty("hostOverride") String hostOverride,
        @JsonProperty("dhclientTimeout") Double dhclientTimeout,
        @JsonProperty("dhcpWarmup") Double dhcpWarmup) {

    public static DhcpAssignRequest empty() {
        return new DhcpAssignRequest(null, null, null);
    }

    public void validate() {
        if (dhclientTimeout != null && dhclientTimeout <= 0) {
            throw new IllegalArgumentException("dhclientTimeout must be positive");
        }
        if (dhcpWarmup != null && dhcpWarmup < 0) {
            throw new IllegalArgumentException("dhcpWarmup must not be negative");
        }
    }

    /** Merge with defaults taken from configuration. */
    public DhcpOrchestrator.Options toOptions(DhcpOrchestrator.Options defaults) {
        return new DhcpOrchestrator.Options(
                hostOverride != null && !hostOverride.isBlank() ? hostOverride : defaults.hostOverride(),
                dhclientTimeout != null ? seconds(dhclientTimeout) : defaults.dhclientTimeout(),
                dhcpWarmup != null ? seconds(dhcpWarmup) : defaults.dhcpWarmup());
    }

    static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
