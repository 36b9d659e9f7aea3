package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport settings of one console session.
 *
 * @param newline line terminator appended to commands; emulated consoles expect CR framing
 */
public record ConsoleSettings(
        ConsoleTarget target,
        Charset charset,
        String newline,
        Duration connectTimeout,
        Duration pollInterval) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    public ConsoleSettings {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(charset, "charset");
        Objects.requireNonNull(newline, "newline");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public static ConsoleSettings of(ConsoleTarget target) {
        return new ConsoleSettings(target, StandardCharsets.UTF_8, "\r",
                DEFAULT_CONNECT_TIMEOUT, DEFAULT_POLL_INTERVAL);
    }

    public ConsoleSettings withTimeouts(Duration connectTimeout, Duration pollInterval) {
        return new ConsoleSettings(target, charset, newline, connectTimeout, pollInterval);
    }
}
