package netlab.provisioner.console;

import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.model.ConsoleTarget;

import java.time.Duration;

/**
 * Opens {@link TelnetConsoleSession}s with the configured timeouts.
 */
public class TelnetConsoleConnector implements ConsoleConnector {

    private final Duration connectTimeout;
    private final Duration pollInterval;

    public TelnetConsoleConnector(Duration connectTimeout, Duration pollInterval) {
        this.connectTimeout = connectTimeout;
        this.pollInterval = pollInterval;
    }

    public TelnetConsoleConnector(ProvisionerConfig config) {
        this(config.connectTimeout(), config.readPollInterval());
    }

    @Override
    public ConsoleSession open(ConsoleTarget target) {
        ConsoleSettings settings = ConsoleSettings.of(target).withTimeouts(connectTimeout, pollInterval);
        TelnetConsoleSession session = new TelnetConsoleSession(settings);
        session.connect();
        return session;
    }
}
