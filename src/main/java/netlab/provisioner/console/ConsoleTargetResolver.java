package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;
import netlab.provisioner.model.NodeRecord;
import netlab.provisioner.platform.PlatformNode;

import java.util.Optional;

/**
 * Works out where to dial a node's console.
 *
 * Host candidates are tried in order: explicit override, the node's recorded
 * console host, then loopback. The platform reports {@code 0.0.0.0} when a
 * console listens on all interfaces; that value is not dialable and is skipped.
 * Resolution never throws: an empty result is a normal outcome.
 */
public class ConsoleTargetResolver {

    public static final String LOOPBACK = "127.0.0.1";
    private static final String ANY_ADDRESS = "0.0.0.0";

    public Optional<ConsoleTarget> resolve(NodeRecord node, String overrideHost) {
        return resolve(node.console(), node.consoleHost(), overrideHost);
    }

    public Optional<ConsoleTarget> resolve(PlatformNode node, String overrideHost) {
        return resolve(node.console(), node.consoleHost(), overrideHost);
    }

    public Optional<ConsoleTarget> resolve(Object consolePort, String recordedHost, String overrideHost) {
        Optional<Integer> port = parsePort(consolePort);
        if (port.isEmpty()) {
            return Optional.empty();
        }
        for (String candidate : new String[] {overrideHost, recordedHost, LOOPBACK}) {
            Optional<String> host = normalizeHost(candidate);
            if (host.isPresent()) {
                return Optional.of(new ConsoleTarget(host.get(), port.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Reduce a host value to its bare host part.
     * Accepts {@code host}, {@code host:port}, {@code [v6]:port} and URL forms.
     *
     * @return empty for blank values and {@code 0.0.0.0}
     */
    public static Optional<String> normalizeHost(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String raw = value.trim();
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        int scheme = raw.indexOf("://");
        if (scheme >= 0) {
            raw = raw.substring(scheme + 3);
        } else if (raw.startsWith("//")) {
            raw = raw.substring(2);
        }
        int slash = raw.indexOf('/');
        if (slash >= 0) {
            raw = raw.substring(0, slash);
        }
        int at = raw.lastIndexOf('@');
        if (at >= 0) {
            raw = raw.substring(at + 1);
        }

        String candidate;
        if (raw.startsWith("[")) {
            int close = raw.indexOf(']');
            candidate = close > 0 ? raw.substring(1, close) : raw.substring(1);
        } else {
            int colon = raw.indexOf(':');
            boolean bareIpv6 = colon >= 0 && raw.indexOf(':', colon + 1) >= 0;
            candidate = (colon >= 0 && !bareIpv6) ? raw.substring(0, colon) : raw;
        }

        candidate = candidate.trim();
        if (candidate.isEmpty() || ANY_ADDRESS.equals(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    static Optional<Integer> parsePort(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        int port;
        if (value instanceof Number n) {
            port = n.intValue();
        } else {
            try {
                port = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return port > 0 ? Optional.of(port) : Optional.empty();
    }
}
