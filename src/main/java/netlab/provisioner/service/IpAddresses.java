package netlab.provisioner.service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls IPv4 addresses out of console output.
 */
public final class IpAddresses {

    private static final Pattern INET = Pattern.compile("\\binet\\s+(\\d+\\.\\d+\\.\\d+\\.\\d+)/(\\d+)");
    private static final Pattern IPV4 = Pattern.compile(
            "\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b");

    private IpAddresses() {
    }

    /**
     * First {@code inet a.b.c.d/n} address in {@code ip addr} output, skipping loopback.
     */
    public static Optional<String> extractFirstIpv4(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = INET.matcher(output);
        while (m.find()) {
            String ip = m.group(1);
            if (!ip.startsWith("127.")) {
                return Optional.of(ip);
            }
        }
        return Optional.empty();
    }

    /**
     * First address in {@code hostname -I} style output, skipping loopback and link-local.
     */
    public static Optional<String> extractHostAddress(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = IPV4.matcher(output.strip());
        while (m.find()) {
            String ip = m.group();
            if (!ip.startsWith("127.") && !ip.startsWith("169.254.")) {
                return Optional.of(ip);
            }
        }
        return Optional.empty();
    }
}
