package netlab.provisioner.config;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword sets used to classify nodes by name.
 * Matching is a case-insensitive substring test.
 */
public final class ClassificationPolicy {

    private final List<String> switchKeywords;
    private final List<String> serverKeywords;
    private final List<String> firewallKeywords;
    private final List<String> collectorKeywords;

    private ClassificationPolicy(List<String> switchKeywords,
            List<String> serverKeywords,
            List<String> firewallKeywords,
            List<String> collectorKeywords) {
        this.switchKeywords = lower(switchKeywords);
        this.serverKeywords = lower(serverKeywords);
        this.firewallKeywords = lower(firewallKeywords);
        this.collectorKeywords = lower(collectorKeywords);
    }

    public static ClassificationPolicy defaults() {
        return new ClassificationPolicy(
                List.of("switch", "openvswitch", "ovs"),
                List.of("dhcp", "dnsmasq"),
                List.of("firewall"),
                List.of("collector"));
    }

    public static ClassificationPolicy of(List<String> switchKeywords,
            List<String> serverKeywords,
            List<String> firewallKeywords,
            List<String> collectorKeywords) {
        return new ClassificationPolicy(switchKeywords, serverKeywords, firewallKeywords, collectorKeywords);
    }

    /**
     * Parse a comma separated keyword list, e.g. {@code "switch, ovs"}.
     */
    public static List<String> parseKeywords(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public List<String> switchKeywords() {
        return switchKeywords;
    }

    public List<String> serverKeywords() {
        return serverKeywords;
    }

    public List<String> firewallKeywords() {
        return firewallKeywords;
    }

    public List<String> collectorKeywords() {
        return collectorKeywords;
    }

    public ClassificationPolicy withSwitchKeywords(List<String> keywords) {
        return new ClassificationPolicy(keywords, serverKeywords, firewallKeywords, collectorKeywords);
    }

    public ClassificationPolicy withServerKeywords(List<String> keywords) {
        return new ClassificationPolicy(switchKeywords, keywords, firewallKeywords, collectorKeywords);
    }

    public ClassificationPolicy withFirewallKeywords(List<String> keywords) {
        return new ClassificationPolicy(switchKeywords, serverKeywords, keywords, collectorKeywords);
    }

    public ClassificationPolicy withCollectorKeywords(List<String> keywords) {
        return new ClassificationPolicy(switchKeywords, serverKeywords, firewallKeywords, keywords);
    }

    private static List<String> lower(List<String> keywords) {
        Objects.requireNonNull(keywords, "keywords");
        return keywords.stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "ClassificationPolicy{switch=" + switchKeywords +
                ", server=" + serverKeywords +
                ", firewall=" + firewallKeywords +
                ", collector=" + collectorKeywords + '}';
    }
}
