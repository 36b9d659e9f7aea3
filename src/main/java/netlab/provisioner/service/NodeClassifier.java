package netlab.provisioner.service;

import netlab.provisioner.config.ClassificationPolicy;
import netlab.provisioner.model.NodeRole;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a {@link NodeRole} from a node name.
 * Server keywords win over switch keywords so a DHCP node is always started in the server phase.
 */
public class NodeClassifier {

    private final ClassificationPolicy policy;

    public NodeClassifier(ClassificationPolicy policy) {
        this.policy = policy;
    }

    public NodeRole classify(String name) {
        String lowered = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (matches(lowered, policy.serverKeywords())) {
            return NodeRole.SERVER;
        }
        if (matches(lowered, policy.switchKeywords())) {
            return NodeRole.SWITCH;
        }
        if (matches(lowered, policy.collectorKeywords())) {
            return NodeRole.COLLECTOR;
        }
        if (matches(lowered, policy.firewallKeywords())) {
            return NodeRole.FIREWALL;
        }
        return NodeRole.PLAIN;
    }

    private static boolean matches(String lowered, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowered.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
