package netlab.provisioner.service;

import netlab.provisioner.config.ClassificationPolicy;
import netlab.provisioner.model.NodeRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeClassifierTest {

    private final NodeClassifier classifier = new NodeClassifier(ClassificationPolicy.defaults());

    @Test
    void defaultKeywordsAreCaseInsensitive() {
        assertEquals(NodeRole.SWITCH, classifier.classify("IT-Switch"));
        assertEquals(NodeRole.SWITCH, classifier.classify("OpenvSwitch-2"));
        assertEquals(NodeRole.SWITCH, classifier.classify("core-OVS"));
        assertEquals(NodeRole.SERVER, classifier.classify("DHCP-Server-1"));
        assertEquals(NodeRole.SERVER, classifier.classify("dnsmasq"));
        assertEquals(NodeRole.FIREWALL, classifier.classify("Edge-Firewall"));
        assertEquals(NodeRole.COLLECTOR, classifier.classify("alice-IT-Collector"));
        assertEquals(NodeRole.PLAIN, classifier.classify("Workstation-1"));
        assertEquals(NodeRole.PLAIN, classifier.classify(null));
    }

    @Test
    void serverKeywordWinsOverSwitchKeyword() {
        assertEquals(NodeRole.SERVER, classifier.classify("dhcp-switch"));
    }

    @Test
    void infrastructureRolesAreSwitchAndCollector() {
        assertTrue(NodeRole.SWITCH.isInfrastructure());
        assertTrue(NodeRole.COLLECTOR.isInfrastructure());
        assertFalse(NodeRole.SERVER.isInfrastructure());
        assertFalse(NodeRole.FIREWALL.isInfrastructure());
        assertFalse(NodeRole.PLAIN.isInfrastructure());
    }

    @Test
    void customPolicyReplacesDefaults() {
        NodeClassifier custom = new NodeClassifier(ClassificationPolicy.defaults()
                .withServerKeywords(List.of("KEA")));

        assertEquals(NodeRole.SERVER, custom.classify("kea-1"));
        assertEquals(NodeRole.PLAIN, custom.classify("dhcp-1"));
    }
}
