package netlab.provisioner.service;

import netlab.provisioner.config.ClassificationPolicy;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.console.ConsoleCommands;
import netlab.provisioner.console.ConsoleException;
import netlab.provisioner.console.ConsoleTargetResolver;
import netlab.provisioner.console.ScriptedConsoleConnector;
import netlab.provisioner.model.DhcpAssignResult;
import netlab.provisioner.model.NodeConfig;
import netlab.provisioner.model.NodeExecutionResult;
import netlab.provisioner.model.NodeRecord;
import netlab.provisioner.repository.InMemoryNodeRecordStore;
import netlab.provisioner.store.NodeStoreException;
import netlab.provisioner.util.Pause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DhcpOrchestratorTest {

    private static final String IP_ADDR = "2: eth0: <UP>\n    inet 10.0.0.5/24 brd 10.0.0.255 scope global eth0\n";

    private ProvisionerConfig config;
    private ScriptedConsoleConnector connector;

    @BeforeEach
    void setUp() {
        config = ProvisionerConfig.defaults().withoutDelays();
        connector = new ScriptedConsoleConnector()
                .on(5000, line -> line.startsWith("/usr/local/bin/start.sh") ? "dnsmasq started\n" : "")
                .on(5001, line -> line.startsWith("ip -4 addr show") ? IP_ADDR : "");
    }

    private DhcpOrchestrator orchestrator(InMemoryNodeRecordStore store) {
        return new DhcpOrchestrator(store, new ConsoleCommands(connector), new ConsoleTargetResolver(),
                new NodeClassifier(ClassificationPolicy.defaults()), config);
    }

    private static List<NodeRecord> lab() {
        return List.of(
                new NodeRecord("DHCP-Server-1", 5000, "127.0.0.1"),
                new NodeRecord("Workstation-1", 5001, "127.0.0.1"),
                new NodeRecord("IT-Switch", 5002, "127.0.0.1"));
    }

    @Test
    @DisplayName("Servers start first, clients lease, changed address is written once")
    void assignsAndPersistsLeasedAddress() {
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(lab());

        DhcpAssignResult result = orchestrator(store).assign();

        assertEquals(1, result.serverResults().size());
        NodeExecutionResult server = result.serverResults().get(0);
        assertTrue(server.success());
        assertEquals("start-server", server.action());
        assertTrue(server.output().contains("dnsmasq started"));

        assertEquals(2, result.clientResults().size());
        NodeExecutionResult workstation = result.clientResults().stream()
                .filter(r -> r.name().equals("Workstation-1")).findFirst().orElseThrow();
        assertTrue(workstation.success());
        assertEquals("10.0.0.5", workstation.assignedIp());
        assertEquals("127.0.0.1", workstation.host());
        assertEquals(5001, workstation.port());

        assertEquals(List.of("Workstation-1"), result.changedNodes());
        assertTrue(result.changed());
        assertNotNull(result.backupPath());
        assertEquals(1, store.writes());
        assertEquals(1, store.backups());
        assertEquals("10.0.0.5", store.node("Workstation-1").assignedIp());
    }

    @Test
    void serverPhaseRunsBeforeAnyClient() {
        orchestrator(new InMemoryNodeRecordStore(lab())).assign();

        List<ScriptedConsoleConnector.Sent> sent = connector.sent();
        assertEquals("/usr/local/bin/start.sh", sent.get(0).command());
        assertEquals(5000, sent.get(0).target().port());
        assertEquals(List.of("dhclient -v -1", "ip -4 addr show"), connector.sentTo(5001));
    }

    @Test
    void switchesAreSkippedWithoutDialing() {
        DhcpAssignResult result = orchestrator(new InMemoryNodeRecordStore(lab())).assign();

        NodeExecutionResult sw = result.clientResults().stream()
                .filter(r -> r.name().equals("IT-Switch")).findFirst().orElseThrow();
        assertTrue(sw.success());
        assertEquals("skipped", sw.output());
        assertFalse(connector.wasOpened(5002));
    }

    @Test
    void secondRunWithSameAddressDoesNotWrite() {
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(lab());
        DhcpOrchestrator orchestrator = orchestrator(store);

        orchestrator.assign();
        DhcpAssignResult second = orchestrator.assign();

        assertFalse(second.changed());
        assertNull(second.backupPath());
        assertEquals(1, store.writes());
    }

    @Test
    void nodeWithoutConsoleFailsAndIsNeverDialed() {
        NodeRecord ghost = new NodeRecord("PC-Ghost", null, null);
        ghost.withAssignedIp("10.9.9.9");
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(List.of(
                new NodeRecord("DHCP-Server-1", 5000, "127.0.0.1"), ghost));

        DhcpAssignResult result = orchestrator(store).assign();

        NodeExecutionResult r = result.clientResults().get(0);
        assertFalse(r.success());
        assertEquals("Missing console settings", r.error());
        assertEquals(1, connector.opened().size(), "only the server is dialed");
        // stale address is cleared and persisted
        assertNull(store.node("PC-Ghost").assignedIp());
        assertEquals(List.of("PC-Ghost"), result.changedNodes());
    }

    @Test
    void unreachableClientDoesNotStopTheBatch() {
        connector.refuse(5001);
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(List.of(
                new NodeRecord("Workstation-1", 5001, "127.0.0.1"),
                new NodeRecord("Workstation-2", 5003, "127.0.0.1")));
        connector.on(5003, line -> line.startsWith("ip -4") ? "inet 10.0.0.6/24 scope global" : "");

        DhcpAssignResult result = orchestrator(store).assign();

        assertEquals(2, result.clientResults().size());
        assertFalse(result.clientResults().get(0).success());
        assertTrue(result.clientResults().get(0).error().contains("Connection refused"));
        assertEquals("10.0.0.6", result.clientResults().get(1).assignedIp());
    }

    @Test
    void clientWithoutLeaseSucceedsWithNoAddress() {
        connector.on(5001, line -> "");
        DhcpAssignResult result = orchestrator(new InMemoryNodeRecordStore(lab())).assign();

        NodeExecutionResult workstation = result.clientResults().get(0);
        assertTrue(workstation.success());
        assertNull(workstation.assignedIp());
    }

    @Test
    void hostOverrideAppliesToEveryNode() {
        orchestrator(new InMemoryNodeRecordStore(lab()))
                .assign(new DhcpOrchestrator.Options("gns3.lab", config.dhclientTimeout(), config.dhcpWarmup()));

        assertTrue(connector.opened().stream().allMatch(t -> t.host().equals("gns3.lab")));
    }

    @Test
    void documentWithoutNodesListIsRejected() {
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(new NodeConfig());

        assertThrows(NodeStoreException.class, () -> orchestrator(store).assign());
    }

    @Test
    @DisplayName("A console that breaks mid-sequence is still closed with an exit")
    void sessionIsClosedWhenClientConsoleBreaks() {
        connector.on(5001, line -> {
            if (line.startsWith("dhclient")) {
                throw new ConsoleException("Read failed on 127.0.0.1:5001: Connection reset");
            }
            return "";
        });

        DhcpAssignResult result = orchestrator(new InMemoryNodeRecordStore(lab())).assign();

        NodeExecutionResult workstation = result.clientResults().stream()
                .filter(r -> r.name().equals("Workstation-1")).findFirst().orElseThrow();
        assertFalse(workstation.success());
        assertTrue(workstation.error().contains("Connection reset"));
        assertTrue(connector.wasOpened(5001));
        assertTrue(connector.allClosed());
        assertTrue(connector.exitSentOnEverySession());
    }

    @Test
    void concurrentRunsDoNotInterleave() throws Exception {
        AtomicInteger leasing = new AtomicInteger();
        AtomicInteger mostAtOnce = new AtomicInteger();
        connector.on(5001, line -> {
            if (line.startsWith("dhclient")) {
                mostAtOnce.accumulateAndGet(leasing.incrementAndGet(), Math::max);
                Pause.sleep(Duration.ofMillis(100));
                leasing.decrementAndGet();
                return "";
            }
            return line.startsWith("ip -4 addr show") ? IP_ADDR : "";
        });
        InMemoryNodeRecordStore store = new InMemoryNodeRecordStore(lab());
        DhcpOrchestrator orchestrator = orchestrator(store);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<DhcpAssignResult>> runs = pool.invokeAll(
                    List.<Callable<DhcpAssignResult>>of(orchestrator::assign, orchestrator::assign));
            for (Future<DhcpAssignResult> run : runs) {
                run.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, mostAtOnce.get());
        assertEquals(1, store.writes());
        assertEquals("10.0.0.5", store.node("Workstation-1").assignedIp());
    }
}
