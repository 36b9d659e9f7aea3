package netlab.provisioner.service;

import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.console.ConsoleCommands;
import netlab.provisioner.console.ConsoleCommands.CommandStep;
import netlab.provisioner.console.ConsoleTargetResolver;
import netlab.provisioner.model.ConsoleTarget;
import netlab.provisioner.model.DhcpAssignResult;
import netlab.provisioner.model.NodeConfig;
import netlab.provisioner.model.NodeExecutionResult;
import netlab.provisioner.model.NodeRecord;
import netlab.provisioner.model.NodeRole;
import netlab.provisioner.repository.NodeRecordStore;
import netlab.provisioner.store.NodeStoreException;
import netlab.provisioner.util.Pause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-phase DHCP bring-up over node consoles.
 *
 * 1. Start the DHCP service on every server node.
 * 2. Wait once so servers can bind their sockets.
 * 3. Ask every client for a lease and record the address it reports.
 *
 * The node config is loaded once, mutated in memory, and written back (after a
 * backup) only if some {@code assigned_ip} actually changed. A failure on one
 * node never stops the batch.
 */
public class DhcpOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DhcpOrchestrator.class);

    static final String START_SERVER_ACTION = "start-server";
    static final String DHCLIENT_ACTION = "dhclient";
    static final String DHCP_START_COMMAND = "/usr/local/bin/start.sh";
    static final String DHCLIENT_COMMAND = "dhclient -v -1";
    static final String IP_SHOW_COMMAND = "ip -4 addr show";
    static final String MISSING_CONSOLE = "Missing console settings";

    /**
     * Per-run knobs.
     *
     * @param hostOverride    console host used for every node instead of the recorded one, may be null
     * @param dhclientTimeout how long to listen for lease output per client
     * @param dhcpWarmup      single pause between the server and client phases
     */
    public record Options(String hostOverride, Duration dhclientTimeout, Duration dhcpWarmup) {

        public static Options from(ProvisionerConfig config) {
            return new Options(config.consoleHostOverride(), config.dhclientTimeout(), config.dhcpWarmup());
        }
    }

    private record Classified(NodeRecord node, NodeRole role) {
    }

    private final NodeRecordStore store;
    private final ConsoleCommands commands;
    private final ConsoleTargetResolver resolver;
    private final NodeClassifier classifier;
    private final ProvisionerConfig config;

    public DhcpOrchestrator(NodeRecordStore store,
            ConsoleCommands commands,
            ConsoleTargetResolver resolver,
            NodeClassifier classifier,
            ProvisionerConfig config) {
        this.store = store;
        this.commands = commands;
        this.resolver = resolver;
        this.classifier = classifier;
        this.config = config;
    }

    public DhcpAssignResult assign() {
        return assign(Options.from(config));
    }

    /**
     * One run at a time: each run loads the store, owns it until the end and writes it at most once.
     */
    public synchronized DhcpAssignResult assign(Options options) {
        NodeConfig document = store.load();
        if (!document.hasNodes()) {
            throw new NodeStoreException("config missing 'nodes' list");
        }

        List<Classified> nodes = document.nodes().stream()
                .filter(Objects::nonNull)
                .map(n -> new Classified(n, classifier.classify(n.name())))
                .toList();

        List<NodeExecutionResult> serverResults = startServers(nodes, options.hostOverride());

        Pause.sleep(options.dhcpWarmup());

        List<String> changed = new ArrayList<>();
        List<NodeExecutionResult> clientResults = runClients(nodes, options, changed);

        Path backupPath = null;
        if (!changed.isEmpty()) {
            backupPath = store.backup();
            store.write(document);
            log.info("DHCP run changed {} node(s): {}", changed.size(), changed);
        } else {
            log.info("DHCP run left all addresses unchanged, store not written");
        }

        return new DhcpAssignResult(serverResults, clientResults, changed, backupPath);
    }

    private List<NodeExecutionResult> startServers(List<Classified> nodes, String hostOverride) {
        List<NodeExecutionResult> results = new ArrayList<>();
        for (Classified c : nodes) {
            if (c.role() != NodeRole.SERVER) {
                continue;
            }
            String name = c.node().name();
            Optional<ConsoleTarget> target = resolver.resolve(c.node(), hostOverride);
            if (target.isEmpty()) {
                log.warn("Server {} has no usable console, not started", name);
                results.add(NodeExecutionResult.unreachable(name, START_SERVER_ACTION, MISSING_CONSOLE));
                continue;
            }

            NodeExecutionResult.Builder result = NodeExecutionResult.builder()
                    .name(name)
                    .target(target.get())
                    .action(START_SERVER_ACTION);
            try {
                String output = commands.runCommand(target.get(), DHCP_START_COMMAND, config.serverStartWindow());
                results.add(result.success(true).output(output).build());
                log.info("Started DHCP service on {} ({})", name, target.get());
            } catch (RuntimeException e) {
                log.warn("Failed to start DHCP service on {}: {}", name, e.getMessage());
                results.add(result.success(false).error(e.getMessage()).build());
            }
        }
        return results;
    }

    private List<NodeExecutionResult> runClients(List<Classified> nodes, Options options, List<String> changed) {
        List<NodeExecutionResult> results = new ArrayList<>();
        for (Classified c : nodes) {
            NodeRecord node = c.node();
            String name = node.name();

            if (c.role() == NodeRole.SERVER) {
                continue;
            }
            if (c.role() == NodeRole.SWITCH) {
                results.add(NodeExecutionResult.builder()
                        .name(name).action(DHCLIENT_ACTION).success(true).output("skipped").build());
                continue;
            }

            Optional<ConsoleTarget> target = resolver.resolve(node, options.hostOverride());
            if (target.isEmpty()) {
                log.warn("Client {} has no usable console, not dialed", name);
                clearAddress(node, changed);
                results.add(NodeExecutionResult.unreachable(name, DHCLIENT_ACTION, MISSING_CONSOLE));
                continue;
            }

            NodeExecutionResult.Builder result = NodeExecutionResult.builder()
                    .name(name)
                    .target(target.get())
                    .action(DHCLIENT_ACTION);
            try {
                String output = commands.runCommandSequence(target.get(), List.of(
                        new CommandStep(DHCLIENT_COMMAND, options.dhclientTimeout()),
                        new CommandStep(IP_SHOW_COMMAND, config.addressShowWindow())),
                        config.interCommandDelay());
                String ip = IpAddresses.extractFirstIpv4(output).orElse(null);
                if (node.updateAssignedIp(ip)) {
                    changed.add(name);
                }
                if (ip == null) {
                    log.warn("No IPv4 address reported by {}", name);
                } else {
                    log.info("{} leased {}", name, ip);
                }
                results.add(result.success(true).output(output).assignedIp(ip).build());
            } catch (RuntimeException e) {
                log.warn("DHCP client run failed on {}: {}", name, e.getMessage());
                clearAddress(node, changed);
                results.add(result.success(false).error(e.getMessage()).build());
            }
        }
        return results;
    }

    private static void clearAddress(NodeRecord node, List<String> changed) {
        if (node.updateAssignedIp(null)) {
            changed.add(node.name());
        }
    }
}
