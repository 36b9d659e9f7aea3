package netlab.provisioner.service;

import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.console.ConsoleConnector;
import netlab.provisioner.console.ConsoleException;
import netlab.provisioner.console.ConsoleSession;
import netlab.provisioner.console.ConsoleTargetResolver;
import netlab.provisioner.model.CollectorConfig;
import netlab.provisioner.model.ConsoleTarget;
import netlab.provisioner.model.LogCollectorResult;
import netlab.provisioner.model.NodeRole;
import netlab.provisioner.model.SnitchNodeInfo;
import netlab.provisioner.platform.LinkEndpoint;
import netlab.provisioner.platform.PlatformClient;
import netlab.provisioner.platform.PlatformLink;
import netlab.provisioner.platform.PlatformNode;
import netlab.provisioner.platform.PlatformTemplate;
import netlab.provisioner.util.Pause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deploys syslog collector nodes for a student and wires every other node to
 * forward its shell history to them.
 *
 * Every step that can fail on a single node adds a message to the error list
 * and moves on; callers get partial results plus the errors.
 */
public class NodeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(NodeProvisioner.class);

    static final int MAX_SWITCH_ADAPTER = 15;
    static final int COLLECTOR_OFFSET_X = 150;
    static final int COLLECTOR_OFFSET_Y = 100;
    static final String ADDRESS_COMMAND = "hostname -I";
    static final String LEASE_COMMAND = "dhclient -v -1";
    static final String SYSLOG_PROBE_COMMAND = "pgrep syslog-ng";
    static final String SYSLOG_START_COMMAND = "syslog-ng";
    static final String COLLECTOR_SUFFIX = "Collector";
    private static final Duration SETTLE_DRAIN = Duration.ofSeconds(1);

    private static final Pattern STUDENT_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    /**
     * Adapter/port pair on a switch.
     */
    public record SwitchPort(int adapter, int port) {
    }

    /**
     * Outcome of deploying collectors.
     */
    public record CollectorSetup(List<SnitchNodeInfo> snitchNodes, List<String> errors, boolean reusedExisting) {
    }

    /**
     * Outcome of history-forwarding injection.
     */
    public record InjectionResult(List<String> injected, List<String> skipped, List<String> errors) {
    }

    /**
     * Nodes split by injection eligibility; skipped entries carry a reason.
     */
    public record Eligibility(List<PlatformNode> eligible, List<String> skipped) {
    }

    /**
     * Collected logs keyed by collector type, plus retrieval warnings.
     */
    public record LogRetrieval(Map<String, String> logs, List<String> errors) {
    }

    private final PlatformClient client;
    private final ConsoleConnector connector;
    private final ConsoleTargetResolver resolver;
    private final NodeClassifier classifier;
    private final ProvisionerConfig config;
    private final String projectId;

    public NodeProvisioner(PlatformClient client,
            ConsoleConnector connector,
            ConsoleTargetResolver resolver,
            NodeClassifier classifier,
            ProvisionerConfig config,
            String projectId) {
        this.client = client;
        this.connector = connector;
        this.resolver = resolver;
        this.classifier = classifier;
        this.config = config;
        this.projectId = projectId;
    }

    /**
     * Validate a student identity used as node name prefix.
     *
     * @throws IllegalArgumentException if the name is blank or has characters other than letters, digits, - and _
     */
    public static String sanitizeStudentName(String studentName) {
        String trimmed = studentName == null ? "" : studentName.trim();
        if (!STUDENT_NAME.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid student name: '" + studentName + "'");
        }
        return trimmed;
    }

    public static List<CollectorConfig> defaultCollectors(String itSwitch, String otSwitch) {
        return List.of(
                new CollectorConfig("IT-" + COLLECTOR_SUFFIX, itSwitch),
                new CollectorConfig("OT-" + COLLECTOR_SUFFIX, otSwitch));
    }

    // ---- full pipeline ----

    /**
     * Create collectors, obtain their addresses, then inject history forwarding into all eligible nodes.
     */
    public LogCollectorResult setupLoggingForStudent(String studentName, String itSwitch, String otSwitch) {
        String student = sanitizeStudentName(studentName);
        CollectorSetup setup = setupCollectors(student, defaultCollectors(itSwitch, otSwitch));

        if (setup.snitchNodes().isEmpty()) {
            List<String> errors = setup.errors().isEmpty()
                    ? List.of("No collectors could be deployed. Ensure DHCP server is running or assign static IPs.")
                    : setup.errors();
            return new LogCollectorResult(List.of(), List.of(), List.of(), errors, setup.reusedExisting());
        }

        InjectionResult injection = injectPromptCommand(setup.snitchNodes());

        List<String> errors = new ArrayList<>(setup.errors());
        errors.addAll(injection.errors());
        return new LogCollectorResult(setup.snitchNodes(), injection.injected(), injection.skipped(),
                errors, setup.reusedExisting());
    }

    // ---- collectors ----

    public CollectorSetup setupCollectors(String studentName, List<CollectorConfig> collectors) {
        String templateId = findTemplateId();
        List<SnitchNodeInfo> snitches = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean anyReused = false;

        for (CollectorConfig collector : collectors) {
            try {
                String nodeName = collector.nodeName(studentName);
                Optional<PlatformNode> existing = findNodeByName(nodeName);
                PlatformNode node;
                if (existing.isPresent()) {
                    log.info("Reusing existing collector node: {}", nodeName);
                    node = existing.get();
                    anyReused = true;
                } else {
                    node = createCollectorNode(nodeName, collector.switchName(), templateId);
                    connectToSwitch(node, collector.switchName());
                }

                // console host/port are only known once the node exists
                node = client.getNode(projectId, node.nodeId());
                if (!client.startNode(projectId, node.nodeId())) {
                    log.warn("Platform refused to start {}", node.name());
                }
                Pause.sleep(config.collectorBootDelay());

                Optional<String> ip = obtainIpAddress(node);
                if (ip.isEmpty()) {
                    String msg = "Failed to obtain IP for " + collector.nameSuffix()
                            + " - ensure DHCP server is running or assign static IP";
                    log.error(msg);
                    errors.add(msg);
                    continue;
                }

                if (!ensureSyslogRunning(node)) {
                    String msg = "Warning: syslog-ng may not be running on " + collector.nameSuffix();
                    log.warn(msg);
                    errors.add(msg);
                }

                snitches.add(new SnitchNodeInfo(
                        node.nodeId(),
                        node.name(),
                        ip.get(),
                        config.syslogPort(),
                        collector.switchName(),
                        node.console(),
                        node.consoleHost() != null ? node.consoleHost() : config.consoleHostOverride()));
            } catch (RuntimeException e) {
                String msg = "Failed to setup " + collector.nameSuffix() + ": " + e.getMessage();
                log.error(msg);
                errors.add(msg);
            }
        }
        return new CollectorSetup(snitches, errors, anyReused);
    }

    String findTemplateId() {
        String wanted = config.collectorTemplate();
        for (PlatformTemplate template : client.listTemplates()) {
            if (wanted.equals(template.name())) {
                return template.templateId();
            }
        }
        throw new NoSuchElementException("Template '" + wanted + "' not found on platform");
    }

    Optional<PlatformNode> findNodeByName(String name) {
        return client.listNodes(projectId).stream()
                .filter(n -> n.name().equals(name))
                .findFirst();
    }

    private PlatformNode findSwitch(String switchName) {
        return findNodeByName(switchName)
                .orElseThrow(() -> new NoSuchElementException("Switch '" + switchName + "' not found in project"));
    }

    private PlatformNode createCollectorNode(String nodeName, String switchName, String templateId) {
        PlatformNode sw = findSwitch(switchName);
        PlatformNode node = client.addNodeFromTemplate(projectId, templateId, nodeName,
                sw.x() + COLLECTOR_OFFSET_X, sw.y() + COLLECTOR_OFFSET_Y);
        log.info("Created collector node: {}", nodeName);
        return node;
    }

    private void connectToSwitch(PlatformNode collector, String switchName) {
        PlatformNode sw = findSwitch(switchName);
        SwitchPort port = allocateSwitchPort(sw);
        client.createLink(projectId,
                new LinkEndpoint(collector.nodeId(), 0, 0),
                new LinkEndpoint(sw.nodeId(), port.adapter(), port.port()));
        log.info("Connected {} to {} on adapter {}", collector.name(), switchName, port.adapter());
    }

    /**
     * Pick the highest adapter in [1, 15] not used by any link of this switch.
     * Adapter 0 is never handed out.
     *
     * @throws PortAllocationException if all adapters are taken
     */
    public SwitchPort allocateSwitchPort(PlatformNode switchNode) {
        Set<Integer> used = new HashSet<>();
        for (PlatformLink link : client.listLinks(projectId)) {
            for (LinkEndpoint endpoint : link.nodes()) {
                if (switchNode.nodeId().equals(endpoint.nodeId())) {
                    used.add(endpoint.adapterNumber());
                }
            }
        }
        for (int adapter = MAX_SWITCH_ADAPTER; adapter >= 1; adapter--) {
            if (!used.contains(adapter)) {
                log.debug("Selected adapter {} on {}", adapter, switchNode.name());
                return new SwitchPort(adapter, 0);
            }
        }
        throw new PortAllocationException("No available ports on node '" + switchNode.name()
                + "' (adapters 1-" + MAX_SWITCH_ADAPTER + " all in use)");
    }

    /**
     * Read the node's address; if it has none, request a lease and look again.
     */
    public Optional<String> obtainIpAddress(PlatformNode node) {
        Optional<ConsoleTarget> target = resolver.resolve(node, config.consoleHostOverride());
        if (target.isEmpty()) {
            log.warn("No console target for node {}", node.name());
            return Optional.empty();
        }
        try (ConsoleSession console = connector.open(target.get())) {
            settle(console);

            Optional<String> ip = IpAddresses.extractHostAddress(
                    console.runCommand(ADDRESS_COMMAND, config.probeWindow()));
            if (ip.isPresent()) {
                log.info("Found existing IP {} on {}", ip.get(), node.name());
                return ip;
            }

            log.info("No IP found on {}, requesting via DHCP...", node.name());
            console.runCommand(LEASE_COMMAND, config.leaseWindow());
            Pause.sleep(config.leaseSettleDelay());

            ip = IpAddresses.extractHostAddress(console.runCommand(ADDRESS_COMMAND, config.probeWindow()));
            if (ip.isPresent()) {
                log.info("Obtained IP {} via DHCP on {}", ip.get(), node.name());
            } else {
                log.error("Failed to obtain IP for {} - no DHCP server or static IP", node.name());
            }
            return ip;
        } catch (ConsoleException e) {
            log.error("Failed to get IP for {}: {}", node.name(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Probe for the syslog daemon and start it if absent.
     *
     * @return true once the daemon is seen running
     */
    public boolean ensureSyslogRunning(PlatformNode node) {
        Optional<ConsoleTarget> target = resolver.resolve(node, config.consoleHostOverride());
        if (target.isEmpty()) {
            log.warn("No console target for node {}", node.name());
            return false;
        }
        try (ConsoleSession console = connector.open(target.get())) {
            settle(console);

            if (syslogRunning(console)) {
                log.info("syslog-ng already running on {}", node.name());
                return true;
            }

            log.info("Starting syslog-ng on {}...", node.name());
            console.runCommand(SYSLOG_START_COMMAND, config.probeWindow());
            Pause.sleep(config.consoleSettleDelay());

            if (syslogRunning(console)) {
                log.info("syslog-ng started on {}", node.name());
                return true;
            }
            log.error("Failed to start syslog-ng on {}", node.name());
            return false;
        } catch (ConsoleException e) {
            log.error("Failed to ensure syslog-ng running on {}: {}", node.name(), e.getMessage());
            return false;
        }
    }

    // pgrep exits 0 only when a process matched; prompts may carry digits of their own
    private boolean syslogRunning(ConsoleSession console) {
        return console.runCommandWithStatus(SYSLOG_PROBE_COMMAND, config.probeWindow()).succeeded();
    }

    // ---- injection ----

    /**
     * Nodes that get history forwarding: telnet console and not a switch or collector.
     */
    public Eligibility eligibleNodes() {
        List<PlatformNode> eligible = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (PlatformNode node : client.listNodes(projectId)) {
            if (!node.hasTelnetConsole()) {
                skipped.add(node.name() + " (console_type=" + node.consoleType() + ")");
                continue;
            }
            NodeRole role = classifier.classify(node.name());
            if (role.isInfrastructure()) {
                skipped.add(node.name() + " (infrastructure node)");
                continue;
            }
            eligible.add(node);
        }
        return new Eligibility(eligible, skipped);
    }

    /**
     * Route a node to a collector: OT-marked names go to the OT collector, everything else to IT,
     * falling back to the first collector.
     */
    public static SnitchNodeInfo selectCollector(String nodeName, List<SnitchNodeInfo> snitches) {
        if (snitches.isEmpty()) {
            throw new IllegalArgumentException("No collectors available");
        }
        if (nodeName.toUpperCase(Locale.ROOT).contains("OT")) {
            for (SnitchNodeInfo s : snitches) {
                if ("ot".equals(s.collectorType())) {
                    return s;
                }
            }
        }
        for (SnitchNodeInfo s : snitches) {
            if ("it".equals(s.collectorType())) {
                return s;
            }
        }
        return snitches.get(0);
    }

    /**
     * Shell statement that streams every executed command to the collector's syslog listener.
     */
    public String buildPromptCommand(String collectorIp) {
        return "export PROMPT_COMMAND='history -a >(tee -a ~/.bash_history | logger -n " + collectorIp
                + " -P " + config.syslogPort() + " -t \"" + config.syslogTag() + "\")'";
    }

    public InjectionResult injectPromptCommand(List<SnitchNodeInfo> snitches) {
        Eligibility eligibility = eligibleNodes();
        List<String> injected = new ArrayList<>();
        List<String> skipped = new ArrayList<>(eligibility.skipped());
        List<String> errors = new ArrayList<>();

        for (PlatformNode node : eligibility.eligible()) {
            String name = node.name();
            Optional<ConsoleTarget> target = resolver.resolve(node, config.consoleHostOverride());
            if (target.isEmpty()) {
                skipped.add(name + " (no console)");
                continue;
            }
            try {
                String collectorIp = selectCollector(name, snitches).ipAddress();
                String promptCommand = buildPromptCommand(collectorIp);
                try (ConsoleSession console = connector.open(target.get())) {
                    settle(console);
                    console.runCommand(promptCommand, config.probeWindow());
                    // survive reconnects
                    console.runCommand("echo \"" + promptCommand + "\" >> ~/.bashrc", config.probeWindow());
                }
                injected.add(name);
                log.info("Injected PROMPT_COMMAND into {} -> {}", name, collectorIp);
            } catch (RuntimeException e) {
                String msg = "Failed to inject into " + name + ": " + e.getMessage();
                log.error(msg);
                errors.add(msg);
            }
        }
        return new InjectionResult(injected, skipped, errors);
    }

    // ---- retrieval & teardown ----

    /**
     * Collectors of a student as currently present on the platform, matched by name.
     * The address is not known from the platform alone and is left null.
     */
    public List<SnitchNodeInfo> findCollectors(String studentName) {
        String student = sanitizeStudentName(studentName);
        List<SnitchNodeInfo> found = new ArrayList<>();
        for (PlatformNode node : client.listNodes(projectId)) {
            if (isCollectorOf(student, node.name())) {
                found.add(new SnitchNodeInfo(node.nodeId(), node.name(), null, config.syslogPort(), null,
                        node.console(), node.consoleHost()));
            }
        }
        return found;
    }

    /**
     * Read the collector's log file and strip command echo and prompt lines.
     *
     * @throws ConsoleException if the console cannot be reached
     * @throws IllegalArgumentException if the collector has no console port
     */
    public String retrieveLogs(SnitchNodeInfo snitch) {
        if (snitch.consolePort() == null) {
            throw new IllegalArgumentException("No console port for " + snitch.name());
        }
        ConsoleTarget target = resolver.resolve(snitch.consolePort(), snitch.consoleHost(),
                        config.consoleHostOverride())
                .orElseThrow(() -> new IllegalArgumentException("No console host for " + snitch.name()));

        try (ConsoleSession console = connector.open(target)) {
            settle(console);
            String output = console.runCommand("cat " + config.collectorLogFile(), config.logReadWindow());
            return cleanLogOutput(output);
        } catch (ConsoleException e) {
            log.error("Failed to retrieve logs from {}: {}", snitch.name(), e.getMessage());
            throw e;
        }
    }

    static String cleanLogOutput(String output) {
        List<String> kept = new ArrayList<>();
        for (String line : output.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.startsWith("cat ") || trimmed.startsWith("#") || trimmed.startsWith("/ #")) {
                continue;
            }
            kept.add(line);
        }
        return String.join("\n", kept).strip();
    }

    public LogRetrieval retrieveAllLogs(List<SnitchNodeInfo> snitches) {
        Map<String, String> logs = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (SnitchNodeInfo snitch : snitches) {
            String type = snitch.collectorType();
            try {
                String content = retrieveLogs(snitch);
                logs.put(type, content);
                if (content.isBlank()) {
                    String warning = snitch.name() + ": Log file is empty - commands may not be reaching the collector";
                    log.warn(warning);
                    errors.add(warning);
                }
            } catch (RuntimeException e) {
                String msg = "Failed to retrieve logs from " + snitch.name() + ": " + e.getMessage();
                log.error(msg);
                errors.add(msg);
                logs.put(type, "");
            }
        }
        return new LogRetrieval(logs, errors);
    }

    /**
     * Delete every collector node of the student, found by name on the platform.
     *
     * @return names of deleted nodes
     */
    public List<String> deleteCollectorNodes(String studentName) {
        String student = sanitizeStudentName(studentName);
        List<String> deleted = new ArrayList<>();
        for (PlatformNode node : client.listNodes(projectId)) {
            if (!isCollectorOf(student, node.name())) {
                continue;
            }
            if (client.deleteNode(projectId, node.nodeId())) {
                deleted.add(node.name());
                log.info("Deleted collector node: {}", node.name());
            } else {
                log.error("Failed to delete {}", node.name());
            }
        }
        return deleted;
    }

    private boolean isCollectorOf(String student, String nodeName) {
        return nodeName.startsWith(student + "-") && nodeName.contains(COLLECTOR_SUFFIX);
    }

    // Give the console a moment after connect, then drop the banner/prompt.
    private void settle(ConsoleSession console) {
        Pause.sleep(config.consoleSettleDelay());
        Duration drain = config.probeWindow().compareTo(SETTLE_DRAIN) < 0 ? config.probeWindow() : SETTLE_DRAIN;
        console.read(drain);
    }
}
