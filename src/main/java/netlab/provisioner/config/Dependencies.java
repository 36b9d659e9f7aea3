package netlab.provisioner.config;

import netlab.provisioner.api.v1.CollectorController;
import netlab.provisioner.api.v1.DhcpController;
import netlab.provisioner.api.v1.HealthController;
import netlab.provisioner.api.v1.ScriptController;
import netlab.provisioner.console.ConsoleCommands;
import netlab.provisioner.console.ConsoleConnector;
import netlab.provisioner.console.ConsoleTargetResolver;
import netlab.provisioner.console.TelnetConsoleConnector;
import netlab.provisioner.platform.Gns3RestClient;
import netlab.provisioner.platform.PlatformClient;
import netlab.provisioner.repository.NodeRecordStore;
import netlab.provisioner.server.RouterHandler;
import netlab.provisioner.service.DhcpOrchestrator;
import netlab.provisioner.service.NodeClassifier;
import netlab.provisioner.service.NodeProvisioner;
import netlab.provisioner.service.ScriptRunner;
import netlab.provisioner.store.JsonNodeRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ProvisionerConfig.fromEnv());
 * DhcpAssignResult result = deps.dhcpOrchestrator().assign();
 * </pre>
 *
 * Tests pass their own store, platform client and console connector through
 * {@link #create(ProvisionerConfig, NodeRecordStore, PlatformClient, ConsoleConnector)}.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ProvisionerConfig config;
    private final NodeRecordStore nodeStore;
    private final PlatformClient platformClient;
    private final ConsoleConnector consoleConnector;
    private final ConsoleTargetResolver targetResolver;
    private final NodeClassifier classifier;
    private final DhcpOrchestrator dhcpOrchestrator;
    private final ScriptRunner scriptRunner;

    // Controllers
    private final HealthController healthController;
    private final DhcpController dhcpController;
    private final CollectorController collectorController;
    private final ScriptController scriptController;

    // Lazy: the project id may have to be looked up on the platform
    private NodeProvisioner nodeProvisioner;
    private RouterHandler routerHandler;

    private Dependencies(ProvisionerConfig config,
            NodeRecordStore nodeStore,
            PlatformClient platformClient,
            ConsoleConnector consoleConnector) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.nodeStore = nodeStore;
        this.platformClient = platformClient;
        this.consoleConnector = consoleConnector;
        this.targetResolver = new ConsoleTargetResolver();
        this.classifier = new NodeClassifier(config.classificationPolicy());

        // Services
        this.dhcpOrchestrator = new DhcpOrchestrator(nodeStore, new ConsoleCommands(consoleConnector),
                targetResolver, classifier, config);
        this.scriptRunner = new ScriptRunner(nodeStore, consoleConnector, targetResolver, config);

        // Controllers
        this.healthController = new HealthController(config);
        this.dhcpController = new DhcpController(dhcpOrchestrator, DhcpOrchestrator.Options.from(config));
        this.collectorController = new CollectorController(this::nodeProvisioner, config);
        this.scriptController = new ScriptController(scriptRunner);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(ProvisionerConfig config) {
        return new Dependencies(config,
                new JsonNodeRecordStore(Path.of(config.nodeStorePath())),
                new Gns3RestClient(config.platformUrl(), config.platformRequestDelay()),
                new TelnetConsoleConnector(config));
    }

    public static Dependencies create(ProvisionerConfig config,
            NodeRecordStore nodeStore,
            PlatformClient platformClient,
            ConsoleConnector consoleConnector) {
        return new Dependencies(config, nodeStore, platformClient, consoleConnector);
    }

    public static Dependencies create() {
        return create(ProvisionerConfig.fromEnv());
    }

    // Getters
    public ProvisionerConfig config() {
        return config;
    }

    public NodeRecordStore nodeStore() {
        return nodeStore;
    }

    public PlatformClient platformClient() {
        return platformClient;
    }

    public ConsoleConnector consoleConnector() {
        return consoleConnector;
    }

    public DhcpOrchestrator dhcpOrchestrator() {
        return dhcpOrchestrator;
    }

    public ScriptRunner scriptRunner() {
        return scriptRunner;
    }

    /**
     * Collector pipeline bound to the configured project. The project id comes
     * from configuration or, failing that, from a lookup of the project name.
     *
     * @throws IllegalStateException if neither project id nor name is configured
     */
    public synchronized NodeProvisioner nodeProvisioner() {
        if (nodeProvisioner == null) {
            String projectId = config.projectId();
            if (projectId == null || projectId.isBlank()) {
                if (config.projectName() == null || config.projectName().isBlank()) {
                    throw new IllegalStateException("No platform project configured (set project id or name)");
                }
                projectId = platformClient.findProjectId(config.projectName());
                log.info("Resolved project '{}' to id {}", config.projectName(), projectId);
            }
            nodeProvisioner = new NodeProvisioner(platformClient, consoleConnector, targetResolver, classifier,
                    config, projectId);
        }
        return nodeProvisioner;
    }

    /**
     * RouterHandler with every controller registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(dhcpController)
                    .registerController(collectorController)
                    .registerController(scriptController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        // Console sessions are scoped per operation; nothing long-lived to release.
        log.info("Dependencies closed");
    }
}
