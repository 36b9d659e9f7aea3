package netlab.provisioner.config;

import java.io.File;
import java.time.Duration;
import java.util.Optional;

/**
 * Configuration holder for provisioner settings.
 * All settings have sensible defaults.
 */
public final class ProvisionerConfig {

    // Emulation platform
    private String platformUrl = "http://127.0.0.1:3080";
    private String projectId = null;
    private String projectName = null;
    private Duration platformRequestDelay = Duration.ZERO;

    // Console settings
    private String consoleHostOverride = null;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readPollInterval = Duration.ofMillis(500);

    // Node store
    private String nodeStorePath = "./config/config.generated.json";

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, mutating endpoints require X-Netlab-Key header

    // DHCP bring-up
    private Duration serverStartWindow = Duration.ofSeconds(5);
    private Duration dhclientTimeout = Duration.ofSeconds(15);
    private Duration addressShowWindow = Duration.ofSeconds(1);
    private Duration interCommandDelay = Duration.ofSeconds(1);
    private Duration dhcpWarmup = Duration.ofSeconds(2);

    // Log collectors
    private String collectorTemplate = "syslog-collector";
    private String itSwitchName = "IT-Switch";
    private String otSwitchName = "OT-Switch";
    private Duration collectorBootDelay = Duration.ofSeconds(3);
    private Duration consoleSettleDelay = Duration.ofMillis(500);
    private Duration leaseSettleDelay = Duration.ofSeconds(2);
    private Duration leaseWindow = Duration.ofSeconds(10);
    private Duration probeWindow = Duration.ofSeconds(2);
    private Duration logReadWindow = Duration.ofSeconds(5);
    private String collectorLogFile = "/var/log/student.log";
    private int syslogPort = 514;
    private String syslogTag = "Student-CMD";

    private ClassificationPolicy classificationPolicy = ClassificationPolicy.defaults();

    private ProvisionerConfig() {
    }

    public static ProvisionerConfig defaults() {
        return new ProvisionerConfig();
    }

    public static ProvisionerConfig fromEnv() {
        ProvisionerConfig config = new ProvisionerConfig();

        // Override from environment variables
        String url = System.getenv("NETLAB_PLATFORM_URL");
        if (url != null && !url.isBlank()) {
            config.platformUrl = url;
        }

        String project = System.getenv("NETLAB_PROJECT_ID");
        if (project != null && !project.isBlank()) {
            config.projectId = project;
        }

        String projectName = System.getenv("NETLAB_PROJECT_NAME");
        if (projectName != null && !projectName.isBlank()) {
            config.projectName = projectName;
        }

        String consoleHost = System.getenv("NETLAB_CONSOLE_HOST");
        if (consoleHost != null && !consoleHost.isBlank()) {
            config.consoleHostOverride = consoleHost;
        }

        String storePath = System.getenv("NETLAB_CONFIG_PATH");
        if (storePath != null && !storePath.isBlank()) {
            config.nodeStorePath = storePath;
        }

        String port = System.getenv("NETLAB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = System.getenv("NETLAB_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String delay = System.getenv("NETLAB_REQUEST_DELAY_MS");
        if (delay != null && !delay.isBlank()) {
            config.platformRequestDelay = Duration.ofMillis(Long.parseLong(delay));
        }

        return config;
    }

    /**
     * Load from an INI file; empty if the file cannot be read.
     */
    public static Optional<ProvisionerConfig> fromIni(File file) {
        return IniConfigLoader.load(file);
    }

    // Getters
    public String platformUrl() {
        return platformUrl;
    }

    public String projectId() {
        return projectId;
    }

    public String projectName() {
        return projectName;
    }

    public Duration platformRequestDelay() {
        return platformRequestDelay;
    }

    public String consoleHostOverride() {
        return consoleHostOverride;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readPollInterval() {
        return readPollInterval;
    }

    public String nodeStorePath() {
        return nodeStorePath;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration serverStartWindow() {
        return serverStartWindow;
    }

    public Duration dhclientTimeout() {
        return dhclientTimeout;
    }

    public Duration addressShowWindow() {
        return addressShowWindow;
    }

    public Duration interCommandDelay() {
        return interCommandDelay;
    }

    public Duration dhcpWarmup() {
        return dhcpWarmup;
    }

    public String collectorTemplate() {
        return collectorTemplate;
    }

    public String itSwitchName() {
        return itSwitchName;
    }

    public String otSwitchName() {
        return otSwitchName;
    }

    public Duration collectorBootDelay() {
        return collectorBootDelay;
    }

    public Duration consoleSettleDelay() {
        return consoleSettleDelay;
    }

    public Duration leaseSettleDelay() {
        return leaseSettleDelay;
    }

    public Duration leaseWindow() {
        return leaseWindow;
    }

    public Duration probeWindow() {
        return probeWindow;
    }

    public Duration logReadWindow() {
        return logReadWindow;
    }

    public String collectorLogFile() {
        return collectorLogFile;
    }

    public int syslogPort() {
        return syslogPort;
    }

    public String syslogTag() {
        return syslogTag;
    }

    public ClassificationPolicy classificationPolicy() {
        return classificationPolicy;
    }

    // Fluent setters for testing/customization
    public ProvisionerConfig withPlatformUrl(String url) {
        this.platformUrl = url;
        return this;
    }

    public ProvisionerConfig withProjectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    public ProvisionerConfig withProjectName(String projectName) {
        this.projectName = projectName;
        return this;
    }

    public ProvisionerConfig withPlatformRequestDelay(Duration delay) {
        this.platformRequestDelay = delay;
        return this;
    }

    public ProvisionerConfig withConsoleHostOverride(String host) {
        this.consoleHostOverride = host;
        return this;
    }

    public ProvisionerConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = timeout;
        return this;
    }

    public ProvisionerConfig withReadPollInterval(Duration interval) {
        this.readPollInterval = interval;
        return this;
    }

    public ProvisionerConfig withNodeStorePath(String path) {
        this.nodeStorePath = path;
        return this;
    }

    public ProvisionerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ProvisionerConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public ProvisionerConfig withServerStartWindow(Duration window) {
        this.serverStartWindow = window;
        return this;
    }

    public ProvisionerConfig withDhclientTimeout(Duration timeout) {
        this.dhclientTimeout = timeout;
        return this;
    }

    public ProvisionerConfig withAddressShowWindow(Duration window) {
        this.addressShowWindow = window;
        return this;
    }

    public ProvisionerConfig withInterCommandDelay(Duration delay) {
        this.interCommandDelay = delay;
        return this;
    }

    public ProvisionerConfig withDhcpWarmup(Duration warmup) {
        this.dhcpWarmup = warmup;
        return this;
    }

    public ProvisionerConfig withCollectorTemplate(String template) {
        this.collectorTemplate = template;
        return this;
    }

    public ProvisionerConfig withSwitchNames(String itSwitch, String otSwitch) {
        this.itSwitchName = itSwitch;
        this.otSwitchName = otSwitch;
        return this;
    }

    public ProvisionerConfig withCollectorBootDelay(Duration delay) {
        this.collectorBootDelay = delay;
        return this;
    }

    public ProvisionerConfig withLeaseWindow(Duration window) {
        this.leaseWindow = window;
        return this;
    }

    public ProvisionerConfig withProbeWindow(Duration window) {
        this.probeWindow = window;
        return this;
    }

    public ProvisionerConfig withLogReadWindow(Duration window) {
        this.logReadWindow = window;
        return this;
    }

    public ProvisionerConfig withCollectorLogFile(String path) {
        this.collectorLogFile = path;
        return this;
    }

    public ProvisionerConfig withSyslog(int port, String tag) {
        this.syslogPort = port;
        this.syslogTag = tag;
        return this;
    }

    public ProvisionerConfig withClassificationPolicy(ClassificationPolicy policy) {
        this.classificationPolicy = policy;
        return this;
    }

    /**
     * Zero every settle delay and shrink read windows. Used by tests that drive scripted consoles.
     */
    public ProvisionerConfig withoutDelays() {
        Duration tick = Duration.ofMillis(20);
        this.dhcpWarmup = Duration.ZERO;
        this.interCommandDelay = Duration.ZERO;
        this.collectorBootDelay = Duration.ZERO;
        this.consoleSettleDelay = Duration.ZERO;
        this.leaseSettleDelay = Duration.ZERO;
        this.serverStartWindow = tick;
        this.dhclientTimeout = tick;
        this.addressShowWindow = tick;
        this.leaseWindow = tick;
        this.probeWindow = tick;
        this.logReadWindow = tick;
        this.readPollInterval = Duration.ofMillis(10);
        return this;
    }

    @Override
    public String toString() {
        return "ProvisionerConfig{" +
                "platformUrl='" + platformUrl + '\'' +
                ", projectId='" + projectId + '\'' +
                ", consoleHostOverride='" + consoleHostOverride + '\'' +
                ", nodeStorePath='" + nodeStorePath + '\'' +
                ", serverPort=" + serverPort +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
