package netlab.provisioner.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads provisioner settings from an INI file.
 * Supports sections [GNS3], [CONSOLE], [STORE], [SERVER], [DHCP], [COLLECTORS] and [CLASSIFICATION].
 * Every section and key is optional; missing values keep their defaults.
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    public static Optional<ProvisionerConfig> load(File file) {
        try {
            Ini ini = new Ini(file);
            ProvisionerConfig cfg = ProvisionerConfig.defaults();

            Profile.Section gns3 = ini.get("GNS3");
            Profile.Section console = ini.get("CONSOLE");
            Profile.Section store = ini.get("STORE");
            Profile.Section server = ini.get("SERVER");
            Profile.Section dhcp = ini.get("DHCP");
            Profile.Section collectors = ini.get("COLLECTORS");
            Profile.Section classification = ini.get("CLASSIFICATION");

            // GNS3
            opt(gns3, "url").ifPresent(cfg::withPlatformUrl);
            opt(gns3, "project_id").ifPresent(cfg::withProjectId);
            opt(gns3, "project_name").ifPresent(cfg::withProjectName);
            millis(gns3, "request_delay_ms").ifPresent(cfg::withPlatformRequestDelay);

            // CONSOLE
            opt(console, "host_override").ifPresent(cfg::withConsoleHostOverride);
            millis(console, "connect_timeout_ms").ifPresent(cfg::withConnectTimeout);
            millis(console, "poll_interval_ms").ifPresent(cfg::withReadPollInterval);

            // STORE
            opt(store, "config_path").ifPresent(cfg::withNodeStorePath);

            // SERVER
            opt(server, "port").map(Integer::parseInt).ifPresent(cfg::withServerPort);
            opt(server, "api_key").ifPresent(cfg::withApiKey);

            // DHCP
            millis(dhcp, "warmup_ms").ifPresent(cfg::withDhcpWarmup);
            millis(dhcp, "dhclient_timeout_ms").ifPresent(cfg::withDhclientTimeout);
            millis(dhcp, "inter_command_delay_ms").ifPresent(cfg::withInterCommandDelay);

            // COLLECTORS
            opt(collectors, "template").ifPresent(cfg::withCollectorTemplate);
            String itSwitch = opt(collectors, "it_switch").orElse(cfg.itSwitchName());
            String otSwitch = opt(collectors, "ot_switch").orElse(cfg.otSwitchName());
            cfg.withSwitchNames(itSwitch, otSwitch);
            opt(collectors, "log_file").ifPresent(cfg::withCollectorLogFile);
            int syslogPort = opt(collectors, "syslog_port").map(Integer::parseInt).orElse(cfg.syslogPort());
            String syslogTag = opt(collectors, "syslog_tag").orElse(cfg.syslogTag());
            cfg.withSyslog(syslogPort, syslogTag);

            // CLASSIFICATION
            ClassificationPolicy policy = cfg.classificationPolicy();
            policy = opt(classification, "switch")
                    .map(ClassificationPolicy::parseKeywords).map(policy::withSwitchKeywords).orElse(policy);
            policy = opt(classification, "server")
                    .map(ClassificationPolicy::parseKeywords).map(policy::withServerKeywords).orElse(policy);
            policy = opt(classification, "firewall")
                    .map(ClassificationPolicy::parseKeywords).map(policy::withFirewallKeywords).orElse(policy);
            policy = opt(classification, "collector")
                    .map(ClassificationPolicy::parseKeywords).map(policy::withCollectorKeywords).orElse(policy);
            cfg.withClassificationPolicy(policy);

            return Optional.of(cfg);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load config from {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    // ===== helpers =====
    private static Optional<String> opt(Profile.Section s, String key) {
        if (s == null) {
            return Optional.empty();
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
    }

    private static Optional<Duration> millis(Profile.Section s, String key) {
        return opt(s, key).map(Long::parseLong).map(Duration::ofMillis);
    }
}
