package netlab.provisioner.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProvisionerConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaultsMatchConsoleConventions() {
        ProvisionerConfig config = ProvisionerConfig.defaults();

        assertEquals("http://127.0.0.1:3080", config.platformUrl());
        assertEquals(Duration.ofSeconds(2), config.dhcpWarmup());
        assertEquals(Duration.ofSeconds(15), config.dhclientTimeout());
        assertEquals(Duration.ofSeconds(1), config.interCommandDelay());
        assertEquals(Duration.ofSeconds(5), config.serverStartWindow());
        assertEquals(514, config.syslogPort());
        assertEquals("Student-CMD", config.syslogTag());
        assertEquals("syslog-collector", config.collectorTemplate());
        assertFalse(config.hasApiKey());
    }

    @Test
    void fromIniOverridesOnlyWhatIsGiven() throws Exception {
        Path ini = dir.resolve("netlab.ini");
        Files.writeString(ini, """
                [GNS3]
                url = http://gns3.lab:3080
                project_name = week-3

                [CONSOLE]
                host_override = gns3.lab
                connect_timeout_ms = 2500

                [SERVER]
                port = 9090
                api_key = s3cret

                [DHCP]
                warmup_ms = 500

                [COLLECTORS]
                it_switch = Office-Switch
                syslog_port = 1514

                [CLASSIFICATION]
                server = kea, dnsmasq
                """);

        ProvisionerConfig config = ProvisionerConfig.fromIni(ini.toFile()).orElseThrow();

        assertEquals("http://gns3.lab:3080", config.platformUrl());
        assertEquals("week-3", config.projectName());
        assertNull(config.projectId());
        assertEquals("gns3.lab", config.consoleHostOverride());
        assertEquals(Duration.ofMillis(2500), config.connectTimeout());
        assertEquals(9090, config.serverPort());
        assertTrue(config.hasApiKey());
        assertEquals(Duration.ofMillis(500), config.dhcpWarmup());
        assertEquals(Duration.ofSeconds(15), config.dhclientTimeout());
        assertEquals("Office-Switch", config.itSwitchName());
        assertEquals("OT-Switch", config.otSwitchName());
        assertEquals(1514, config.syslogPort());
        assertEquals("Student-CMD", config.syslogTag());
        assertEquals(List.of("kea", "dnsmasq"), config.classificationPolicy().serverKeywords());
        assertEquals(ClassificationPolicy.defaults().switchKeywords(), config.classificationPolicy().switchKeywords());
    }

    @Test
    void unreadableIniIsEmpty() throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[SERVER]\nport = not-a-number\n");

        assertTrue(ProvisionerConfig.fromIni(ini.toFile()).isEmpty());
        assertTrue(ProvisionerConfig.fromIni(new File(dir.toFile(), "missing.ini")).isEmpty());
    }

    @Test
    void keywordListsAreTrimmedAndLowerCased() {
        List<String> parsed = ClassificationPolicy.parseKeywords(" Switch, ,OVS ");

        assertEquals(List.of("Switch", "OVS"), parsed);
        assertEquals(List.of("switch", "ovs"),
                ClassificationPolicy.defaults().withSwitchKeywords(parsed).switchKeywords());
    }
}
