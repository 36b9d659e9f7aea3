package netlab.provisioner.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import netlab.provisioner.config.Dependencies;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.console.ScriptedConsoleConnector;
import netlab.provisioner.model.NodeRecord;
import netlab.provisioner.platform.FakePlatformClient;
import netlab.provisioner.repository.InMemoryNodeRecordStore;
import netlab.provisioner.server.ProvisionerNettyServer;
import netlab.provisioner.server.RouterHandler;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints of a running Netty server.
 * Platform and consoles are scripted fakes; everything in between is real.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;
    private static final String IP_ADDR = "2: eth0: <UP>\n    inet 10.0.0.7/24 brd 10.0.0.255 scope global eth0\n";

    @TempDir
    Path tempDir;

    private HttpClient httpClient;
    private InMemoryNodeRecordStore store;
    private FakePlatformClient platform;
    private ScriptedConsoleConnector connector;

    @BeforeEach
    void setUp() throws Exception {
        if (ProvisionerNettyServer.isRunning()) {
            ProvisionerNettyServer.stop();
        }
        startServer(null);
    }

    @AfterEach
    void tearDown() {
        ProvisionerNettyServer.stop();
    }

    private void startServer(String apiKey) throws Exception {
        Path storeFile = Files.writeString(tempDir.resolve("config.generated.json"), "{\"nodes\": []}");
        ProvisionerConfig config = ProvisionerConfig.defaults()
                .withoutDelays()
                .withNodeStorePath(storeFile.toString())
                .withProjectId("p1")
                .withApiKey(apiKey);

        store = new InMemoryNodeRecordStore(List.of(
                new NodeRecord("DHCP-Server-1", 5000, "127.0.0.1"),
                new NodeRecord("Workstation-1", 5001, "127.0.0.1")));
        platform = new FakePlatformClient()
                .withTemplate("tmpl-1", "syslog-collector")
                .withNode("sw-it", "IT-Switch", 5100, "telnet", 100, 200)
                .withNode("sw-ot", "OT-Switch", 5101, "telnet", 400, 200)
                .withNode("pc-1", "IT-PC-1", 5201, "telnet", 0, 0);
        connector = new ScriptedConsoleConnector()
                .on(5000, line -> line.startsWith("bash /opt/check.sh")
                        ? ScriptedConsoleConnector.exitWith(line, "all good", 0)
                        : "dnsmasq started\n")
                .on(5001, line -> line.startsWith("ip -4 addr show") ? IP_ADDR : "")
                .on(5201, line -> "")
                .on(6000, collector("10.10.0.2", "Oct 19 10:00:01 IT-PC-1 Student-CMD: ls -la"))
                .on(6001, collector("10.20.0.2", ""));

        Dependencies deps = Dependencies.create(config, store, platform, connector);
        assertTrue(ProvisionerNettyServer.start(TEST_PORT, deps));

        // Wait for server to be ready
        TimeUnit.MILLISECONDS.sleep(200);

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    private static java.util.function.Function<String, String> collector(String ip, String log) {
        return line -> {
            if (line.equals("hostname -I")) {
                return ip + "\r\n";
            }
            if (line.startsWith("pgrep syslog-ng")) {
                return ScriptedConsoleConnector.exitWith(line, "321", 0);
            }
            if (line.startsWith("cat ")) {
                return line + "\r\n" + log + "\r\n/ # ";
            }
            return "";
        };
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(BASE_URL + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void healthReportsNodeStore() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals("1.0.0", health.get("version").asText());
    }

    @Test
    @DisplayName("DHCP assign over HTTP starts the server, leases the client and writes the store")
    void dhcpAssign() throws Exception {
        HttpResponse<String> response = post("/api/v1/dhcp/assign", "{\"dhclientTimeout\": 0.05}");

        assertEquals(200, response.statusCode(), "Body: " + response.body());
        JsonNode result = MAPPER.readTree(response.body());
        assertTrue(result.get("changed").asBoolean());
        assertEquals("Workstation-1", result.get("changedNodes").get(0).asText());
        assertEquals(1, result.get("serverResults").size());
        assertEquals("10.0.0.7", store.node("Workstation-1").assignedIp());
        assertEquals(1, store.writes());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        HttpResponse<String> response = post("/api/v1/dhcp/assign", "{not json");

        assertEquals(400, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).get("error").asText().startsWith("malformed JSON"));
    }

    @Test
    void invalidRequestValueIsBadRequest() throws Exception {
        HttpResponse<String> response = post("/api/v1/dhcp/assign", "{\"dhclientTimeout\": -1}");

        assertEquals(400, response.statusCode());
        assertEquals("dhclientTimeout must be positive", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
        assertEquals(404, get("/metrics").statusCode());
    }

    @Test
    void mutatingRequestsNeedApiKeyWhenConfigured() throws Exception {
        ProvisionerNettyServer.stop();
        startServer("s3cret");

        assertEquals(403, post("/api/v1/dhcp/assign", "{}").statusCode());
        assertEquals(200, get("/api/v1/health").statusCode());

        HttpResponse<String> withKey = httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(BASE_URL + "/api/v1/dhcp/assign"))
                        .header(RouterHandler.API_KEY_HEADER, "s3cret")
                        .POST(HttpRequest.BodyPublishers.ofString("{}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, withKey.statusCode(), "Body: " + withKey.body());
    }

    @Test
    @DisplayName("Collectors: setup, read logs, delete")
    void collectorLifecycle() throws Exception {
        HttpResponse<String> setup = post("/api/v1/collectors/alice", "");
        assertEquals(200, setup.statusCode(), "Body: " + setup.body());
        JsonNode result = MAPPER.readTree(setup.body());
        assertTrue(result.get("success").asBoolean());
        assertEquals(2, result.get("snitchNodes").size());
        assertEquals("IT-PC-1", result.get("injectedNodes").get(0).asText());

        HttpResponse<String> logs = get("/api/v1/collectors/alice/logs");
        assertEquals(200, logs.statusCode(), "Body: " + logs.body());
        JsonNode logBody = MAPPER.readTree(logs.body());
        assertTrue(logBody.get("logs").get("it").asText().contains("Student-CMD: ls -la"));
        assertEquals("", logBody.get("logs").get("ot").asText());

        HttpResponse<String> delete = httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(BASE_URL + "/api/v1/collectors/alice"))
                        .DELETE()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, delete.statusCode());
        assertEquals(2, MAPPER.readTree(delete.body()).get("deleted").size());

        assertEquals(404, get("/api/v1/collectors/alice/logs").statusCode());
    }

    @Test
    void invalidStudentNameIsRejected() throws Exception {
        assertEquals(400, post("/api/v1/collectors/bad%20name", "").statusCode());
    }

    @Test
    void scriptRunReportsExitCode() throws Exception {
        HttpResponse<String> response = post("/api/v1/scripts/run", """
                {"nodeName": "dhcp-server-1", "remotePath": "/opt/check.sh", "shell": "bash", "timeout": 0.1}
                """);

        assertEquals(200, response.statusCode(), "Body: " + response.body());
        JsonNode result = MAPPER.readTree(response.body());
        assertTrue(result.get("success").asBoolean());
        assertEquals(0, result.get("exitCode").asInt());
        assertTrue(result.get("output").asText().contains("all good"));

        assertEquals(400, post("/api/v1/scripts/run", "{\"nodeName\": \"Nope\", \"remotePath\": \"/x\"}")
                .statusCode());
    }
}
