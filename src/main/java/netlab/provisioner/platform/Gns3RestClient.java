package netlab.provisioner.platform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import netlab.provisioner.util.Pause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Thin client for the GNS3 v2 REST API.
 */
public class Gns3RestClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(Gns3RestClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String baseUrl;
    private final HttpClient http;
    private final Duration requestDelay;

    public Gns3RestClient(String baseUrl, Duration requestDelay) {
        this(baseUrl, requestDelay, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public Gns3RestClient(String baseUrl, Duration requestDelay, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestDelay = requestDelay == null ? Duration.ZERO : requestDelay;
        this.http = http;
    }

    @Override
    public List<PlatformProject> listProjects() {
        return get("/v2/projects", new TypeReference<List<PlatformProject>>() {
        });
    }

    @Override
    public String findProjectId(String projectName) {
        for (PlatformProject project : listProjects()) {
            if (project.name() != null && project.name().equals(projectName)) {
                return project.projectId();
            }
        }
        throw new NoSuchElementException("Project named '" + projectName + "' not found");
    }

    @Override
    public List<PlatformTemplate> listTemplates() {
        return get("/v2/templates", new TypeReference<List<PlatformTemplate>>() {
        });
    }

    @Override
    public PlatformNode addNodeFromTemplate(String projectId, String templateId, String name, int x, int y) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("x", x);
        payload.put("y", y);
        payload.put("name", name);
        PlatformNode node = post("/v2/projects/" + projectId + "/templates/" + templateId, payload,
                PlatformNode.class);
        if (node == null || node.nodeId() == null) {
            throw new PlatformException("Failed to create node '" + name + "': no node_id in response", 0);
        }
        log.info("Created node {} ({}) from template {}", name, node.nodeId(), templateId);
        return node;
    }

    @Override
    public PlatformNode getNode(String projectId, String nodeId) {
        return get("/v2/projects/" + projectId + "/nodes/" + nodeId, new TypeReference<PlatformNode>() {
        });
    }

    @Override
    public List<PlatformNode> listNodes(String projectId) {
        return get("/v2/projects/" + projectId + "/nodes", new TypeReference<List<PlatformNode>>() {
        });
    }

    @Override
    public boolean startNode(String projectId, String nodeId) {
        try {
            post("/v2/projects/" + projectId + "/nodes/" + nodeId + "/start", Map.of(), null);
            return true;
        } catch (PlatformException e) {
            log.warn("Start of node {} refused: {}", nodeId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean stopAllNodes(String projectId) {
        try {
            post("/v2/projects/" + projectId + "/nodes/stop", Map.of(), null);
            return true;
        } catch (PlatformException e) {
            log.warn("Stop of project {} refused: {}", projectId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<PlatformLink> listLinks(String projectId) {
        return get("/v2/projects/" + projectId + "/links", new TypeReference<List<PlatformLink>>() {
        });
    }

    @Override
    public PlatformLink createLink(String projectId, LinkEndpoint a, LinkEndpoint b) {
        Map<String, Object> payload = Map.of("nodes", List.of(a, b));
        return post("/v2/projects/" + projectId + "/links", payload, PlatformLink.class);
    }

    @Override
    public boolean deleteNode(String projectId, String nodeId) {
        try {
            delete("/v2/projects/" + projectId + "/nodes/" + nodeId);
            return true;
        } catch (PlatformException e) {
            log.warn("Delete of node {} failed: {}", nodeId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean deleteLink(String projectId, String linkId) {
        try {
            delete("/v2/projects/" + projectId + "/links/" + linkId);
            return true;
        } catch (PlatformException e) {
            log.warn("Delete of link {} failed: {}", linkId, e.getMessage());
            return false;
        }
    }

    @Override
    public DeleteSummary deleteAllNodes(String projectId) {
        List<String> errors = new ArrayList<>();
        int nodesDeleted = 0;
        int linksDeleted = 0;

        stopAllNodes(projectId);

        try {
            for (PlatformLink link : listLinks(projectId)) {
                if (link.linkId() != null && deleteLink(projectId, link.linkId())) {
                    linksDeleted++;
                }
            }
        } catch (PlatformException e) {
            errors.add("Failed to list/delete links: " + e.getMessage());
        }

        try {
            for (PlatformNode node : listNodes(projectId)) {
                if (node.nodeId() != null && deleteNode(projectId, node.nodeId())) {
                    nodesDeleted++;
                }
            }
        } catch (PlatformException e) {
            errors.add("Failed to list/delete nodes: " + e.getMessage());
        }

        log.info("Project {} wiped: {} nodes, {} links, {} errors",
                projectId, nodesDeleted, linksDeleted, errors.size());
        return new DeleteSummary(nodesDeleted, linksDeleted, errors);
    }

    // ---- transport ----

    private <T> T get(String path, TypeReference<T> type) {
        String body = send(HttpRequest.newBuilder(uri(path)).GET().build());
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new PlatformException("Malformed response from GET " + path + ": " + e.getMessage(), e);
        }
    }

    private <T> T post(String path, Object payload, Class<T> type) {
        String json;
        try {
            json = MAPPER.writeValueAsString(payload);
        } catch (IOException e) {
            throw new PlatformException("Cannot encode request for " + path, e);
        }
        String body = send(HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
        if (type == null || body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new PlatformException("Malformed response from POST " + path + ": " + e.getMessage(), e);
        }
    }

    private void delete(String path) {
        send(HttpRequest.newBuilder(uri(path)).DELETE().build());
    }

    private String send(HttpRequest request) {
        Pause.sleep(requestDelay);
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PlatformException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException(request.method() + " " + request.uri() + " interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new PlatformException(request.method() + " " + request.uri() + " returned " + status
                    + ": " + response.body(), status);
        }
        log.debug("{} {} -> {}", request.method(), request.uri(), status);
        return response.body() == null ? "" : response.body();
    }

    private URI uri(String path) {
        return URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path));
    }
}
