package netlab.provisioner.platform;

import java.util.List;

/**
 * Node and link management on the emulation platform.
 * All methods throw {@link PlatformException} when the platform rejects the call.
 */
public interface PlatformClient {

    List<PlatformProject> listProjects();

    /**
     * @throws java.util.NoSuchElementException if no project has this name
     */
    String findProjectId(String projectName);

    List<PlatformTemplate> listTemplates();

    /**
     * Instantiate a template as a new node at (x, y).
     */
    PlatformNode addNodeFromTemplate(String projectId, String templateId, String name, int x, int y);

    PlatformNode getNode(String projectId, String nodeId);

    List<PlatformNode> listNodes(String projectId);

    /**
     * @return false if the platform refused to start the node
     */
    boolean startNode(String projectId, String nodeId);

    boolean stopAllNodes(String projectId);

    List<PlatformLink> listLinks(String projectId);

    PlatformLink createLink(String projectId, LinkEndpoint a, LinkEndpoint b);

    boolean deleteNode(String projectId, String nodeId);

    boolean deleteLink(String projectId, String linkId);

    /**
     * Stop every node, then delete all links and nodes, collecting errors instead of failing.
     */
    DeleteSummary deleteAllNodes(String projectId);
}
