package netlab.provisioner.platform;

import java.util.List;

/**
 * Counts from wiping a project.
 */
public record DeleteSummary(int nodesDeleted, int linksDeleted, List<String> errors) {

    public DeleteSummary {
        errors = List.copyOf(errors);
    }
}
