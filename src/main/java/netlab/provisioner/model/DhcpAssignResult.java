package netlab.provisioner.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a two-phase DHCP bring-up.
 *
 * @param serverResults one entry per DHCP/DNS server node
 * @param clientResults one entry per remaining node, switches included as skipped
 * @param changedNodes  names of nodes whose {@code assigned_ip} changed
 * @param backupPath    backup written before the store was updated, null when nothing changed
 */
public record DhcpAssignResult(
        List<NodeExecutionResult> serverResults,
        List<NodeExecutionResult> clientResults,
        List<String> changedNodes,
        Path backupPath) {

    public DhcpAssignResult {
        serverResults = List.copyOf(serverResults);
        clientResults = List.copyOf(clientResults);
        changedNodes = List.copyOf(changedNodes);
    }

    public boolean changed() {
        return !changedNodes.isEmpty();
    }
}
