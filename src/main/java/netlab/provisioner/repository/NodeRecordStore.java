package netlab.provisioner.repository;

import netlab.provisioner.model.NodeConfig;

import java.nio.file.Path;

/**
 * Persistence for the generated topology config.
 */
public interface NodeRecordStore {

    /**
     * Read the whole document.
     *
     * @return the config
     * @throws netlab.provisioner.store.NodeStoreException if missing or malformed
     */
    NodeConfig load();

    /**
     * Replace the document. Implementations must not leave a half-written file behind.
     *
     * @param config the config to persist
     */
    void write(NodeConfig config);

    /**
     * Copy the current document aside.
     *
     * @return path of the backup
     */
    Path backup();
}
