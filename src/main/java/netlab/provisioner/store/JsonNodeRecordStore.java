package netlab.provisioner.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import netlab.provisioner.model.NodeConfig;
import netlab.provisioner.repository.NodeRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Node store backed by one JSON file.
 * Writes go to a temp file in the same directory which is then moved over the original.
 */
public class JsonNodeRecordStore implements NodeRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonNodeRecordStore.class);
    private static final String BACKUP_SUFFIX = ".backup.json";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;

    public JsonNodeRecordStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public NodeConfig load() {
        if (!Files.exists(path)) {
            throw new NodeStoreException("Config file not found: " + path);
        }
        try {
            JsonNode tree = MAPPER.readTree(path.toFile());
            if (tree == null || !tree.isObject()) {
                throw new NodeStoreException("Config file must contain a JSON object: " + path);
            }
            return MAPPER.treeToValue(tree, NodeConfig.class);
        } catch (IOException e) {
            throw new NodeStoreException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(NodeConfig config) {
        Path tmp = null;
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(tmp, MAPPER.writeValueAsString(config) + "\n");
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote node config {}", path);
        } catch (IOException e) {
            throw new NodeStoreException("Failed to write " + path + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    @Override
    public Path backup() {
        Path backup = backupPath();
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up {} to {}", path, backup);
        } catch (NoSuchFileException e) {
            log.debug("Nothing to back up at {}", path);
        } catch (IOException e) {
            throw new NodeStoreException("Failed to back up " + path + ": " + e.getMessage(), e);
        }
        return backup;
    }

    Path backupPath() {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(stem + BACKUP_SUFFIX);
    }
}
