package com.lbg.markets.surveillance.tail.tracker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stores checkpoints as a JSON document on local disk.
 * Writes go to a temp file first and are renamed into place, so a crash mid-save leaves
 * the previous snapshot intact.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOG = Logger.getLogger(FileCheckpointStore.class);
    private static final TypeReference<List<Checkpoint>> CHECKPOINTS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Path file;

    public FileCheckpointStore(
            ObjectMapper mapper,
            @ConfigProperty(name = "tail.checkpoint.path", defaultValue = "data/checkpoints.json") String path
    ) {
        this.mapper = mapper;
        this.file = Paths.get(path);
    }

    @Override
    public void save(List<Checkpoint> checkpoints) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writerFor(CHECKPOINTS).writeValue(temp.toFile(), checkpoints);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        LOG.debugf("Saved %d checkpoints to %s", checkpoints.size(), file);
    }

    @Override
    public List<Checkpoint> load() throws IOException {
        if (!Files.exists(file)) {
            LOG.infof("No checkpoint file at %s, starting fresh", file);
            return List.of();
        }
        List<Checkpoint> checkpoints = mapper.readValue(file.toFile(), CHECKPOINTS);
        LOG.infof("Loaded %d checkpoints from %s", checkpoints.size(), file);
        return checkpoints;
    }
}
