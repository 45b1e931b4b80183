package com.lbg.markets.surveillance.tail.tracker;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Simple in-memory store for development/testing.
 * Not persistent - state is lost on restart.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCheckpointStore.class);

    private final AtomicReference<List<Checkpoint>> snapshot = new AtomicReference<>(List.of());

    @Override
    public void save(List<Checkpoint> checkpoints) {
        snapshot.set(List.copyOf(checkpoints));
        LOG.debugf("Saved %d checkpoints", checkpoints.size());
    }

    @Override
    public List<Checkpoint> load() {
        return snapshot.get();
    }
}
