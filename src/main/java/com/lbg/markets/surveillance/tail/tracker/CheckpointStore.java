package com.lbg.markets.surveillance.tail.tracker;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;

import java.io.IOException;
import java.util.List;

/**
 * Interface for persisting tailing progress between restarts.
 * Each save replaces the previous snapshot as a whole.
 */
public interface CheckpointStore {

    /**
     * Replace the stored snapshot.
     */
    void save(List<Checkpoint> checkpoints) throws IOException;

    /**
     * The most recently saved snapshot, or an empty list if nothing was saved yet.
     */
    List<Checkpoint> load() throws IOException;
}
