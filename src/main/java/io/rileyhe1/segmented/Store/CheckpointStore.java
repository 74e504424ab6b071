package io.rileyhe1.segmented.Store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import io.rileyhe1.segmented.Data.Checkpoint;

/**
 * Durable home of transfer checkpoints. The engine reads and writes checkpoints only
 * through this interface. Writes are serialized: concurrent callers queue, and each
 * save replaces the previous snapshot atomically.
 */
public interface CheckpointStore
{
    /**
     * Returns the checkpoint for a transfer. Corrupt, unreadable or expired checkpoints
     * are reported as absent, never as errors.
     */
    Optional<Checkpoint> load(String transferId);

    /**
     * All loadable checkpoints, with the same corruption and expiry rules as {@link #load}.
     */
    List<Checkpoint> loadAll();

    void save(Checkpoint checkpoint) throws IOException;

    void delete(String transferId) throws IOException;
}
