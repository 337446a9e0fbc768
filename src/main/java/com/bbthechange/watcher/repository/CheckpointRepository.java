package com.bbthechange.watcher.repository;

import com.bbthechange.watcher.model.Checkpoint;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for per-(source-unit, filter) progress watermarks.
 */
public interface CheckpointRepository {

    /**
     * Find the checkpoint for a pair.
     *
     * @param sourceUnit Normalized source-unit name
     * @param filter Normalized filter text
     * @return Optional containing the checkpoint if one was ever written
     */
    Optional<Checkpoint> find(String sourceUnit, String filter);

    /**
     * Move the watermark for a pair forward.
     * The write is conditional: a stored watermark that is already at or past
     * {@code lastSeenTime} is left untouched.
     *
     * @return true if the watermark was written, false if the store already held a value at or past it
     */
    boolean advance(String sourceUnit, String filter, Instant lastSeenTime);
}
