package com.z254.loom.checkpoint;

import com.z254.loom.domain.model.Checkpoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence for graph execution checkpoints.
 */
public interface CheckpointStore {

    /**
     * Save a checkpoint, replacing any previous one with the same id.
     */
    Mono<Void> save(Checkpoint checkpoint);

    /**
     * Load a checkpoint by ID. Empty when none is stored.
     */
    Mono<Checkpoint> load(String checkpointId);

    /**
     * Find checkpoints written by runs of a graph.
     */
    Flux<Checkpoint> findByGraphName(String graphName);

    /**
     * Find checkpoints written by one execution.
     */
    Flux<Checkpoint> findByExecution(String executionId);

    /**
     * Delete a checkpoint by ID.
     */
    Mono<Void> delete(String checkpointId);

    /**
     * Delete checkpoints created before the cutoff and return how many were removed.
     */
    Mono<Long> deleteOlderThan(Instant cutoff);
}
