package com.z254.loom.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.loom.domain.model.AgentState;
import com.z254.loom.domain.model.Checkpoint;
import com.z254.loom.graph.GraphException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory checkpoint store for development and testing.
 * <p>
 * States are kept as Jackson trees, so a stored checkpoint is isolated from later mutations of
 * the state it was taken from, and every load returns a fresh copy. State values must therefore
 * be serializable by Jackson; they come back as JSON-natural types (strings, numbers, booleans,
 * lists and maps).
 */
@Slf4j
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, StoredCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryCheckpointStore() {
        this(defaultObjectMapper());
    }

    public InMemoryCheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> save(Checkpoint checkpoint) {
        if (checkpoint == null || checkpoint.getCheckpointId() == null) {
            return Mono.error(new IllegalArgumentException("Checkpoint and its id must not be null"));
        }
        return Mono.fromRunnable(() -> {
            JsonNode state;
            try {
                state = objectMapper.valueToTree(checkpoint.getState());
            } catch (IllegalArgumentException e) {
                throw GraphException.checkpointFailure(checkpoint.getCheckpointId(), e);
            }
            checkpoints.put(checkpoint.getCheckpointId(),
                    new StoredCheckpoint(checkpoint.toBuilder().state(null).build(), state));
            log.debug("Saved checkpoint {} at node {} (step {})",
                    checkpoint.getCheckpointId(), checkpoint.getNodeName(), checkpoint.getStepCount());
        });
    }

    @Override
    public Mono<Checkpoint> load(String checkpointId) {
        return Mono.fromSupplier(() -> checkpointId != null ? checkpoints.get(checkpointId) : null)
                .map(this::restore);
    }

    @Override
    public Flux<Checkpoint> findByGraphName(String graphName) {
        return Flux.fromIterable(checkpoints.values())
                .filter(stored -> graphName.equals(stored.metadata().getGraphName()))
                .map(this::restore);
    }

    @Override
    public Flux<Checkpoint> findByExecution(String executionId) {
        return Flux.fromIterable(checkpoints.values())
                .filter(stored -> executionId.equals(stored.metadata().getExecutionId()))
                .map(this::restore);
    }

    @Override
    public Mono<Void> delete(String checkpointId) {
        checkpoints.remove(checkpointId);
        return Mono.empty();
    }

    @Override
    public Mono<Long> deleteOlderThan(Instant cutoff) {
        return Mono.fromCallable(() -> {
            long removed = checkpoints.entrySet().stream()
                    .filter(entry -> entry.getValue().metadata().getCreatedAt().isBefore(cutoff))
                    .map(Map.Entry::getKey)
                    .toList()
                    .stream()
                    .filter(id -> checkpoints.remove(id) != null)
                    .count();
            if (removed > 0) {
                log.info("Removed {} checkpoint(s) created before {}", removed, cutoff);
            }
            return removed;
        });
    }

    private Checkpoint restore(StoredCheckpoint stored) {
        try {
            AgentState state = objectMapper.treeToValue(stored.state(), AgentState.class);
            return stored.metadata().toBuilder().state(state).build();
        } catch (JsonProcessingException e) {
            throw GraphException.checkpointFailure(stored.metadata().getCheckpointId(), e);
        }
    }

    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private record StoredCheckpoint(Checkpoint metadata, JsonNode state) {
    }
}
