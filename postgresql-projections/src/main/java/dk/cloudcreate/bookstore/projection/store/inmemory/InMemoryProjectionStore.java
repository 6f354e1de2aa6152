package dk.cloudcreate.bookstore.projection.store.inmemory;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.store.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * {@link ProjectionStore} keeping documents and checkpoints in memory. Every operation is atomic
 */
public class InMemoryProjectionStore implements ProjectionStore {
    private final Map<String, ProjectionState> states = new HashMap<>();
    private final Clock                        clock;

    public InMemoryProjectionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProjectionStore(Clock clock) {
        this.clock = checkNotNull(clock, "No clock provided");
    }

    @Override
    public synchronized ProjectionCheckpoint checkpoint(ProjectionName projectionName, TenantId tenantId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        var state = states.get(key(projectionName, tenantId));
        if (state == null) {
            return ProjectionCheckpoint.initial(projectionName, tenantId);
        }
        return state.toCheckpoint(projectionName, tenantId);
    }

    @Override
    public synchronized Optional<ProjectionDocument> findDocument(ProjectionName projectionName, TenantId tenantId, int generation, String documentType, String documentId) {
        checkNotNull(documentType, "No documentType provided");
        checkNotNull(documentId, "No documentId provided");
        return Optional.ofNullable(stateOf(projectionName, tenantId).documents(generation, documentType).get(documentId));
    }

    @Override
    public synchronized List<ProjectionDocument> findDocuments(ProjectionName projectionName, TenantId tenantId, int generation, String documentType) {
        checkNotNull(documentType, "No documentType provided");
        return new ArrayList<>(stateOf(projectionName, tenantId).documents(generation, documentType).values());
    }

    @Override
    public synchronized void commit(ProjectionName projectionName, TenantId tenantId, int generation, List<DocumentWrite> writes, GlobalEventOrder checkpoint) {
        checkNotNull(writes, "No writes provided");
        checkNotNull(checkpoint, "No checkpoint provided");
        var state = stateOf(projectionName, tenantId);
        var rebuilding = state.rebuildGeneration != null && state.rebuildGeneration == generation;
        if (generation != state.activeGeneration && !rebuilding) {
            throw new ProjectionException(lenientFormat("[%s:%s] Generation %s is neither active (%s) nor being rebuilt (%s)",
                                                        projectionName, tenantId, generation, state.activeGeneration, state.rebuildGeneration));
        }

        var now = OffsetDateTime.now(clock);
        for (var write : writes) {
            var documents = state.documents(generation, write.documentType);
            if (write.isDelete()) {
                documents.remove(write.documentId);
            } else {
                documents.put(write.documentId, new ProjectionDocument(write.documentType, write.documentId, write.version, write.softDeleted, write.json.get(), now));
            }
        }
        if (rebuilding) {
            state.rebuildCheckpoint = GlobalEventOrder.max(state.rebuildCheckpoint, checkpoint);
        } else {
            state.checkpoint = GlobalEventOrder.max(state.checkpoint, checkpoint);
        }
    }

    @Override
    public synchronized int beginRebuild(ProjectionName projectionName, TenantId tenantId) {
        var state = stateOf(projectionName, tenantId);
        var generation = Math.max(state.activeGeneration, state.rebuildGeneration != null ? state.rebuildGeneration : 0) + 1;
        state.generations.keySet().removeIf(existingGeneration -> existingGeneration != state.activeGeneration);
        state.rebuildGeneration = generation;
        state.rebuildCheckpoint = GlobalEventOrder.NONE;
        return generation;
    }

    @Override
    public synchronized void completeRebuild(ProjectionName projectionName, TenantId tenantId, int generation) {
        var state = stateOf(projectionName, tenantId);
        checkState(state.rebuildGeneration != null && state.rebuildGeneration == generation,
                   "[%s:%s] Generation %s is not being rebuilt", projectionName, tenantId, generation);
        state.generations.keySet().removeIf(existingGeneration -> existingGeneration != generation);
        state.activeGeneration = generation;
        state.checkpoint = state.rebuildCheckpoint;
        state.rebuildGeneration = null;
        state.rebuildCheckpoint = GlobalEventOrder.NONE;
    }

    @Override
    public synchronized void halt(ProjectionName projectionName, TenantId tenantId, String error) {
        checkNotNull(error, "No error provided");
        stateOf(projectionName, tenantId).haltedError = error;
    }

    @Override
    public synchronized void clearHalt(ProjectionName projectionName, TenantId tenantId) {
        stateOf(projectionName, tenantId).haltedError = null;
    }

    /**
     * @return the generations that currently hold documents for the projection and tenant
     */
    public synchronized Set<Integer> generations(ProjectionName projectionName, TenantId tenantId) {
        return stateOf(projectionName, tenantId).generations.entrySet()
                                                            .stream()
                                                            .filter(entry -> entry.getValue().values().stream().anyMatch(documents -> !documents.isEmpty()))
                                                            .map(Map.Entry::getKey)
                                                            .collect(Collectors.toSet());
    }

    private ProjectionState stateOf(ProjectionName projectionName, TenantId tenantId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        return states.computeIfAbsent(key(projectionName, tenantId), key -> new ProjectionState());
    }

    private static String key(ProjectionName projectionName, TenantId tenantId) {
        return projectionName + "|" + tenantId;
    }

    private static class ProjectionState {
        private final Map<Integer, Map<String, SortedMap<String, ProjectionDocument>>> generations       = new HashMap<>();
        private       int                                                               activeGeneration  = ProjectionCheckpoint.FIRST_GENERATION;
        private       GlobalEventOrder                                                  checkpoint        = GlobalEventOrder.NONE;
        private       Integer                                                           rebuildGeneration;
        private       GlobalEventOrder                                                  rebuildCheckpoint = GlobalEventOrder.NONE;
        private       String                                                            haltedError;

        private SortedMap<String, ProjectionDocument> documents(int generation, String documentType) {
            return generations.computeIfAbsent(generation, g -> new HashMap<>())
                              .computeIfAbsent(documentType, type -> new TreeMap<>());
        }

        private ProjectionCheckpoint toCheckpoint(ProjectionName projectionName, TenantId tenantId) {
            return new ProjectionCheckpoint(projectionName,
                                            tenantId,
                                            activeGeneration,
                                            checkpoint,
                                            Optional.ofNullable(rebuildGeneration),
                                            rebuildCheckpoint,
                                            Optional.ofNullable(haltedError));
        }
    }
}
