package dk.cloudcreate.bookstore.projection.store.postgresql;

import dk.cloudcreate.bookstore.common.transaction.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.store.*;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.*;
import java.util.*;
import java.util.function.Function;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;
import static dk.cloudcreate.bookstore.eventstore.postgresql.PostgresqlEventStoreConfiguration.checkValidSqlName;

/**
 * {@link ProjectionStore} using two PostgreSQL tables: one row per projection and tenant holding the checkpoint and generation
 * bookkeeping, and one row per document (stored as JSONB) keyed by projection, tenant, generation, document type and id.<br>
 * Document writes and the checkpoint update of a batch share a transaction, and the checkpoint row is locked for the duration
 * of the transaction, so a generation swap can't interleave with a commit.
 */
public class PostgresqlProjectionStore implements ProjectionStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlProjectionStore.class);

    public static final String DEFAULT_CHECKPOINTS_TABLE_NAME = "projection_checkpoints";
    public static final String DEFAULT_DOCUMENTS_TABLE_NAME   = "projection_documents";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final String                                                        checkpointsTableName;
    private final String                                                        documentsTableName;
    private final Clock                                                         clock;
    private final RowMapper<ProjectionDocument>                                 documentRowMapper = PostgresqlProjectionStore::mapDocument;

    public PostgresqlProjectionStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, DEFAULT_CHECKPOINTS_TABLE_NAME, DEFAULT_DOCUMENTS_TABLE_NAME, Clock.systemUTC());
    }

    public PostgresqlProjectionStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                     String checkpointsTableName,
                                     String documentsTableName,
                                     Clock clock) {
        this.unitOfWorkFactory = checkNotNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.checkpointsTableName = checkValidSqlName(checkpointsTableName);
        this.documentsTableName = checkValidSqlName(documentsTableName);
        this.clock = checkNotNull(clock, "No clock provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> createTables(unitOfWork.handle()));
    }

    private void createTables(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + checkpointsTableName + " (\n" +
                               "    projection text NOT NULL,\n" +
                               "    tenant_id text NOT NULL,\n" +
                               "    active_generation int NOT NULL,\n" +
                               "    checkpoint bigint NOT NULL,\n" +
                               "    rebuild_generation int,\n" +
                               "    rebuild_checkpoint bigint,\n" +
                               "    halted_error text,\n" +
                               "    updated_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    PRIMARY KEY (projection, tenant_id)\n" +
                               ")");
        handle.execute("CREATE TABLE IF NOT EXISTS " + documentsTableName + " (\n" +
                               "    projection text NOT NULL,\n" +
                               "    tenant_id text NOT NULL,\n" +
                               "    generation int NOT NULL,\n" +
                               "    doc_type text NOT NULL,\n" +
                               "    doc_id text NOT NULL,\n" +
                               "    version bigint NOT NULL,\n" +
                               "    soft_deleted boolean NOT NULL DEFAULT false,\n" +
                               "    document JSONB NOT NULL,\n" +
                               "    updated_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    PRIMARY KEY (projection, tenant_id, generation, doc_type, doc_id)\n" +
                               ")");
        log.info("Ensured projection tables '{}' and '{}' exist", checkpointsTableName, documentsTableName);
    }

    @Override
    public ProjectionCheckpoint checkpoint(ProjectionName projectionName, TenantId tenantId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        return withHandle(handle -> findCheckpoint(handle, projectionName, tenantId, false))
                .orElseGet(() -> ProjectionCheckpoint.initial(projectionName, tenantId));
    }

    @Override
    public Optional<ProjectionDocument> findDocument(ProjectionName projectionName, TenantId tenantId, int generation, String documentType, String documentId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(documentType, "No documentType provided");
        checkNotNull(documentId, "No documentId provided");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + documentsTableName +
                                                               " WHERE projection = :projection AND tenant_id = :tenantId AND generation = :generation" +
                                                               " AND doc_type = :docType AND doc_id = :docId")
                                          .bind("projection", projectionName.toString())
                                          .bind("tenantId", tenantId.toString())
                                          .bind("generation", generation)
                                          .bind("docType", documentType)
                                          .bind("docId", documentId)
                                          .map(documentRowMapper)
                                          .findOne());
    }

    @Override
    public List<ProjectionDocument> findDocuments(ProjectionName projectionName, TenantId tenantId, int generation, String documentType) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(documentType, "No documentType provided");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + documentsTableName +
                                                               " WHERE projection = :projection AND tenant_id = :tenantId AND generation = :generation" +
                                                               " AND doc_type = :docType ORDER BY doc_id ASC")
                                          .bind("projection", projectionName.toString())
                                          .bind("tenantId", tenantId.toString())
                                          .bind("generation", generation)
                                          .bind("docType", documentType)
                                          .map(documentRowMapper)
                                          .list());
    }

    @Override
    public void commit(ProjectionName projectionName, TenantId tenantId, int generation, List<DocumentWrite> writes, GlobalEventOrder checkpoint) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(writes, "No writes provided");
        checkNotNull(checkpoint, "No checkpoint provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle  = unitOfWork.handle();
            var current = lockCheckpoint(handle, projectionName, tenantId);
            String checkpointColumn;
            if (current.activeGeneration == generation) {
                checkpointColumn = "checkpoint";
            } else if (current.rebuildGeneration.isPresent() && current.rebuildGeneration.get() == generation) {
                checkpointColumn = "rebuild_checkpoint";
            } else {
                throw new ProjectionException(lenientFormat("[%s:%s] Generation %s is neither active (%s) nor being rebuilt (%s)",
                                                            projectionName, tenantId, generation, current.activeGeneration, current.rebuildGeneration));
            }

            writeDocuments(handle, projectionName, tenantId, generation, writes);
            handle.createUpdate("UPDATE " + checkpointsTableName +
                                        " SET " + checkpointColumn + " = GREATEST(COALESCE(" + checkpointColumn + ", 0), :checkpoint), updated_at = :now" +
                                        " WHERE projection = :projection AND tenant_id = :tenantId")
                  .bind("checkpoint", checkpoint.longValue())
                  .bind("now", now())
                  .bind("projection", projectionName.toString())
                  .bind("tenantId", tenantId.toString())
                  .execute();
        });
        log.trace("[{}:{}] Committed {} document write(s) to generation {} at checkpoint {}", projectionName, tenantId, writes.size(), generation, checkpoint);
    }

    private void writeDocuments(Handle handle, ProjectionName projectionName, TenantId tenantId, int generation, List<DocumentWrite> writes) {
        var now     = now();
        var upserts = handle.prepareBatch("INSERT INTO " + documentsTableName +
                                                  " (projection, tenant_id, generation, doc_type, doc_id, version, soft_deleted, document, updated_at)" +
                                                  " VALUES (:projection, :tenantId, :generation, :docType, :docId, :version, :softDeleted, CAST(:document AS JSONB), :now)" +
                                                  " ON CONFLICT (projection, tenant_id, generation, doc_type, doc_id) DO UPDATE SET" +
                                                  " version = EXCLUDED.version, soft_deleted = EXCLUDED.soft_deleted, document = EXCLUDED.document, updated_at = EXCLUDED.updated_at");
        var deletes = handle.prepareBatch("DELETE FROM " + documentsTableName +
                                                  " WHERE projection = :projection AND tenant_id = :tenantId AND generation = :generation" +
                                                  " AND doc_type = :docType AND doc_id = :docId");
        var hasUpserts = false;
        var hasDeletes = false;
        for (var write : writes) {
            if (write.isDelete()) {
                deletes.bind("projection", projectionName.toString())
                       .bind("tenantId", tenantId.toString())
                       .bind("generation", generation)
                       .bind("docType", write.documentType)
                       .bind("docId", write.documentId)
                       .add();
                hasDeletes = true;
            } else {
                upserts.bind("projection", projectionName.toString())
                       .bind("tenantId", tenantId.toString())
                       .bind("generation", generation)
                       .bind("docType", write.documentType)
                       .bind("docId", write.documentId)
                       .bind("version", write.version)
                       .bind("softDeleted", write.softDeleted)
                       .bind("document", write.json.get())
                       .bind("now", now)
                       .add();
                hasUpserts = true;
            }
        }
        if (hasUpserts) {
            upserts.execute();
        }
        if (hasDeletes) {
            deletes.execute();
        }
    }

    @Override
    public int beginRebuild(ProjectionName projectionName, TenantId tenantId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle     = unitOfWork.handle();
            var current    = lockCheckpoint(handle, projectionName, tenantId);
            var generation = Math.max(current.activeGeneration, current.rebuildGeneration.orElse(0)) + 1;
            deleteOtherGenerations(handle, projectionName, tenantId, current.activeGeneration);
            handle.createUpdate("UPDATE " + checkpointsTableName +
                                        " SET rebuild_generation = :generation, rebuild_checkpoint = 0, updated_at = :now" +
                                        " WHERE projection = :projection AND tenant_id = :tenantId")
                  .bind("generation", generation)
                  .bind("now", now())
                  .bind("projection", projectionName.toString())
                  .bind("tenantId", tenantId.toString())
                  .execute();
            log.debug("[{}:{}] Started rebuild into generation {}", projectionName, tenantId, generation);
            return generation;
        });
    }

    @Override
    public void completeRebuild(ProjectionName projectionName, TenantId tenantId, int generation) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle  = unitOfWork.handle();
            var current = lockCheckpoint(handle, projectionName, tenantId);
            checkState(current.rebuildGeneration.isPresent() && current.rebuildGeneration.get() == generation,
                       "[%s:%s] Generation %s is not being rebuilt", projectionName, tenantId, generation);
            handle.createUpdate("UPDATE " + checkpointsTableName +
                                        " SET active_generation = :generation, checkpoint = COALESCE(rebuild_checkpoint, 0)," +
                                        " rebuild_generation = NULL, rebuild_checkpoint = NULL, updated_at = :now" +
                                        " WHERE projection = :projection AND tenant_id = :tenantId")
                  .bind("generation", generation)
                  .bind("now", now())
                  .bind("projection", projectionName.toString())
                  .bind("tenantId", tenantId.toString())
                  .execute();
            deleteOtherGenerations(handle, projectionName, tenantId, generation);
        });
        log.debug("[{}:{}] Generation {} is now active", projectionName, tenantId, generation);
    }

    @Override
    public void halt(ProjectionName projectionName, TenantId tenantId, String error) {
        checkNotNull(error, "No error provided");
        updateHaltedError(projectionName, tenantId, error);
    }

    @Override
    public void clearHalt(ProjectionName projectionName, TenantId tenantId) {
        updateHaltedError(projectionName, tenantId, null);
    }

    private void updateHaltedError(ProjectionName projectionName, TenantId tenantId, String error) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            lockCheckpoint(handle, projectionName, tenantId);
            handle.createUpdate("UPDATE " + checkpointsTableName +
                                        " SET halted_error = :error, updated_at = :now" +
                                        " WHERE projection = :projection AND tenant_id = :tenantId")
                  .bind("error", error)
                  .bind("now", now())
                  .bind("projection", projectionName.toString())
                  .bind("tenantId", tenantId.toString())
                  .execute();
        });
    }

    private void deleteOtherGenerations(Handle handle, ProjectionName projectionName, TenantId tenantId, int keepGeneration) {
        var deleted = handle.createUpdate("DELETE FROM " + documentsTableName +
                                                  " WHERE projection = :projection AND tenant_id = :tenantId AND generation <> :generation")
                            .bind("projection", projectionName.toString())
                            .bind("tenantId", tenantId.toString())
                            .bind("generation", keepGeneration)
                            .execute();
        if (deleted > 0) {
            log.debug("[{}:{}] Deleted {} document(s) not belonging to generation {}", projectionName, tenantId, deleted, keepGeneration);
        }
    }

    /**
     * Ensure the checkpoint row exists and lock it for the rest of the transaction
     */
    private ProjectionCheckpoint lockCheckpoint(Handle handle, ProjectionName projectionName, TenantId tenantId) {
        handle.createUpdate("INSERT INTO " + checkpointsTableName +
                                    " (projection, tenant_id, active_generation, checkpoint, updated_at)" +
                                    " VALUES (:projection, :tenantId, :generation, 0, :now) ON CONFLICT DO NOTHING")
              .bind("projection", projectionName.toString())
              .bind("tenantId", tenantId.toString())
              .bind("generation", ProjectionCheckpoint.FIRST_GENERATION)
              .bind("now", now())
              .execute();
        return findCheckpoint(handle, projectionName, tenantId, true)
                .orElseThrow(() -> new ProjectionException(lenientFormat("[%s:%s] Checkpoint row disappeared", projectionName, tenantId)));
    }

    private Optional<ProjectionCheckpoint> findCheckpoint(Handle handle, ProjectionName projectionName, TenantId tenantId, boolean forUpdate) {
        return handle.createQuery("SELECT * FROM " + checkpointsTableName +
                                          " WHERE projection = :projection AND tenant_id = :tenantId" +
                                          (forUpdate ? " FOR UPDATE" : ""))
                     .bind("projection", projectionName.toString())
                     .bind("tenantId", tenantId.toString())
                     .map((rs, ctx) -> mapCheckpoint(rs, projectionName, tenantId))
                     .findOne();
    }

    private static ProjectionCheckpoint mapCheckpoint(ResultSet rs, ProjectionName projectionName, TenantId tenantId) throws SQLException {
        var rebuildGeneration = rs.getInt("rebuild_generation");
        var isRebuilding      = !rs.wasNull();
        var rebuildCheckpoint = rs.getLong("rebuild_checkpoint");
        return new ProjectionCheckpoint(projectionName,
                                        tenantId,
                                        rs.getInt("active_generation"),
                                        GlobalEventOrder.of(rs.getLong("checkpoint")),
                                        isRebuilding ? Optional.of(rebuildGeneration) : Optional.empty(),
                                        GlobalEventOrder.of(rebuildCheckpoint),
                                        Optional.ofNullable(rs.getString("halted_error")));
    }

    private static ProjectionDocument mapDocument(ResultSet rs, StatementContext ctx) throws SQLException {
        return new ProjectionDocument(rs.getString("doc_type"),
                                      rs.getString("doc_id"),
                                      rs.getLong("version"),
                                      rs.getBoolean("soft_deleted"),
                                      rs.getString("document"),
                                      rs.getObject("updated_at", OffsetDateTime.class));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private <R> R withHandle(Function<Handle, R> function) {
        var unitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (unitOfWork.isPresent()) {
            return function.apply(unitOfWork.get().handle());
        }
        return unitOfWorkFactory.withUnitOfWork(newUnitOfWork -> function.apply(newUnitOfWork.handle()));
    }
}
