package dk.cloudcreate.bookstore.scheduler.store.postgresql;

import dk.cloudcreate.bookstore.common.transaction.*;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.scheduler.*;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.*;
import java.time.*;
import java.util.*;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;
import static dk.cloudcreate.bookstore.eventstore.postgresql.PostgresqlEventStoreConfiguration.checkValidSqlName;

/**
 * {@link ScheduledCommandStore} backed by a single PostgreSQL table.<br>
 * Due entries are claimed using <code>FOR UPDATE SKIP LOCKED</code>, so any number of scheduler instances can poll the same
 * table without claiming the same entry twice. The unique index on tenant and idempotency key makes registration idempotent.
 */
public class PostgresqlScheduledCommandStore implements ScheduledCommandStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlScheduledCommandStore.class);

    public static final String DEFAULT_SCHEDULED_COMMANDS_TABLE_NAME = "scheduled_commands";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final String                                                        tableName;
    private final RowMapper<ScheduledCommand>                                   rowMapper = PostgresqlScheduledCommandStore::mapScheduledCommand;

    public PostgresqlScheduledCommandStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, DEFAULT_SCHEDULED_COMMANDS_TABLE_NAME);
    }

    public PostgresqlScheduledCommandStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory, String tableName) {
        this.unitOfWorkFactory = checkNotNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.tableName = checkValidSqlName(tableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> createTable(unitOfWork.handle()));
    }

    private void createTable(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                               "    id text PRIMARY KEY,\n" +
                               "    tenant_id text NOT NULL,\n" +
                               "    idempotency_key text NOT NULL,\n" +
                               "    command_type text NOT NULL,\n" +
                               "    command_payload JSONB NOT NULL,\n" +
                               "    due_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    correlation_id text NOT NULL,\n" +
                               "    causation_id text,\n" +
                               "    status text NOT NULL,\n" +
                               "    dispatch_attempts int NOT NULL DEFAULT 0,\n" +
                               "    last_error text,\n" +
                               "    claimed_at TIMESTAMP WITH TIME ZONE,\n" +
                               "    created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    completed_at TIMESTAMP WITH TIME ZONE\n" +
                               ")");
        handle.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + tableName + "_idempotency_key ON " + tableName + " (tenant_id, idempotency_key)");
        handle.execute("CREATE INDEX IF NOT EXISTS " + tableName + "_due ON " + tableName + " (status, due_at)");
        log.info("Ensured scheduled commands table '{}' exists", tableName);
    }

    @Override
    public boolean register(ScheduledCommand scheduledCommand) {
        checkNotNull(scheduledCommand, "No scheduledCommand provided");
        var rowsInserted = withHandle(handle -> handle.createUpdate("INSERT INTO " + tableName + " (\n" +
                                                                            "    id, tenant_id, idempotency_key, command_type, command_payload, due_at,\n" +
                                                                            "    correlation_id, causation_id, status, dispatch_attempts, created_at\n" +
                                                                            ") VALUES (\n" +
                                                                            "    :id, :tenantId, :idempotencyKey, :commandType, :commandPayload::jsonb, :dueAt,\n" +
                                                                            "    :correlationId, :causationId, :status, 0, :createdAt\n" +
                                                                            ") ON CONFLICT (tenant_id, idempotency_key) DO NOTHING")
                                                      .bind("id", scheduledCommand.id.toString())
                                                      .bind("tenantId", scheduledCommand.tenantId.toString())
                                                      .bind("idempotencyKey", scheduledCommand.idempotencyKey)
                                                      .bind("commandType", scheduledCommand.commandType)
                                                      .bind("commandPayload", scheduledCommand.commandJson)
                                                      .bind("dueAt", scheduledCommand.dueAt)
                                                      .bind("correlationId", scheduledCommand.correlationId.toString())
                                                      .bind("causationId", scheduledCommand.causationId.map(EventId::toString).orElse(null))
                                                      .bind("status", ScheduledCommandStatus.PENDING.name())
                                                      .bind("createdAt", scheduledCommand.createdAt)
                                                      .execute());
        return rowsInserted == 1;
    }

    @Override
    public List<ScheduledCommand> claimDue(OffsetDateTime now, OffsetDateTime staleClaimsBefore, int batchSize) {
        checkNotNull(now, "No now provided");
        checkNotNull(staleClaimsBefore, "No staleClaimsBefore provided");
        var claimed = withHandle(handle -> handle.createQuery("UPDATE " + tableName + " SET\n" +
                                                                      "    status = :claimed,\n" +
                                                                      "    claimed_at = :now,\n" +
                                                                      "    dispatch_attempts = dispatch_attempts + 1\n" +
                                                                      " WHERE id IN (\n" +
                                                                      "    SELECT id FROM " + tableName + "\n" +
                                                                      "     WHERE (status = :pending AND due_at <= :now)\n" +
                                                                      "        OR (status = :claimed AND claimed_at < :staleClaimsBefore)\n" +
                                                                      "     ORDER BY due_at ASC, created_at ASC\n" +
                                                                      "     LIMIT :batchSize\n" +
                                                                      "     FOR UPDATE SKIP LOCKED\n" +
                                                                      " )\n" +
                                                                      " RETURNING *")
                                                         .bind("claimed", ScheduledCommandStatus.CLAIMED.name())
                                                         .bind("pending", ScheduledCommandStatus.PENDING.name())
                                                         .bind("now", now)
                                                         .bind("staleClaimsBefore", staleClaimsBefore)
                                                         .bind("batchSize", batchSize)
                                                         .map(rowMapper)
                                                         .list());
        // RETURNING doesn't preserve the sub-select order
        var ordered = new ArrayList<>(claimed);
        ordered.sort(Comparator.comparing((ScheduledCommand entry) -> entry.dueAt).thenComparing(entry -> entry.createdAt));
        return ordered;
    }

    @Override
    public void markExecuted(ScheduledCommandId id, OffsetDateTime executedAt) {
        checkNotNull(executedAt, "No executedAt provided");
        update(id, "status = :status, claimed_at = NULL, completed_at = :completedAt",
               Map.of("status", ScheduledCommandStatus.EXECUTED.name(), "completedAt", executedAt));
    }

    @Override
    public void reschedule(ScheduledCommandId id, OffsetDateTime nextDueAt, String error) {
        checkNotNull(nextDueAt, "No nextDueAt provided");
        checkNotNull(error, "No error provided");
        update(id, "status = :status, claimed_at = NULL, due_at = :dueAt, last_error = :error",
               Map.of("status", ScheduledCommandStatus.PENDING.name(), "dueAt", nextDueAt, "error", error));
    }

    @Override
    public void markFailed(ScheduledCommandId id, OffsetDateTime failedAt, String error) {
        checkNotNull(failedAt, "No failedAt provided");
        checkNotNull(error, "No error provided");
        update(id, "status = :status, claimed_at = NULL, completed_at = :completedAt, last_error = :error",
               Map.of("status", ScheduledCommandStatus.FAILED.name(), "completedAt", failedAt, "error", error));
    }

    private void update(ScheduledCommandId id, String assignments, Map<String, Object> arguments) {
        checkNotNull(id, "No id provided");
        var rowsUpdated = withHandle(handle -> handle.createUpdate("UPDATE " + tableName + " SET " + assignments + " WHERE id = :id")
                                                     .bindMap(arguments)
                                                     .bind("id", id.toString())
                                                     .execute());
        if (rowsUpdated != 1) {
            throw new ScheduledCommandException(lenientFormat("Unknown scheduled command '%s'", id));
        }
    }

    @Override
    public Optional<ScheduledCommand> find(TenantId tenantId, String idempotencyKey) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(idempotencyKey, "No idempotencyKey provided");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + tableName + " WHERE tenant_id = :tenantId AND idempotency_key = :idempotencyKey")
                                          .bind("tenantId", tenantId.toString())
                                          .bind("idempotencyKey", idempotencyKey)
                                          .map(rowMapper)
                                          .findOne());
    }

    @Override
    public List<ScheduledCommand> findAll(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + tableName + " WHERE tenant_id = :tenantId ORDER BY due_at ASC, created_at ASC")
                                          .bind("tenantId", tenantId.toString())
                                          .map(rowMapper)
                                          .list());
    }

    private static ScheduledCommand mapScheduledCommand(ResultSet rs, StatementContext ctx) throws SQLException {
        var causationId = rs.getString("causation_id");
        return new ScheduledCommand(ScheduledCommandId.of(rs.getString("id")),
                                    TenantId.of(rs.getString("tenant_id")),
                                    rs.getString("idempotency_key"),
                                    rs.getString("command_type"),
                                    rs.getString("command_payload"),
                                    toUtc(rs.getObject("due_at", OffsetDateTime.class)),
                                    CorrelationId.of(rs.getString("correlation_id")),
                                    causationId != null ? Optional.of(EventId.of(causationId)) : Optional.empty(),
                                    ScheduledCommandStatus.valueOf(rs.getString("status")),
                                    rs.getInt("dispatch_attempts"),
                                    Optional.ofNullable(rs.getString("last_error")),
                                    Optional.ofNullable(rs.getObject("claimed_at", OffsetDateTime.class)).map(PostgresqlScheduledCommandStore::toUtc),
                                    toUtc(rs.getObject("created_at", OffsetDateTime.class)),
                                    Optional.ofNullable(rs.getObject("completed_at", OffsetDateTime.class)).map(PostgresqlScheduledCommandStore::toUtc));
    }

    private static OffsetDateTime toUtc(OffsetDateTime timestamp) {
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC);
    }

    private <R> R withHandle(Function<Handle, R> function) {
        var unitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (unitOfWork.isPresent()) {
            return function.apply(unitOfWork.get().handle());
        }
        return unitOfWorkFactory.withUnitOfWork(newUnitOfWork -> function.apply(newUnitOfWork.handle()));
    }
}
