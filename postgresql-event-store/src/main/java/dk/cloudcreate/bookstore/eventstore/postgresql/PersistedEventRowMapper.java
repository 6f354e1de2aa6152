package dk.cloudcreate.bookstore.eventstore.postgresql;

import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final EventTypeRegistry eventTypeRegistry;
    private final JSONSerializer    jsonSerializer;

    PersistedEventRowMapper(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer) {
        this.eventTypeRegistry = checkNotNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = rs.getString("event_type");
        if (eventType == null || eventType.isBlank()) {
            throw new EventStoreException(lenientFormat("Row with global_order %s has an empty event_type", rs.getLong("global_order")));
        }
        return new PersistedEvent(EventId.of(rs.getString("event_id")),
                                  TenantId.of(rs.getString("tenant_id")),
                                  StreamId.of(rs.getString("stream_id")),
                                  StreamVersion.of(rs.getLong("stream_version")),
                                  GlobalEventOrder.of(rs.getLong("global_order")),
                                  new EventJSON(eventTypeRegistry, jsonSerializer, EventType.of(eventType), rs.getString("event_payload")),
                                  CorrelationId.optionalFrom(rs.getString("correlation_id")),
                                  EventId.optionalFrom(rs.getString("causation_id")),
                                  rs.getObject("event_timestamp", OffsetDateTime.class));
    }
}
