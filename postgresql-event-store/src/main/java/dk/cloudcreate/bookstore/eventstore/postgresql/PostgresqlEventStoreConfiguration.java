package dk.cloudcreate.bookstore.eventstore.postgresql;

import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.*;

/**
 * Configuration of the {@link PostgresqlEventStore}
 */
public final class PostgresqlEventStoreConfiguration {
    private static final Pattern VALID_SQL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,50}");

    public static final String DEFAULT_EVENTS_TABLE_NAME = "events";
    /**
     * First key of the two-key transaction scoped advisory lock taken per tenant while appending
     */
    public static final int    DEFAULT_APPEND_LOCK_NAMESPACE = 71_431;

    /**
     * Name of the table holding all events of all tenants
     */
    public final String eventsTableName;
    public final int    appendLockNamespace;

    public PostgresqlEventStoreConfiguration(String eventsTableName, int appendLockNamespace) {
        this.eventsTableName = checkValidSqlName(eventsTableName);
        this.appendLockNamespace = appendLockNamespace;
    }

    public static PostgresqlEventStoreConfiguration defaultConfiguration() {
        return new PostgresqlEventStoreConfiguration(DEFAULT_EVENTS_TABLE_NAME, DEFAULT_APPEND_LOCK_NAMESPACE);
    }

    /**
     * Table and column names are interpolated into SQL, so only plain SQL identifiers are accepted
     */
    public static String checkValidSqlName(String name) {
        checkNotNull(name, "No name provided");
        checkArgument(VALID_SQL_NAME.matcher(name).matches(), "'%s' is not a valid SQL table name", name);
        return name;
    }
}
