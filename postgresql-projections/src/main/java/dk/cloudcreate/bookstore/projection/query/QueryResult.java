package dk.cloudcreate.bookstore.projection.query;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A read model document together with its version
 */
public final class QueryResult<T> {
    public final T       document;
    public final long    version;
    public final boolean softDeleted;

    public QueryResult(T document, long version, boolean softDeleted) {
        this.document = checkNotNull(document, "No document provided");
        this.version = version;
        this.softDeleted = softDeleted;
    }

    /**
     * @return the version as a strong ETag, usable as <code>If-Match</code> value of a following command
     */
    public String etag() {
        return "\"" + version + "\"";
    }

    @Override
    public String toString() {
        return "QueryResult{" + document + ", version=" + version + (softDeleted ? ", softDeleted" : "") + '}';
    }
}
