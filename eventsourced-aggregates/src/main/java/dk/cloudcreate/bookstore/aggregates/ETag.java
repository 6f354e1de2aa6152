package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.common.types.LongType;
import dk.cloudcreate.bookstore.eventstore.types.StreamVersion;

import java.util.Optional;

import static com.google.common.base.Preconditions.*;

/**
 * The externally visible concurrency token of a stream: the stream version rendered as a quoted entity tag, e.g. <code>"3"</code>
 */
public final class ETag extends LongType<ETag> {
    public static final String ANY = "*";

    public ETag(Long value) {
        super(value);
        checkArgument(value >= 0, "ETag value cannot be negative");
    }

    public static ETag of(StreamVersion version) {
        checkNotNull(version, "No version provided");
        return new ETag(version.longValue());
    }

    public static ETag of(long version) {
        return new ETag(version);
    }

    /**
     * Parse an <code>If-Match</code> style value. Surrounding quotes and a weak validator prefix (<code>W/</code>) are accepted
     *
     * @param rawETag the raw value
     * @return the parsed {@link ETag} or {@link Optional#empty()} if the value isn't a valid entity tag
     */
    public static Optional<ETag> parse(String rawETag) {
        if (rawETag == null) {
            return Optional.empty();
        }
        var candidate = rawETag.trim();
        if (candidate.startsWith("W/")) {
            candidate = candidate.substring(2);
        }
        if (candidate.length() >= 2 && candidate.startsWith("\"") && candidate.endsWith("\"")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (candidate.isEmpty() || !candidate.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ETag(Long.parseLong(candidate)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public StreamVersion version() {
        return StreamVersion.of(value);
    }

    public boolean matches(StreamVersion version) {
        return version != null && value == version.longValue();
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
