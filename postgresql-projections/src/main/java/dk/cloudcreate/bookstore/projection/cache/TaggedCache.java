package dk.cloudcreate.bookstore.projection.cache;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-through cache whose entries carry tags. Invalidating a tag evicts every entry carrying it.<br>
 * An entry computed while one of its tags is invalidated is returned to the caller but never cached, so a concurrent
 * invalidation can't be overwritten by a value read before it.
 */
public interface TaggedCache {
    /**
     * @param key     cache key
     * @param factory computes the value on a miss (may return null, which is cached as well)
     * @param tags    the tags of the entry
     * @param ttl     time to live of the entry
     */
    <T> T getOrCreate(String key, Supplier<T> factory, Set<String> tags, Duration ttl);

    void invalidateByTag(String tag);

    void invalidateAll();
}
