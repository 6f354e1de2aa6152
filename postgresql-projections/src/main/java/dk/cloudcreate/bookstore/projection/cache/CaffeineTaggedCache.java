package dk.cloudcreate.bookstore.projection.cache;

import com.github.benmanes.caffeine.cache.*;
import org.slf4j.*;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.*;

/**
 * {@link TaggedCache} backed by Caffeine with a time to live per entry.<br>
 * Every computation and invalidation takes a tick from a logical clock. An entry remembers the tick at which its computation
 * started and is only valid if none of its tags was invalidated at a later tick. Invalidation ticks are kept for
 * <code>maximumTtl</code>, the longest time any entry can live.
 */
public class CaffeineTaggedCache implements TaggedCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineTaggedCache.class);

    private final Cache<String, Entry> entries;
    private final Cache<String, Long>  tagInvalidations;
    private final AtomicLong           clock = new AtomicLong();
    private final Duration             maximumTtl;

    public CaffeineTaggedCache(long maximumSize, Duration maximumTtl) {
        checkArgument(maximumSize > 0, "maximumSize must be > 0");
        this.maximumTtl = checkNotNull(maximumTtl, "No maximumTtl provided");
        entries = Caffeine.newBuilder()
                          .maximumSize(maximumSize)
                          .expireAfter(new Expiry<String, Entry>() {
                              @Override
                              public long expireAfterCreate(String key, Entry entry, long currentTime) {
                                  return entry.ttl.toNanos();
                              }

                              @Override
                              public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                                  return entry.ttl.toNanos();
                              }

                              @Override
                              public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                                  return currentDuration;
                              }
                          })
                          .build();
        tagInvalidations = Caffeine.newBuilder()
                                   .expireAfterWrite(maximumTtl)
                                   .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrCreate(String key, Supplier<T> factory, Set<String> tags, Duration ttl) {
        checkNotNull(key, "No key provided");
        checkNotNull(factory, "No factory provided");
        checkNotNull(tags, "No tags provided");
        checkNotNull(ttl, "No ttl provided");
        checkArgument(ttl.compareTo(maximumTtl) <= 0, "ttl %s exceeds the maximum ttl %s", ttl, maximumTtl);

        var existing = entries.getIfPresent(key);
        if (existing != null && isValid(existing)) {
            return (T) existing.value;
        }

        var computedAt = clock.incrementAndGet();
        var entry      = new Entry(factory.get(), Set.copyOf(tags), computedAt, ttl);
        if (isValid(entry)) {
            entries.put(key, entry);
        } else {
            log.trace("Not caching '{}', one of its tags was invalidated while it was computed", key);
        }
        return (T) entry.value;
    }

    @Override
    public void invalidateByTag(String tag) {
        checkNotNull(tag, "No tag provided");
        tagInvalidations.put(tag, clock.incrementAndGet());
        entries.asMap().values().removeIf(entry -> entry.tags.contains(tag));
        log.trace("Invalidated tag '{}'", tag);
    }

    @Override
    public void invalidateAll() {
        entries.invalidateAll();
    }

    public long estimatedSize() {
        return entries.estimatedSize();
    }

    private boolean isValid(Entry entry) {
        for (var tag : entry.tags) {
            var invalidatedAt = tagInvalidations.getIfPresent(tag);
            if (invalidatedAt != null && invalidatedAt > entry.computedAt) {
                return false;
            }
        }
        return true;
    }

    private static final class Entry {
        private final Object      value;
        private final Set<String> tags;
        private final long        computedAt;
        private final Duration    ttl;

        private Entry(Object value, Set<String> tags, long computedAt, Duration ttl) {
            this.value = value;
            this.tags = tags;
            this.computedAt = computedAt;
            this.ttl = ttl;
        }
    }
}
