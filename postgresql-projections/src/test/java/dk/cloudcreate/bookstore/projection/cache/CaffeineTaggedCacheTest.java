package dk.cloudcreate.bookstore.projection.cache;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CaffeineTaggedCacheTest {
    private static final Duration TTL = Duration.ofMinutes(1);

    private CaffeineTaggedCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineTaggedCache(1_000, Duration.ofMinutes(5));
    }

    @Test
    void values_are_computed_once_until_a_tag_is_invalidated() {
        // Given
        var computations = new AtomicInteger();

        // When
        var first  = cache.getOrCreate("book:1", () -> "v" + computations.incrementAndGet(), Set.of("acme:book:1", "acme:books"), TTL);
        var second = cache.getOrCreate("book:1", () -> "v" + computations.incrementAndGet(), Set.of("acme:book:1", "acme:books"), TTL);
        cache.invalidateByTag("acme:books");
        var third = cache.getOrCreate("book:1", () -> "v" + computations.incrementAndGet(), Set.of("acme:book:1", "acme:books"), TTL);

        // Then
        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(third).isEqualTo("v2");
    }

    @Test
    void invalidating_a_tag_leaves_entries_without_that_tag_alone() {
        // Given
        cache.getOrCreate("acme-book", () -> "acme", Set.of("acme:book:1"), TTL);
        cache.getOrCreate("globex-book", () -> "globex", Set.of("globex:book:1"), TTL);

        // When
        cache.invalidateByTag("acme:book:1");

        // Then
        assertThat((String) cache.getOrCreate("globex-book", () -> "recomputed", Set.of("globex:book:1"), TTL)).isEqualTo("globex");
        assertThat((String) cache.getOrCreate("acme-book", () -> "recomputed", Set.of("acme:book:1"), TTL)).isEqualTo("recomputed");
    }

    @Test
    void a_value_computed_while_its_tag_is_invalidated_is_not_cached() {
        // Given a read that races with an invalidation
        var stale = cache.getOrCreate("book:1", () -> {
            cache.invalidateByTag("acme:book:1");
            return "stale";
        }, Set.of("acme:book:1"), TTL);

        // When
        var next = cache.getOrCreate("book:1", () -> "fresh", Set.of("acme:book:1"), TTL);

        // Then
        assertThat(stale).isEqualTo("stale");
        assertThat(next).isEqualTo("fresh");
    }

    @Test
    void null_values_are_cached() {
        // Given
        var computations = new AtomicInteger();

        // When
        cache.getOrCreate("missing", () -> {
            computations.incrementAndGet();
            return null;
        }, Set.of("acme:book:missing"), TTL);
        Object second = cache.getOrCreate("missing", () -> {
            computations.incrementAndGet();
            return null;
        }, Set.of("acme:book:missing"), TTL);

        // Then
        assertThat(second).isNull();
        assertThat(computations).hasValue(1);
    }

    @Test
    void ttl_above_the_maximum_is_rejected() {
        assertThatThrownBy(() -> cache.getOrCreate("key", () -> "value", Set.of(), Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
