package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.eventstore.types.StreamVersion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ETagTest {
    @Test
    void renders_the_stream_version_as_a_quoted_entity_tag() {
        assertThat(ETag.of(StreamVersion.of(3)).toString()).isEqualTo("\"3\"");
    }

    @Test
    void parses_strong_weak_and_unquoted_values() {
        assertThat(ETag.parse("\"3\"")).contains(ETag.of(3));
        assertThat(ETag.parse(" W/\"12\" ")).contains(ETag.of(12));
        assertThat(ETag.parse("7")).contains(ETag.of(7));
    }

    @Test
    void rejects_malformed_values() {
        assertThat(ETag.parse(null)).isEmpty();
        assertThat(ETag.parse("")).isEmpty();
        assertThat(ETag.parse("\"\"")).isEmpty();
        assertThat(ETag.parse("\"abc\"")).isEmpty();
        assertThat(ETag.parse("\"-1\"")).isEmpty();
        assertThat(ETag.parse("\"99999999999999999999999\"")).isEmpty();
    }

    @Test
    void matches_only_the_same_stream_version() {
        var etag = ETag.of(2);
        assertThat(etag.matches(StreamVersion.of(2))).isTrue();
        assertThat(etag.matches(StreamVersion.of(3))).isFalse();
        assertThat(etag.version()).isEqualTo(StreamVersion.of(2));
    }
}
