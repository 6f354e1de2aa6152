package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.common.tenant.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CommandFailuresTest {
    private static final TenantId TENANT = TenantId.of("acme");
    private static final StreamId STREAM = StreamId.of("book-1");

    @Test
    void maps_failures_to_http_status_codes() {
        assertThat(CommandFailures.httpStatusOf(new PreconditionFailedException(TENANT, STREAM, "\"1\"", Optional.of(StreamVersion.of(2))))).isEqualTo(412);
        assertThat(CommandFailures.httpStatusOf(new ConcurrencyConflictException(TENANT, STREAM, StreamVersion.of(1), Optional.empty()))).isEqualTo(412);
        assertThat(CommandFailures.httpStatusOf(new PreconditionRequiredException(TENANT, STREAM))).isEqualTo(428);
        assertThat(CommandFailures.httpStatusOf(new ValidationFailedException(TENANT, STREAM, ValidationFailure.invalid("title", "Title is required")))).isEqualTo(400);
        assertThat(CommandFailures.httpStatusOf(new ValidationFailedException(TENANT, STREAM, ValidationFailure.notFound("Book not found")))).isEqualTo(404);
        assertThat(CommandFailures.httpStatusOf(new ValidationFailedException(TENANT, STREAM, ValidationFailure.conflict("Book is deleted")))).isEqualTo(409);
        assertThat(CommandFailures.httpStatusOf(new MissingTenantException("No tenant"))).isEqualTo(400);
        assertThat(CommandFailures.httpStatusOf(InvalidTenantException.unknownTenant(TENANT))).isEqualTo(400);
        assertThat(CommandFailures.httpStatusOf(new CommandTimeoutException("AddBook", Duration.ofSeconds(30)))).isEqualTo(503);
        assertThat(CommandFailures.httpStatusOf(new IllegalStateException("boom"))).isEqualTo(500);
    }

    @Test
    void conflicts_carry_the_refresh_and_retry_message() {
        assertThat(CommandFailures.userMessageOf(new ConcurrencyConflictException(TENANT, STREAM, StreamVersion.of(1), Optional.empty())))
                .isEqualTo("The resource has been modified since you last retrieved it. Please refresh and try again.");
        assertThat(CommandFailures.userMessageOf(new IllegalStateException("internal detail"))).isEqualTo("An unexpected error occurred");
    }
}
