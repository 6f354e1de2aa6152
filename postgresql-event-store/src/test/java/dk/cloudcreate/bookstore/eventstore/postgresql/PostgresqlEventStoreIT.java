package dk.cloudcreate.bookstore.eventstore.postgresql;

import dk.cloudcreate.bookstore.common.transaction.JdbiUnitOfWorkFactory;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.test_data.OrderEvents.*;
import dk.cloudcreate.bookstore.eventstore.test_data.OrderEvents;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresqlEventStoreIT extends AbstractEventStoreTest {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiUnitOfWorkFactory unitOfWorkFactory;
    private PostgresqlEventStore  eventStore;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                                                                  postgreSQLContainer.getUsername(),
                                                                  postgreSQLContainer.getPassword()));
        eventStore = new PostgresqlEventStore(unitOfWorkFactory, OrderEvents.registry());
    }

    @Override
    protected EventStore eventStore() {
        return eventStore;
    }

    @Test
    void append_joins_an_active_unit_of_work_and_is_rolled_back_with_it() {
        // Given
        var orderId = StreamId.of("rolled-back-order");

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventStore.append(ACME, orderId, StreamVersion.NEW_STREAM, List.of(PersistableEvent.of(new OrderPlaced("rolled-back-order", "customer"))));
            throw new IllegalStateException("Simulated failure after append");
        })).isInstanceOf(IllegalStateException.class);

        // Then
        assertThat(eventStore.readStream(ACME, orderId)).isEmpty();
        assertThat(eventStore.currentVersion(ACME, orderId)).isEqualTo(StreamVersion.NEW_STREAM);
    }
}
