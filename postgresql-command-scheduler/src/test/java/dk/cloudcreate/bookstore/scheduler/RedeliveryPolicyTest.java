package dk.cloudcreate.bookstore.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RedeliveryPolicyTest {
    @Test
    void fixed_backoff_always_uses_the_same_delay() {
        var policy = RedeliveryPolicy.fixedBackoff(Duration.ofSeconds(10), 3);

        assertThat(policy.calculateNextRedeliveryDelay(0)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.calculateNextRedeliveryDelay(2)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void linear_backoff_grows_by_the_initial_delay_until_the_maximum() {
        var policy = RedeliveryPolicy.linearBackoff(Duration.ofSeconds(10), Duration.ofSeconds(35), 5);

        assertThat(policy.calculateNextRedeliveryDelay(0)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.calculateNextRedeliveryDelay(1)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.calculateNextRedeliveryDelay(2)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.calculateNextRedeliveryDelay(3)).isEqualTo(Duration.ofSeconds(35));
    }

    @Test
    void exponential_backoff_multiplies_the_delay_until_the_maximum() {
        var policy = RedeliveryPolicy.exponentialBackoff(Duration.ofSeconds(1), 2.0d, Duration.ofSeconds(10), 5);

        assertThat(policy.calculateNextRedeliveryDelay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.calculateNextRedeliveryDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.calculateNextRedeliveryDelay(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.calculateNextRedeliveryDelay(4)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.calculateNextRedeliveryDelay(60)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void the_policy_is_exhausted_after_the_initial_dispatch_and_the_maximum_number_of_redeliveries() {
        var policy = RedeliveryPolicy.fixedBackoff(Duration.ofSeconds(1), 2);

        assertThat(policy.isExhausted(2)).isFalse();
        assertThat(policy.isExhausted(3)).isTrue();
    }

    @Test
    void a_maximum_delay_below_the_initial_delay_is_rejected() {
        assertThatThrownBy(() -> RedeliveryPolicy.linearBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
