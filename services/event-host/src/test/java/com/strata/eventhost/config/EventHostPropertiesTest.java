package com.strata.eventhost.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.strata.subscription.SubscriptionOptions;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventHostProperties")
class EventHostPropertiesTest {

    @Test
    @DisplayName("defaults optional fields")
    void defaultsOptionalFields() {
        var props = new EventHostProperties("orders-host", null, 0, null);

        assertThat(props.migrateOnStartup()).isTrue();
        assertThat(props.readPageSize()).isEqualTo(EventHostProperties.DEFAULT_READ_PAGE_SIZE);
        assertThat(props.subscription().enabled()).isTrue();
        assertThat(props.subscription().id()).isEqualTo("default");
    }

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var subscription = new EventHostProperties.Subscription(
                false, "billing", 50, Duration.ofMillis(5), 5, Duration.ofMillis(200), Duration.ZERO, 99);
        var props = new EventHostProperties("orders-host", false, 25, subscription);

        assertThat(props.migrateOnStartup()).isFalse();
        assertThat(props.readPageSize()).isEqualTo(25);
        assertThat(props.subscription()).isEqualTo(subscription);
    }

    @Nested
    @DisplayName("Subscription")
    class SubscriptionSettings {

        @Test
        @DisplayName("defaults to three delivery attempts and a one second jittered resubscribe delay")
        void defaults() {
            var subscription = new EventHostProperties.Subscription(null, " ", 0, null, 0, null, null, 0);

            assertThat(subscription.batchSize()).isEqualTo(500);
            assertThat(subscription.idleInterval()).isEqualTo(Duration.ofMillis(100));
            assertThat(subscription.retryAttempts()).isEqualTo(3);
            assertThat(subscription.resubscribeDelay()).isEqualTo(Duration.ofSeconds(1));
            assertThat(subscription.resubscribeJitter()).isEqualTo(Duration.ofSeconds(1));
            assertThat(subscription.maxLag()).isEqualTo(SubscriptionOptions.DEFAULT_MAX_LAG);
        }

        @Test
        @DisplayName("converts to worker options")
        void toOptions() {
            var subscription = new EventHostProperties.Subscription(
                    true, "billing", 50, Duration.ofMillis(5), 4, Duration.ofMillis(200), Duration.ZERO, 99);

            SubscriptionOptions options = subscription.toOptions();

            assertThat(options.subscriptionId()).isEqualTo("billing");
            assertThat(options.polling().batchSize()).isEqualTo(50);
            assertThat(options.polling().idleInterval()).isEqualTo(Duration.ofMillis(5));
            assertThat(options.deliveryRetry().maxAttempts()).isEqualTo(4);
            assertThat(options.resubscribeBackoff().nextDelay(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(options.maxLag()).isEqualTo(99);
        }
    }
}
