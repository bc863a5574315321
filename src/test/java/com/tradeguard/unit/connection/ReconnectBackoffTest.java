package com.tradeguard.unit.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeguard.connection.ReconnectBackoff;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

    @Test
    @DisplayName("Delay grows by the multiplier and caps at the max")
    void exponentialWithCap() {
        // r = 0.5 puts every delay in the middle of the jitter band
        ReconnectBackoff backoff =
                new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, 0.2, () -> 0.5);

        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.getAttemptCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Jitter spreads the delay within plus or minus the jitter fraction")
    void jitterBand() {
        ReconnectBackoff low = new ReconnectBackoff(Duration.ofSeconds(10), Duration.ofSeconds(60), 2.0, 0.2, () -> 0.0);
        ReconnectBackoff high =
                new ReconnectBackoff(Duration.ofSeconds(10), Duration.ofSeconds(60), 2.0, 0.2, () -> 0.999);

        assertThat(low.nextDelay()).isEqualTo(Duration.ofSeconds(8));
        assertThat(high.nextDelay()).isBetween(Duration.ofMillis(11_990), Duration.ofSeconds(12));
    }

    @Test
    @DisplayName("Reset starts over from the initial delay")
    void reset() {
        ReconnectBackoff backoff =
                new ReconnectBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), 3.0, 0.0, () -> 0.5);
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertThat(backoff.getAttemptCount()).isZero();
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("Invalid settings are refused")
    void invalidSettings() {
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ZERO, Duration.ofSeconds(1), 2.0, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 0.5, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 2.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
