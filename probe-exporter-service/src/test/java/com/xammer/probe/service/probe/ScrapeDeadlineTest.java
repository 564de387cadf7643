package com.xammer.probe.service.probe;

import com.xammer.probe.exception.ProbeTimeoutException;
import com.xammer.probe.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeDeadlineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

    @Test
    void remainingShrinksWithTimeAndNeverGoesNegative() {
        ScrapeDeadline deadline = ScrapeDeadline.after(Duration.ofSeconds(10), clock);

        clock.advance(Duration.ofSeconds(4));
        assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(6));
        assertThat(deadline.isExpired()).isFalse();

        clock.advance(Duration.ofSeconds(6));
        assertThat(deadline.isExpired()).isTrue();

        clock.advance(Duration.ofSeconds(5));
        assertThat(deadline.remaining()).isZero();
    }

    @Test
    void cancellationExpiresImmediately() {
        ScrapeDeadline deadline = ScrapeDeadline.after(Duration.ofMinutes(1), clock);

        deadline.cancel();

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isZero();
    }

    @Test
    void checkNotExpiredNamesTheOperation() {
        ScrapeDeadline deadline = ScrapeDeadline.after(Duration.ofSeconds(1), clock);
        assertThatCode(() -> deadline.checkNotExpired("create_keypair")).doesNotThrowAnyException();

        clock.advance(Duration.ofSeconds(1));

        assertThatThrownBy(() -> deadline.checkNotExpired("create_keypair"))
                .isInstanceOf(ProbeTimeoutException.class)
                .hasMessageContaining("create_keypair");
    }
}
