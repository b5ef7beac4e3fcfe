package com.docfederation.util;

import com.docfederation.exception.ErrorCode;
import com.docfederation.exception.SyncDeadlineExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Deadline")
class DeadlineTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("Reports remaining time and expires on time")
    void expires() {
        Deadline deadline = Deadline.after(Clock.fixed(START, ZoneOffset.UTC), Duration.ofMinutes(10));
        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).isEqualTo(Duration.ofMinutes(10));
        assertThatCode(() -> deadline.check("fetch")).doesNotThrowAnyException();

        Deadline late = Deadline.after(Clock.fixed(START.plusSeconds(601), ZoneOffset.UTC), Duration.ofMinutes(-1));
        assertThat(late.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(() -> late.check("index"))
                .isInstanceOf(SyncDeadlineExceededException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TIMEOUT);
    }
}
