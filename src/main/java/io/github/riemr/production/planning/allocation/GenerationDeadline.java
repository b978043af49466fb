package io.github.riemr.production.planning.allocation;

import io.github.riemr.production.domain.exception.GenerationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 生成処理の打ち切り期限。ループの各反復で {@link #check()} を呼ぶ。
 */
public final class GenerationDeadline {
    private final Clock clock;
    private final Instant expiresAt;
    private final Duration timeout;

    private GenerationDeadline(Clock clock, Instant expiresAt, Duration timeout) {
        this.clock = clock;
        this.expiresAt = expiresAt;
        this.timeout = timeout;
    }

    public static GenerationDeadline after(Duration timeout, Clock clock) {
        return new GenerationDeadline(clock, clock.instant().plus(timeout), timeout);
    }

    public static GenerationDeadline none() {
        return new GenerationDeadline(null, null, null);
    }

    public void check() {
        if (expiresAt != null && clock.instant().isAfter(expiresAt)) {
            throw new GenerationTimeoutException("Schedule generation exceeded " + timeout);
        }
    }
}
