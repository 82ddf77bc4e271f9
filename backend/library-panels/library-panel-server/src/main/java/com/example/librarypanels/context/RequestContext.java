package com.example.librarypanels.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Who is calling, on behalf of which organization, and until when the caller is willing to wait.
 * Passed explicitly into every service operation.
 *
 * @param orgId    organization every lookup is scoped to
 * @param userId   actor recorded in the audit columns
 * @param deadline instant after which the unit of work is aborted, or {@code null} for none
 */
public record RequestContext(long orgId, long userId, Instant deadline) {

    public static RequestContext of(long orgId, long userId) {
        return new RequestContext(orgId, userId, null);
    }

    public RequestContext withDeadline(Instant deadline) {
        return new RequestContext(orgId, userId, deadline);
    }

    public RequestContext withTimeout(Duration timeout, Clock clock) {
        return withDeadline(clock.instant().plus(timeout));
    }

    /** Time left until the deadline, empty when the caller set none. May be zero or negative. */
    public Optional<Duration> remaining(Clock clock) {
        if (deadline == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), deadline));
    }
}
