package com.example.librarypanels.controller;

import com.example.librarypanels.config.LibraryPanelProperties;
import com.example.librarypanels.context.RequestContext;
import com.example.librarypanels.error.exception.InvalidRequestContextException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Builds the {@link RequestContext} from the caller headers. Authentication happens upstream; the
 * headers are trusted as given.
 */
@Component
public class RequestContextResolver {

    public static final String ORG_ID_HEADER = "X-Org-Id";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String REQUEST_TIMEOUT_HEADER = "X-Request-Timeout";

    private final LibraryPanelProperties properties;
    private final Clock clock;

    public RequestContextResolver(LibraryPanelProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param timeout ISO-8601 duration such as {@code PT5S}, or {@code null} for the configured default
     */
    public RequestContext resolve(long orgId, long userId, String timeout) {
        if (orgId <= 0) {
            throw new InvalidRequestContextException(ORG_ID_HEADER + " must be positive");
        }
        return RequestContext.of(orgId, userId).withTimeout(parseTimeout(timeout), clock);
    }

    private Duration parseTimeout(String timeout) {
        if (timeout == null || timeout.isBlank()) {
            return properties.defaultRequestTimeout();
        }
        Duration parsed;
        try {
            parsed = Duration.parse(timeout.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestContextException(REQUEST_TIMEOUT_HEADER + " is not an ISO-8601 duration: " + timeout);
        }
        if (parsed.isNegative() || parsed.isZero()) {
            throw new InvalidRequestContextException(REQUEST_TIMEOUT_HEADER + " must be positive");
        }
        return parsed;
    }
}
