package com.example.librarypanels.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum LibraryPanelErrorCode implements ErrorCode {

    LIBRARY_PANEL_NOT_FOUND("LP001", "library panel could not be found: uid=%s", HttpStatus.NOT_FOUND),
    LIBRARY_PANEL_ALREADY_EXISTS("LP002", "library panel with that uid already exists: uid=%s", HttpStatus.CONFLICT),
    LIBRARY_PANEL_CONNECTION_NOT_FOUND("LP003", "library panel %s is not connected to dashboard %d", HttpStatus.NOT_FOUND),
    LIBRARY_PANEL_INVARIANT_VIOLATION("LP004", "found %d panels for uid=%s, while expecting at most one", HttpStatus.INTERNAL_SERVER_ERROR),

    INVALID_REQUEST_CONTEXT("C001", "invalid request context: %s", HttpStatus.BAD_REQUEST),
    REQUEST_DEADLINE_EXCEEDED("C002", "request deadline exceeded", HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_SERVER_ERROR("C003", "internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
