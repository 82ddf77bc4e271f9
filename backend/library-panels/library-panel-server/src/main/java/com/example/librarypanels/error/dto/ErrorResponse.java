package com.example.librarypanels.error.dto;

import com.example.librarypanels.error.ErrorCode;
import com.example.librarypanels.error.exception.BaseException;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

    /** Business failures carry the formatted message, e.g. the uid that was not found. */
    public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
        return toResponseEntity(e.getErrorCode(), e.getMessage());
    }

    /** Unexpected failures only expose the generic message of the code. */
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return toResponseEntity(errorCode, errorCode.getMessage());
    }

    private static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String message) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(new ErrorResponse(
                        errorCode.getStatus().value(),
                        errorCode.getCode(),
                        message,
                        LocalDateTime.now()));
    }
}
