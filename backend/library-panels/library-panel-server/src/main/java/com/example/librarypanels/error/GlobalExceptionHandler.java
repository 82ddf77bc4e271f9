package com.example.librarypanels.error;

import com.example.librarypanels.error.dto.ErrorResponse;
import com.example.librarypanels.error.exception.BaseException;
import com.example.librarypanels.error.exception.InvalidRequestContextException;
import com.example.librarypanels.error.exception.LibraryPanelInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(LibraryPanelInvariantViolationException.class)
    protected ResponseEntity<ErrorResponse> handleInvariantViolation(LibraryPanelInvariantViolationException e) {
        // Already logged with its context where it was raised.
        return ErrorResponse.toResponseEntity(LibraryPanelErrorCode.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
        log.warn("Business exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    protected ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(new InvalidRequestContextException(e.getMessage()));
    }

    @ExceptionHandler(TransactionTimedOutException.class)
    protected ResponseEntity<ErrorResponse> handleDeadlineExceeded(TransactionTimedOutException e) {
        log.warn("Request deadline exceeded: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(LibraryPanelErrorCode.REQUEST_DEADLINE_EXCEEDED);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected system failure", e);
        return ErrorResponse.toResponseEntity(LibraryPanelErrorCode.INTERNAL_SERVER_ERROR);
    }
}
