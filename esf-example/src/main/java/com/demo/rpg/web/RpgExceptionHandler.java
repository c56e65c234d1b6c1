package com.demo.rpg.web;

import com.myorg.esf.contracts.core.exception.AggregateNotFoundException;
import com.myorg.esf.contracts.core.exception.ConcurrencyConflictException;
import com.myorg.esf.contracts.core.exception.EsfNonRetryableException;
import com.myorg.esf.contracts.core.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class RpgExceptionHandler {

    @ExceptionHandler(AggregateNotFoundException.class)
    public ProblemDetail notFound(AggregateNotFoundException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ProblemDetail conflict(ConcurrencyConflictException e) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
        pd.setProperty("expectedVersion", e.getExpectedVersion());
        pd.setProperty("actualVersion", e.getActualVersion());
        return pd;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badRequest(IllegalArgumentException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /** Command refused by the character's current state, e.g. healing a defeated character. */
    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail unprocessable(IllegalStateException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ProblemDetail unavailable(StorageException e) {
        log.error("Event store unavailable", e);
        return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "Event store unavailable");
    }

    @ExceptionHandler(EsfNonRetryableException.class)
    public ProblemDetail nonRetryable(EsfNonRetryableException e) {
        log.error("Non-retryable failure reason={}", e.getReason(), e);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
