package com.ietfdata.gateway.infrastructure.web;

import com.ietfdata.model.error.DatatrackerException;
import com.ietfdata.model.error.ErrorKind;
import com.ietfdata.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} bodies.
 *
 * <p>Client failures map by {@link ErrorKind}:
 *
 * <pre>
 * VALIDATION          400
 * NOT_FOUND           404
 * FETCH               502
 * DECODE, INVARIANT_VIOLATION, PAGINATION_LOOP  500
 * </pre>
 *
 * Every body carries {@code kind} (for client failures), {@code timestamp} and, when the request
 * has one, {@code correlationId}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TYPE_BASE = "https://ietfdata.com/errors/";

    @ExceptionHandler(DatatrackerException.class)
    public ProblemDetail handleDatatracker(DatatrackerException ex) {
        HttpStatus status = statusOf(ex.kind());
        if (status.is5xxServerError()) {
            log.error("Datatracker request failed [{}]: {}", ex.kind(), ex.getMessage(), ex);
        } else {
            log.warn("Datatracker request rejected [{}]: {}", ex.kind(), ex.getMessage());
        }
        String detail = ex.kind() == ErrorKind.FETCH ? "The Datatracker service could not be reached" : ex.getMessage();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_BASE + ex.kind().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("kind", ex.kind().name());
        problem.setProperty("retryable", ex.isRetryable());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FETCH -> HttpStatus.BAD_GATEWAY;
            case DECODE, INVARIANT_VIOLATION, PAGINATION_LOOP -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ProblemDetail badRequest(String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Bad Request");
        problem.setType(URI.create(TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
