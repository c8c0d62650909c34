package com.ietfdata.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ietfdata.model.Person;
import com.ietfdata.model.error.DecodeException;
import com.ietfdata.model.error.ErrorKind;
import com.ietfdata.model.error.FetchException;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.observability.CorrelationContext;
import com.ietfdata.observability.CorrelationContextHolder;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps NOT_FOUND to 404 and keeps the message")
    void notFound() {
        ProblemDetail result = handler.handleDatatracker(new NotFoundException("/api/v1/person/person/1/"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).contains("/api/v1/person/person/1/");
        assertThat(result.getProperties()).containsEntry("kind", "NOT_FOUND").containsKey("timestamp");
    }

    @Test
    @DisplayName("maps FETCH to 502 without leaking transport details")
    void fetch() {
        ProblemDetail result = handler.handleDatatracker(
                FetchException.timeout("/api/v1/doc/document/?apikey=s3cret", new HttpTimeoutException("slow")));

        assertThat(result.getStatus()).isEqualTo(502);
        assertThat(result.getDetail()).doesNotContain("s3cret");
        assertThat(result.getProperties()).containsEntry("retryable", true);
    }

    @Test
    @DisplayName("maps DECODE to 500")
    void decode() {
        ProblemDetail result = handler.handleDatatracker(new DecodeException(
                "/api/v1/person/person/1/", Person.class, new IllegalStateException("bad body")));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getType().toString()).endsWith("/decode");
    }

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    @DisplayName("every kind has a status")
    void everyKindMapped(ErrorKind kind) {
        assertThat(GlobalExceptionHandler.statusOf(kind)).isNotNull();
    }

    @Test
    @DisplayName("includes the request's correlation ID")
    void correlationId() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", "GET", "/api/v1/people/1"));

        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Bad Request");
        assertThat(result.getProperties()).containsEntry("correlationId", "corr-1");
    }

    @Test
    @DisplayName("maps anything else to 500 Internal Server Error")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("something broke");
    }
}
