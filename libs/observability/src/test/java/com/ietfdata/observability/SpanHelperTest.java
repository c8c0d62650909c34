package com.ietfdata.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly for reliable span collection.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should create a CLIENT span with attributes and return the result")
    void shouldCreateClientSpan() {
        String result = spanHelper.withClientSpan("datatracker.fetch",
                Map.of("http.path", "/api/v1/person/person/1/"), () -> "body");

        assertThat(result).isEqualTo("body");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo("datatracker.fetch");
        assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("http.path")))
                .isEqualTo("/api/v1/person/person/1/");
    }

    @Test
    @DisplayName("should record the error and rethrow the same exception")
    void shouldRecordError() {
        var failure = new IllegalStateException("service unavailable");

        assertThatThrownBy(() -> spanHelper.withSpan("failing", SpanKind.INTERNAL, Map.of(), () -> {
            throw failure;
        })).isSameAs(failure);

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).contains("service unavailable");
        assertThat(span.getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("should attach the correlation context")
    void shouldAttachCorrelationContext() {
        CorrelationContextHolder.set(new CorrelationContext("corr-abc", "resolve", "/api/v1/group/group/1/"));

        spanHelper.withClientSpan("datatracker.fetch", Map.of(), () -> "ok");

        var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attributes.get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-abc");
        assertThat(attributes.get(AttributeKey.stringKey("datatracker.operation"))).isEqualTo("resolve");
        assertThat(attributes.get(AttributeKey.stringKey("datatracker.target")))
                .isEqualTo("/api/v1/group/group/1/");
    }

    @Test
    @DisplayName("noop() should run the work without recording")
    void noopRunsWork() {
        assertThat(SpanHelper.noop().withClientSpan("x", Map.of(), () -> 42)).isEqualTo(42);
        assertThat(spanExporter.getFinishedSpanItems()).isEmpty();
    }
}
