package com.ietfdata.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ietfdata.observability.SensitiveDataRedactor;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatatrackerProperties")
class DatatrackerPropertiesTest {

    @Test
    @DisplayName("unset values take the client defaults")
    void defaults() {
        var props = new DatatrackerProperties(null, null, 0, 0, null, null, 0);

        assertThat(props.baseUrl()).isEqualTo("https://datatracker.ietf.org");
        assertThat(props.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.pageSize()).isEqualTo(100);
        assertThat(props.maxPages()).isEqualTo(10_000);
        assertThat(props.maxListResults()).isEqualTo(50);
    }

    @Test
    @DisplayName("converts to ClientSettings, dropping a blank API key")
    void toClientSettings() {
        var settings = new DatatrackerProperties("http://localhost:8000/", Duration.ofSeconds(5), 20, 7, "ua", "", 10)
                .toClientSettings();

        assertThat(settings.baseUrl()).isEqualTo("http://localhost:8000");
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.pageSize()).isEqualTo(20);
        assertThat(settings.maxPages()).isEqualTo(7);
        assertThat(settings.userAgent()).isEqualTo("ua");
        assertThat(settings.apiKey()).isNull();
    }

    @Test
    @DisplayName("redacted() masks the API key for logging and keeps the other values")
    void redacted() {
        var props = new DatatrackerProperties("https://datatracker.ietf.org", Duration.ofSeconds(5), 20, 7, "ua",
                "s3cret", 10);

        assertThat(props.redacted())
                .containsEntry("base-url", "https://datatracker.ietf.org")
                .containsEntry("page-size", 20)
                .containsEntry("api-key", SensitiveDataRedactor.REDACTED)
                .doesNotContainValue("s3cret");
    }

    @Test
    @DisplayName("redacted() leaves an unset API key empty")
    void redactedWithoutKey() {
        assertThat(new DatatrackerProperties(null, null, 0, 0, null, "", 0).redacted()).containsEntry("api-key", null);
    }
}
