package com.ietfdata.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClientSettings")
class ClientSettingsTest {

    @Test
    @DisplayName("defaults point at the public service")
    void defaults() {
        var settings = ClientSettings.defaults();

        assertThat(settings.baseUrl()).isEqualTo("https://datatracker.ietf.org");
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.pageSize()).isEqualTo(100);
        assertThat(settings.maxPages()).isEqualTo(10_000);
        assertThat(settings.apiKey()).isNull();
    }

    @Test
    @DisplayName("a trailing slash on the base URL is dropped")
    void stripsSlash() {
        assertThat(ClientSettings.defaults().withBaseUrl("https://dt.example.org/").baseUrl())
                .isEqualTo("https://dt.example.org");
    }

    @Test
    @DisplayName("invalid values are rejected")
    void rejectsInvalid() {
        assertThatThrownBy(() -> ClientSettings.defaults().withBaseUrl("ftp://dt.example.org"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientSettings.defaults().withBaseUrl("https://dt.example.org/api"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientSettings.defaults().withPageSize(5000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientSettings.defaults().withMaxPages(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClientSettings(null, Duration.ZERO, 0, 0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString() hides the API key")
    void hidesApiKey() {
        assertThat(ClientSettings.defaults().withApiKey("s3cret").toString()).doesNotContain("s3cret");
    }
}
