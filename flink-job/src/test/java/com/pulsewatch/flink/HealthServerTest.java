package com.pulsewatch.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final HealthServer server = new HealthServer(ready::get);

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should report readiness only once the pipeline is assembled")
    void shouldReportReadiness() throws IOException {
        server.start(0);
        assertThat(server.isRunning()).isTrue();

        assertThat(status("/health")).isEqualTo(200);
        assertThat(status("/readiness")).isEqualTo(503);

        ready.set(true);
        assertThat(status("/readiness")).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject out-of-range ports")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.isRunning()).isFalse();
    }

    private int status(String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection)
                new URL("http://localhost:" + server.boundPort() + path).openConnection();
        try {
            return connection.getResponseCode();
        } finally {
            connection.disconnect();
        }
    }
}
