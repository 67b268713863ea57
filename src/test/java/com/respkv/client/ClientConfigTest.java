package com.respkv.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClientConfigTest {

    @Test
    void builder_defaultValues() {
        ClientConfig config = ClientConfig.builder().build();

        assertThat(config.getConnectTimeoutMs()).isEqualTo(5000);
        assertThat(config.getReadTimeoutMs()).isEqualTo(30000);
    }

    @Test
    void builder_customTimeouts() {
        ClientConfig config = ClientConfig.builder()
            .connectTimeoutMs(3000)
            .readTimeoutMs(15000)
            .build();

        assertThat(config.getConnectTimeoutMs()).isEqualTo(3000);
        assertThat(config.getReadTimeoutMs()).isEqualTo(15000);
    }

    @Test
    void setters_rejectNonPositiveTimeouts() {
        ClientConfig config = new ClientConfig();

        assertThatThrownBy(() -> config.setConnectTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectTimeoutMs");
        assertThatThrownBy(() -> config.setReadTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("readTimeoutMs");
    }
}
