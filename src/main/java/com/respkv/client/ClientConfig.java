package com.respkv.client;

/**
 * Configuration for the RespKV client.
 */
public class ClientConfig {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;

    public ClientConfig() {
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got: " + connectTimeoutMs);
        }
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("readTimeoutMs must be positive, got: " + readTimeoutMs);
        }
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private final ClientConfig config = new ClientConfig();

        public Builder connectTimeoutMs(int ms) {
            config.setConnectTimeoutMs(ms);
            return this;
        }

        public Builder readTimeoutMs(int ms) {
            config.setReadTimeoutMs(ms);
            return this;
        }

        public ClientConfig build() {
            return config;
        }
    }
}
