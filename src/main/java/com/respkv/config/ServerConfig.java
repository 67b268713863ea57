package com.respkv.config;

import com.respkv.core.AbstractStorageEngine;
import com.respkv.core.StorageEngines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the RespKV server.
 *
 * Defaults can be overridden from the environment ({@code RESPKV_*}
 * variables) or from system properties ({@code respkv.*}); environment
 * variables win. Command line flags are applied on top by the caller.
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 6379;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String storage = StorageEngines.VOLATILE;
    private long sweepIntervalMs = AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS;

    /**
     * Create a config with built-in defaults only.
     */
    public ServerConfig() {
    }

    /**
     * Create a config from the process environment and system properties.
     */
    public static ServerConfig load() {
        return load(System.getenv(), System.getProperties());
    }

    /**
     * Create a config from the given environment and properties.
     */
    public static ServerConfig load(Map<String, String> env, Properties props) {
        ServerConfig config = new ServerConfig();

        String host = lookup(env, props, "RESPKV_HOST", "respkv.host");
        if (host != null) {
            config.setHost(host);
        }
        String storage = lookup(env, props, "RESPKV_STORAGE", "respkv.storage");
        if (storage != null) {
            config.setStorage(storage);
        }
        String port = lookup(env, props, "RESPKV_PORT", "respkv.port");
        if (port != null) {
            try {
                config.setPort(Integer.parseInt(port));
                logger.info("Using port={} from configuration", config.getPort());
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid port value: {}, using default", port);
            }
        }
        String sweep = lookup(env, props, "RESPKV_SWEEP_INTERVAL_MS", "respkv.sweep.interval.ms");
        if (sweep != null) {
            try {
                config.setSweepIntervalMs(Long.parseLong(sweep));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid sweep interval value: {}, using default", sweep);
            }
        }
        return config;
    }

    private static String lookup(Map<String, String> env, Properties props, String envKey, String propKey) {
        String value = env.get(envKey);
        if (value == null || value.isEmpty()) {
            value = props.getProperty(propKey);
        }
        return value != null && !value.isEmpty() ? value.trim() : null;
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be empty");
        }
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    /**
     * @param port 1-65535, or 0 for an ephemeral port
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        this.port = port;
    }

    public String getStorage() {
        return storage;
    }

    /**
     * @param storage "volatile", or the path of the SQLite data file
     */
    public void setStorage(String storage) {
        if (storage == null || storage.isBlank()) {
            throw new IllegalArgumentException("storage cannot be empty");
        }
        this.storage = storage;
    }

    public boolean isVolatileStorage() {
        return StorageEngines.isVolatile(storage);
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException("sweepIntervalMs must be positive, got: " + sweepIntervalMs);
        }
        this.sweepIntervalMs = sweepIntervalMs;
    }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port
                + ", storage=" + storage + ", sweepIntervalMs=" + sweepIntervalMs + "}";
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private final ServerConfig config = new ServerConfig();

        public Builder host(String host) {
            config.setHost(host);
            return this;
        }

        public Builder port(int port) {
            config.setPort(port);
            return this;
        }

        public Builder storage(String storage) {
            config.setStorage(storage);
            return this;
        }

        public Builder sweepIntervalMs(long sweepIntervalMs) {
            config.setSweepIntervalMs(sweepIntervalMs);
            return this;
        }

        public ServerConfig build() {
            return config;
        }
    }
}
