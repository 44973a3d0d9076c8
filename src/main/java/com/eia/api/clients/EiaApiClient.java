package com.eia.api.clients;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

import com.eia.api.config.EiaClientConfig;

/**
 * Main entry point for EIA API operations. Wires the HTTP transport and the
 * data client from one {@link EiaClientConfig}. Close it to release the
 * HTTP connection pool.
 */
public class EiaApiClient implements Closeable {

    private final EiaClientConfig config;
    private final EiaApiBase apiBase;
    private final EiaDataClient data;

    public EiaApiClient(EiaClientConfig config) {
        this(config, new EiaApiBase(config.getDebugLevel(), config.getConcurrency()));
    }

    public EiaApiClient(EiaClientConfig config, EiaApiBase apiBase) {
        this.config = config;
        this.apiBase = apiBase;
        this.data = new EiaDataClient(apiBase, config);
    }

    /**
     * Get the time-series data client
     */
    public EiaDataClient data() {
        return data;
    }

    /**
     * Access base functionality (request stats, debug level)
     */
    public EiaApiBase base() {
        return apiBase;
    }

    public EiaClientConfig getConfig() {
        return config;
    }

    public void setDebugLevel(int level) {
        apiBase.setDebugLevel(level);
    }

    public Map<String, Object> getApiStats() {
        return apiBase.getApiStats();
    }

    @Override
    public void close() throws IOException {
        apiBase.close();
    }
}
