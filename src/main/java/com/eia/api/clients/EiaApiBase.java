package com.eia.api.clients;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.eia.api.exceptions.TransportFailureException;
import com.eia.api.exceptions.TypeMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * HTTP transport for the EIA API: issues GET requests through Spring's
 * {@link RestClient} backed by Apache HttpClient 5, attaches the api key, logs
 * requests and extracts the {@code response.data} rows.
 */
public class EiaApiBase implements EiaTransport, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(EiaApiBase.class);
    private static final Logger requestLogger = LoggerFactory.getLogger("EiaRequestLogger");

    public static final String ACCEPT_JSON = "application/json";
    public static final String API_KEY_PARAM = "api_key";

    private final CloseableHttpClient httpClient;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final AtomicInteger totalRequests = new AtomicInteger();
    private final AtomicInteger failedRequests = new AtomicInteger();
    private final DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    private volatile int debugLevel;

    public EiaApiBase() {
        this(0, 8);
    }

    /**
     * @param debugLevel     request logging verbosity, 0..3
     * @param maxConnections upper bound on pooled connections, matched to the fetch concurrency
     */
    public EiaApiBase(int debugLevel, int maxConnections) {
        this(createHttpClient(maxConnections), null, debugLevel);
    }

    /**
     * Build on a caller supplied {@link RestClient.Builder}, e.g. one bound to a mock server.
     */
    public EiaApiBase(RestClient.Builder restClientBuilder, int debugLevel) {
        this(null, restClientBuilder, debugLevel);
    }

    private EiaApiBase(CloseableHttpClient httpClient, RestClient.Builder restClientBuilder, int debugLevel) {
        this.httpClient = httpClient;
        RestClient.Builder builder = restClientBuilder != null ? restClientBuilder
                : RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
        this.restClient = builder.build();
        this.objectMapper = new ObjectMapper();
        this.debugLevel = clampDebugLevel(debugLevel);

        logger.info("EIA API base client initialized with debug level {}", this.debugLevel);
    }

    private static CloseableHttpClient createHttpClient(int maxConnections) {
        int poolSize = Math.max(1, maxConnections);
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(poolSize)
                .setMaxConnPerRoute(poolSize)
                .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .build();
    }

    /**
     * Releases the pooled connections. Only the HTTP client created by this
     * instance is closed; a caller supplied builder stays the caller's.
     */
    @Override
    public void close() throws IOException {
        if (httpClient != null) {
            httpClient.close();
            logger.debug("EIA API connection pool closed");
        }
    }

    @Override
    public List<Map<String, Object>> getRows(String url, String apiKey) {
        String responseBody = getResponseBody(url, apiKey);
        return extractData(responseBody, url);
    }

    /**
     * Core HTTP GET. The credential is appended here and never logged.
     */
    protected String getResponseBody(String url, String apiKey) {
        int requestNum = logRequest(url);

        try {
            long startTime = System.currentTimeMillis();
            String response = restClient.method(HttpMethod.GET)
                    .uri(URI.create(withApiKey(url, apiKey)))
                    .header("Accept", ACCEPT_JSON)
                    .retrieve()
                    .body(String.class);
            long endTime = System.currentTimeMillis();

            if (debugLevel >= 2) {
                requestLogger.debug("Response time: {} ms for request #{}", (endTime - startTime), requestNum);
            }
            return response;
        } catch (RestClientResponseException e) {
            failedRequests.incrementAndGet();
            requestLogger.error("Request failed: {} - HTTP {}", url, e.getStatusCode().value());
            throw new TransportFailureException("HTTP " + e.getStatusCode().value() + " from EIA API",
                    e.getStatusCode().value(), url, e);
        } catch (ResourceAccessException e) {
            failedRequests.incrementAndGet();
            requestLogger.error("Request failed: {} - {}", url, e.getMessage());
            throw new TransportFailureException("I/O error calling EIA API: " + e.getMessage(),
                    TransportFailureException.NO_STATUS, url, e);
        } catch (RestClientException e) {
            failedRequests.incrementAndGet();
            requestLogger.error("Request failed: {} - {}", url, e.getMessage());
            throw new TransportFailureException("EIA API request failed: " + e.getMessage(),
                    TransportFailureException.NO_STATUS, url, e);
        }
    }

    /**
     * Extract the {@code response.data} array from a response body.
     */
    @SuppressWarnings("unchecked")
    protected List<Map<String, Object>> extractData(String responseBody, String url) {
        if (responseBody == null || responseBody.isEmpty()) {
            throw new TypeMismatchException("Empty response body from " + url, "response", responseBody);
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode data = root.path("response").path("data");
            if (!data.isArray()) {
                throw new TypeMismatchException("Response from " + url + " has no response.data array",
                        "response.data", data.isMissingNode() ? null : data.toString());
            }
            List<Map<String, Object>> rows = objectMapper.convertValue(data, List.class);
            return rows == null ? Collections.emptyList() : rows;
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response from {}: {}", url, e.getOriginalMessage());
            throw new TypeMismatchException("Failed to parse JSON response from " + url, "response", null, e);
        }
    }

    static String withApiKey(String url, String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return url;
        }
        char separator = url.indexOf('?') >= 0 ? '&' : '?';
        return url + separator + API_KEY_PARAM + "=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
    }

    private int logRequest(String url) {
        String endpoint = extractEndpoint(url);
        int requestNum = totalRequests.incrementAndGet();
        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();

        if (debugLevel >= 1) {
            String time = LocalDateTime.now().format(timeFormat);
            requestLogger.debug("[{}] Request #{}: {}", time, requestNum, endpoint);
        }
        if (debugLevel >= 2) {
            requestLogger.debug("Full URL: {}", url);
        }
        return requestNum;
    }

    private static String extractEndpoint(String url) {
        String endpoint = url;
        int schemeIndex = endpoint.indexOf("://");
        if (schemeIndex > 0) {
            int pathIndex = endpoint.indexOf('/', schemeIndex + 3);
            endpoint = pathIndex > 0 ? endpoint.substring(pathIndex) : "/";
        }
        int queryIndex = endpoint.indexOf('?');
        if (queryIndex > 0) {
            endpoint = endpoint.substring(0, queryIndex);
        }
        return endpoint;
    }

    private static int clampDebugLevel(int level) {
        return Math.max(0, Math.min(3, level));
    }

    public void setDebugLevel(int level) {
        this.debugLevel = clampDebugLevel(level);
        logger.info("Debug level set to {}", this.debugLevel);
    }

    public int getDebugLevel() {
        return debugLevel;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Map<String, Object> getApiStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRequests", totalRequests.get());
        stats.put("failedRequests", failedRequests.get());

        Map<String, Integer> endpointStats = new HashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpointStats.put(endpoint, count.get()));
        stats.put("endpointStats", endpointStats);
        return stats;
    }
}
