package com.eia.api.clients;

import java.util.List;
import java.util.Map;

import com.eia.api.exceptions.TransportFailureException;

/**
 * Inbound HTTP capability: issue one GET and return the rows of
 * {@code response.data}.
 */
public interface EiaTransport {

    /**
     * @param url    request URL without credential
     * @param apiKey opaque credential attached to the request
     * @return rows in response order, never null
     * @throws TransportFailureException on non-2xx status or connection failure
     */
    List<Map<String, Object>> getRows(String url, String apiKey);
}
