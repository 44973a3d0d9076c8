package com.eia.api.query;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Serializes a {@link FacetSet} into the API's repeated-key query fragment,
 * {@code facets[name][]=value}, one token per value in insertion order.
 */
public final class FacetEncoder {

    private FacetEncoder() {
    }

    /**
     * @return the fragment without a leading separator, or an empty string for a null
     *         or empty facet set
     */
    public static String encode(FacetSet facets) {
        if (facets == null || facets.isEmpty()) {
            return "";
        }
        StringJoiner fragment = new StringJoiner("&");
        for (Map.Entry<String, FacetValue> entry : facets.asMap().entrySet()) {
            String key = "facets[" + encodeComponent(entry.getKey()) + "][]=";
            for (String value : entry.getValue().values()) {
                fragment.add(key + encodeComponent(value));
            }
        }
        return fragment.toString();
    }

    static String encodeComponent(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }
}
