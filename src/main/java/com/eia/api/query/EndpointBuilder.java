package com.eia.api.query;

import java.time.LocalDateTime;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Composes request URLs of the form
 * {@code <base><path>?data[]=value&facets[..][]=..&start=..&end=..&length=..&offset=..&frequency=..}.
 * Components whose input is absent are omitted entirely. Pure, no I/O.
 */
public class EndpointBuilder {

    public static final String DEFAULT_BASE_URL = "https://api.eia.gov/v2/";
    public static final String VALUE_COLUMN = "value";

    private final String baseUrl;

    public EndpointBuilder() {
        this(DEFAULT_BASE_URL);
    }

    public EndpointBuilder(String baseUrl) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new InvalidArgumentException("Base URL must not be blank");
        }
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Endpoint build(String path, FacetSet facets, TimeRange range, Frequency frequency) {
        return build(path, facets, range, frequency, PageControls.none());
    }

    /**
     * @param path         dataset route, e.g. {@code electricity/rto/region-sub-ba-data/data/}
     * @param facets       facet filter, may be null
     * @param range        start/end bounds, may be null
     * @param frequency    frequency label, may be null
     * @param pageControls explicit length/offset, may be null
     */
    public Endpoint build(String path, FacetSet facets, TimeRange range, Frequency frequency,
            PageControls pageControls) {
        if (range == null) {
            return compose(path, facets, null, null, null, frequency, pageControls);
        }
        return compose(path, facets, range, range.formatStart(), range.formatEnd(), frequency, pageControls);
    }

    /**
     * Open-ended request. Each bound is optional and sent only when present,
     * formatted at the granularity of {@code frequency}.
     *
     * @param start first period, may be null
     * @param end   last period, may be null
     */
    public Endpoint build(String path, FacetSet facets, LocalDateTime start, LocalDateTime end,
            Frequency frequency, PageControls pageControls) {
        if (start == null && end == null) {
            return build(path, facets, (TimeRange) null, frequency, pageControls);
        }
        if (frequency == null) {
            throw new InvalidArgumentException("A frequency is required to format start/end bounds");
        }
        Granularity granularity = frequency.getGranularity();
        if (start != null && end != null) {
            return build(path, facets, TimeRange.of(start, end, granularity), frequency, pageControls);
        }
        String startParam = start == null ? null : granularity.format(granularity.truncate(start));
        String endParam = end == null ? null : granularity.format(granularity.truncate(end));
        return compose(path, facets, null, startParam, endParam, frequency, pageControls);
    }

    private Endpoint compose(String path, FacetSet facets, TimeRange range, String startParam, String endParam,
            Frequency frequency, PageControls pageControls) {
        if (path == null || path.trim().isEmpty()) {
            throw new InvalidArgumentException("API path must not be blank");
        }
        FacetSet effectiveFacets = facets == null ? FacetSet.empty() : facets;
        PageControls effectivePaging = pageControls == null ? PageControls.none() : pageControls;

        String route = path.trim();
        while (route.startsWith("/")) {
            route = route.substring(1);
        }

        StringBuilder url = new StringBuilder(baseUrl).append(route)
                .append("?data[]=").append(VALUE_COLUMN);

        String facetFragment = FacetEncoder.encode(effectiveFacets);
        if (!facetFragment.isEmpty()) {
            url.append('&').append(facetFragment);
        }
        if (startParam != null) {
            url.append("&start=").append(startParam);
        }
        if (endParam != null) {
            url.append("&end=").append(endParam);
        }
        if (effectivePaging.getLength() != null) {
            url.append("&length=").append(effectivePaging.getLength());
        }
        if (effectivePaging.getOffset() != null) {
            url.append("&offset=").append(effectivePaging.getOffset());
        }
        if (frequency != null) {
            url.append("&frequency=").append(frequency.getLabel());
        }

        return new Endpoint(route, effectiveFacets, range, startParam, endParam, frequency, effectivePaging,
                url.toString());
    }

    /**
     * Minimal request covering {@code anchor} and the following period.
     */
    public Endpoint buildProbe(String path, FacetSet facets, LocalDateTime anchor, Frequency frequency) {
        if (anchor == null || frequency == null) {
            throw new InvalidArgumentException("Probe needs an anchor and a frequency");
        }
        Granularity granularity = frequency.getGranularity();
        LocalDateTime start = granularity.truncate(anchor);
        TimeRange probeRange = TimeRange.of(start, granularity.plus(start, 1), granularity);
        return build(path, facets, probeRange, frequency);
    }
}
