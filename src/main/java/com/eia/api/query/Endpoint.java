package com.eia.api.query;

/**
 * Immutable description of one request. Maps 1:1 to the URL returned by
 * {@link #getUrl()}; the credential is attached later by the transport.
 */
public final class Endpoint {

    private final String path;
    private final FacetSet facets;
    private final TimeRange range;
    private final String start;
    private final String end;
    private final Frequency frequency;
    private final PageControls pageControls;
    private final String url;

    Endpoint(String path, FacetSet facets, TimeRange range, String start, String end,
            Frequency frequency, PageControls pageControls, String url) {
        this.path = path;
        this.facets = facets;
        this.range = range;
        this.start = start;
        this.end = end;
        this.frequency = frequency;
        this.pageControls = pageControls;
        this.url = url;
    }

    public String getPath() {
        return path;
    }

    public FacetSet getFacets() {
        return facets;
    }

    /**
     * @return the requested range, or null unless both bounds are present
     */
    public TimeRange getRange() {
        return range;
    }

    /**
     * @return the {@code start} parameter as sent, or null when omitted
     */
    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public PageControls getPageControls() {
        return pageControls;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Endpoint && url.equals(((Endpoint) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }
}
