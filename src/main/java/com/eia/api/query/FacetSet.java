package com.eia.api.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Immutable, insertion ordered mapping of facet name to facet value.
 */
public final class FacetSet {

    private static final FacetSet EMPTY = new FacetSet(Collections.emptyMap());

    private final Map<String, FacetValue> facets;

    private FacetSet(Map<String, FacetValue> facets) {
        this.facets = facets;
    }

    public static FacetSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build from a map whose values are strings or lists of strings. A null map yields
     * the empty set.
     */
    public static FacetSet fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            builder.facet(entry.getKey(), FacetValue.of(entry.getValue()));
        }
        return builder.build();
    }

    public Map<String, FacetValue> asMap() {
        return facets;
    }

    public boolean isEmpty() {
        return facets.isEmpty();
    }

    public int size() {
        return facets.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FacetSet && facets.equals(((FacetSet) o).facets);
    }

    @Override
    public int hashCode() {
        return facets.hashCode();
    }

    @Override
    public String toString() {
        return facets.toString();
    }

    public static final class Builder {

        private final Map<String, FacetValue> facets = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder facet(String name, String value) {
            return facet(name, FacetValue.single(value));
        }

        public Builder facet(String name, String... values) {
            return facet(name, FacetValue.multiple(values));
        }

        public Builder facet(String name, FacetValue value) {
            if (name == null || name.trim().isEmpty()) {
                throw new InvalidArgumentException("Facet name must not be blank");
            }
            if (value == null) {
                throw new InvalidArgumentException("Facet '" + name + "' has no value");
            }
            facets.put(name, value);
            return this;
        }

        public FacetSet build() {
            if (facets.isEmpty()) {
                return EMPTY;
            }
            return new FacetSet(Collections.unmodifiableMap(new LinkedHashMap<>(facets)));
        }
    }
}
