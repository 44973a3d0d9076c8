package com.eia.api.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Value of a single facet: either one string or an ordered list of strings.
 * Anything else is rejected by {@link #of(Object)}.
 */
public abstract class FacetValue {

    private FacetValue() {
    }

    /**
     * Values in the order they are sent on the wire.
     */
    public abstract List<String> values();

    public static FacetValue single(String value) {
        return new Single(value);
    }

    public static FacetValue multiple(List<String> values) {
        return new Multiple(values);
    }

    public static FacetValue multiple(String... values) {
        return new Multiple(List.of(values));
    }

    /**
     * Convert a loosely typed value (as read from a map or config) into a facet value.
     *
     * @throws InvalidArgumentException if the value is neither a string nor a list of strings
     */
    public static FacetValue of(Object raw) {
        if (raw instanceof FacetValue) {
            return (FacetValue) raw;
        }
        if (raw instanceof String) {
            return new Single((String) raw);
        }
        if (raw instanceof List) {
            List<?> list = (List<?>) raw;
            List<String> values = new ArrayList<>(list.size());
            for (Object element : list) {
                if (!(element instanceof String)) {
                    throw new InvalidArgumentException("Facet list elements must be strings, got: "
                            + (element == null ? "null" : element.getClass().getSimpleName()));
                }
                values.add((String) element);
            }
            return new Multiple(values);
        }
        throw new InvalidArgumentException("Facet value must be a string or a list of strings, got: "
                + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    public static final class Single extends FacetValue {

        private final String value;

        Single(String value) {
            if (value == null) {
                throw new InvalidArgumentException("Facet value must not be null");
            }
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public List<String> values() {
            return Collections.singletonList(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Single && value.equals(((Single) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value;
        }
    }

    public static final class Multiple extends FacetValue {

        private final List<String> values;

        Multiple(List<String> values) {
            if (values == null) {
                throw new InvalidArgumentException("Facet values must not be null");
            }
            for (String value : values) {
                if (value == null) {
                    throw new InvalidArgumentException("Facet values must not contain null");
                }
            }
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public List<String> values() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Multiple && values.equals(((Multiple) o).values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(values);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
