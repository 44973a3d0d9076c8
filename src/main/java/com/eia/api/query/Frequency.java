package com.eia.api.query;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Frequency label sent as {@code frequency=} and the granularity of its periods.
 */
public enum Frequency {

    HOURLY("hourly", Granularity.HOUR),
    DAILY("daily", Granularity.DAY);

    private final String label;
    private final Granularity granularity;

    Frequency(String label, Granularity granularity) {
        this.label = label;
        this.granularity = granularity;
    }

    public String getLabel() {
        return label;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public static Frequency fromLabel(String label) {
        if (label != null) {
            for (Frequency frequency : values()) {
                if (frequency.label.equalsIgnoreCase(label.trim())) {
                    return frequency;
                }
            }
        }
        throw new InvalidArgumentException("Frequency must be 'hourly' or 'daily', got: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
