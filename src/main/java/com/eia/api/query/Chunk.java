package com.eia.api.query;

/**
 * One contiguous slice of a query's range, tagged with its position in the plan.
 */
public final class Chunk {

    private final int index;
    private final TimeRange range;

    public Chunk(int index, TimeRange range) {
        this.index = index;
        this.range = range;
    }

    public int getIndex() {
        return index;
    }

    public TimeRange getRange() {
        return range;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Chunk)) {
            return false;
        }
        Chunk other = (Chunk) o;
        return index == other.index && range.equals(other.range);
    }

    @Override
    public int hashCode() {
        return 31 * index + range.hashCode();
    }

    @Override
    public String toString() {
        return "Chunk#" + index + range;
    }
}
