package com.eia.api.fetch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Untyped rows returned by one chunk request, in response order.
 */
public final class RawRowSet {

    private final int index;
    private final String url;
    private final List<Map<String, Object>> rows;

    public RawRowSet(int index, String url, List<Map<String, Object>> rows) {
        this.index = index;
        this.url = url;
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    public int getIndex() {
        return index;
    }

    public String getUrl() {
        return url;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
