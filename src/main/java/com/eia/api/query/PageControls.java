package com.eia.api.query;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Explicit {@code length} / {@code offset} paging parameters. Either may be absent.
 */
public final class PageControls {

    private static final PageControls NONE = new PageControls(null, null);

    private final Integer length;
    private final Integer offset;

    private PageControls(Integer length, Integer offset) {
        if (length != null && length <= 0) {
            throw new InvalidArgumentException("Page length must be positive, got: " + length);
        }
        if (offset != null && offset < 0) {
            throw new InvalidArgumentException("Page offset must not be negative, got: " + offset);
        }
        this.length = length;
        this.offset = offset;
    }

    public static PageControls none() {
        return NONE;
    }

    public static PageControls of(Integer length, Integer offset) {
        if (length == null && offset == null) {
            return NONE;
        }
        return new PageControls(length, offset);
    }

    public static PageControls length(int length) {
        return new PageControls(length, null);
    }

    public Integer getLength() {
        return length;
    }

    public Integer getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "PageControls[length=" + length + ", offset=" + offset + "]";
    }
}
