package com.musicbackup.sync;

import java.util.List;

/**
 * One page of a paginated remote listing.
 * @param items Items on this page, nulls already dropped
 * @param offset Offset this page was requested at
 * @param total Total the remote service declares for the whole listing
 * @param nextOffset Offset of the following page, or null when this was the last one
 */
public record Page<T>(List<T> items, int offset, int total, Integer nextOffset) {
    public Page {
        items = Utils.nonNullList(items);
    }

    public boolean hasNext() {
        return nextOffset != null;
    }
}
