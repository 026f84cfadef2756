package com.example.secureshare.model;

import java.util.List;

/**
 * A single page of a listing plus the number of rows across all pages.
 */
public record PagedResult<T>(List<T> items, long totalCount) {

    public PagedResult {
        items = List.copyOf(items);
    }
}
