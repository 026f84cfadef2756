package com.example.secureshare.service;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * A 1-indexed page of a listing. Offsets are {@code (page - 1) * pageSize}; a page
 * number below 1 is rejected rather than clamped.
 */
public final class PageWindow {

    private final int page;
    private final int pageSize;

    private PageWindow(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }

    public static PageWindow of(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be at least 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1, got " + pageSize);
        }
        return new PageWindow(page, pageSize);
    }

    public static PageWindow of(int page, int pageSize, int maxPageSize) {
        if (pageSize > maxPageSize) {
            throw new IllegalArgumentException("Page size must not exceed " + maxPageSize + ", got " + pageSize);
        }
        return of(page, pageSize);
    }

    public int getPage() { return page; }

    public int getPageSize() { return pageSize; }

    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }

    /**
     * Ordering lives in the listing queries, so the request carries no sort.
     */
    public Pageable toPageable() {
        return PageRequest.of(page - 1, pageSize);
    }

    @Override
    public String toString() {
        return "PageWindow{page=" + page + ", pageSize=" + pageSize + "}";
    }
}
