package com.example.secureshare.model;

/**
 * Outcome of one retention sweep.
 */
public record ReapResult(int linksDeleted, int filesDeleted) {

    public static final ReapResult NOTHING = new ReapResult(0, 0);

    public boolean isEmpty() {
        return linksDeleted == 0 && filesDeleted == 0;
    }
}
