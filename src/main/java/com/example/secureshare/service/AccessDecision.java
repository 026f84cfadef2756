package com.example.secureshare.service;

import com.example.secureshare.entity.FileEntity;

/**
 * Result of evaluating a retrieval attempt against a shared link.
 */
public final class AccessDecision {

    public enum Outcome {
        GRANTED,
        /** Link missing, expired, or addressed to someone else. */
        NOT_FOUND,
        WRONG_PASSWORD
    }

    private static final AccessDecision NOT_FOUND = new AccessDecision(Outcome.NOT_FOUND, null);
    private static final AccessDecision WRONG_PASSWORD = new AccessDecision(Outcome.WRONG_PASSWORD, null);

    private final Outcome outcome;
    private final FileEntity file;

    private AccessDecision(Outcome outcome, FileEntity file) {
        this.outcome = outcome;
        this.file = file;
    }

    public static AccessDecision granted(FileEntity file) {
        return new AccessDecision(Outcome.GRANTED, file);
    }

    public static AccessDecision notFound() {
        return NOT_FOUND;
    }

    public static AccessDecision wrongPassword() {
        return WRONG_PASSWORD;
    }

    public Outcome getOutcome() { return outcome; }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }

    /**
     * The file to hand out; only present when access was granted.
     */
    public FileEntity getFile() {
        if (file == null) {
            throw new IllegalStateException("No file for outcome " + outcome);
        }
        return file;
    }
}
