package com.harvester.core.fetch;

import com.harvester.core.link.ClassifiedLink;

/**
 * Result of fetching one link. Failures are reported here instead of thrown.
 */
public record FetchOutcome(
        ClassifiedLink link,
        Status status,
        int filesWritten,
        int filesFailed,
        String detail
) {
    public enum Status {
        FETCHED,
        EMPTY,
        ALREADY_PROCESSED,
        TRANSPORT_ERROR,
        ACCESS_ERROR,
        STORAGE_ERROR,
        UNEXPECTED_ERROR,
        INTERRUPTED
    }

    public static FetchOutcome fetched(ClassifiedLink link, int written, int failed) {
        return new FetchOutcome(link, Status.FETCHED, written, failed, null);
    }

    public static FetchOutcome empty(ClassifiedLink link, String detail) {
        return new FetchOutcome(link, Status.EMPTY, 0, 0, detail);
    }

    public static FetchOutcome alreadyProcessed(ClassifiedLink link) {
        return new FetchOutcome(link, Status.ALREADY_PROCESSED, 0, 0, null);
    }

    public static FetchOutcome failed(ClassifiedLink link, Status status, String detail) {
        return new FetchOutcome(link, status, 0, 0, detail);
    }

    public static FetchOutcome interrupted(ClassifiedLink link) {
        return new FetchOutcome(link, Status.INTERRUPTED, 0, 0, "interrupted");
    }

    /**
     * True when the link ended in a state that is written to the ledger.
     */
    public boolean isRecorded() {
        return status == Status.FETCHED || status == Status.EMPTY;
    }
}
