package com.harvester.core.crawl;

import com.harvester.core.fetch.FetchOutcome;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters of one run, logged as a summary when the run ends.
 */
public class CrawlReport {
    private final Map<FetchOutcome.Status, AtomicInteger> outcomes = new EnumMap<>(FetchOutcome.Status.class);
    private final AtomicInteger filesWritten = new AtomicInteger();
    private final AtomicInteger filesFailed = new AtomicInteger();
    private final AtomicInteger channelsWalked = new AtomicInteger();
    private final AtomicInteger channelsSkipped = new AtomicInteger();
    private final AtomicInteger unrecognisedEntries = new AtomicInteger();

    public CrawlReport() {
        for (FetchOutcome.Status status : FetchOutcome.Status.values()) {
            outcomes.put(status, new AtomicInteger());
        }
    }

    public void record(FetchOutcome outcome) {
        outcomes.get(outcome.status()).incrementAndGet();
        filesWritten.addAndGet(outcome.filesWritten());
        filesFailed.addAndGet(outcome.filesFailed());
    }

    public void recordInterrupted() {
        outcomes.get(FetchOutcome.Status.INTERRUPTED).incrementAndGet();
    }

    public void channelWalked() {
        channelsWalked.incrementAndGet();
    }

    public void channelSkipped() {
        channelsSkipped.incrementAndGet();
    }

    public void unrecognisedEntry() {
        unrecognisedEntries.incrementAndGet();
    }

    public int count(FetchOutcome.Status status) {
        return outcomes.get(status).get();
    }

    public int totalLinks() {
        return outcomes.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int getFilesWritten() {
        return filesWritten.get();
    }

    public int getFilesFailed() {
        return filesFailed.get();
    }

    public int getChannelsWalked() {
        return channelsWalked.get();
    }

    public int getChannelsSkipped() {
        return channelsSkipped.get();
    }

    public int getUnrecognisedEntries() {
        return unrecognisedEntries.get();
    }

    public String summary() {
        return String.format(
                "%d link(s): %d fetched, %d empty, %d already done, %d transport errors, %d access errors, "
                        + "%d storage errors, %d unexpected, %d interrupted | %d file(s) written, %d failed | "
                        + "%d channel(s) walked, %d skipped, %d unrecognised input(s)",
                totalLinks(),
                count(FetchOutcome.Status.FETCHED),
                count(FetchOutcome.Status.EMPTY),
                count(FetchOutcome.Status.ALREADY_PROCESSED),
                count(FetchOutcome.Status.TRANSPORT_ERROR),
                count(FetchOutcome.Status.ACCESS_ERROR),
                count(FetchOutcome.Status.STORAGE_ERROR),
                count(FetchOutcome.Status.UNEXPECTED_ERROR),
                count(FetchOutcome.Status.INTERRUPTED),
                getFilesWritten(), getFilesFailed(),
                getChannelsWalked(), getChannelsSkipped(), getUnrecognisedEntries());
    }

    @Override
    public String toString() {
        return summary();
    }
}
