package com.harvester.core.fetch;

import com.harvester.core.link.ClassifiedLink;
import com.harvester.core.link.LinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Future;

/**
 * Entry point for fetching one classified link. Every fetch first takes a slot
 * of the link budget and keeps it until the link, images included, is done.
 */
public class ResourceFetcher {
    private static final Logger logger = LoggerFactory.getLogger(ResourceFetcher.class);

    private final PageScraper pageScraper;
    private final ChannelPostFetcher postFetcher;
    private final ConcurrencyBudget linkBudget;
    private final Path downloadRoot;

    public ResourceFetcher(PageScraper pageScraper, ChannelPostFetcher postFetcher,
                           ConcurrencyBudget linkBudget, Path downloadRoot) {
        this.pageScraper = pageScraper;
        this.postFetcher = postFetcher;
        this.linkBudget = linkBudget;
        this.downloadRoot = downloadRoot;
    }

    /**
     * Fetch on the calling thread.
     */
    public FetchOutcome fetch(ClassifiedLink link) {
        try {
            return linkBudget.withPermit(() -> dispatch(link));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.interrupted(link);
        }
    }

    /**
     * Fetch on a worker of the link budget.
     */
    public Future<FetchOutcome> submit(ClassifiedLink link) {
        return linkBudget.submit(() -> dispatch(link));
    }

    private FetchOutcome dispatch(ClassifiedLink link) {
        FetchTarget target = new FetchTarget(link, downloadRoot);
        try {
            if (link.kind() == LinkKind.TELEGRAPH_PAGE) {
                logger.info("↳ Telegraph page: {}", link.url());
            } else if (link.kind() == LinkKind.GRAPH_PAGE) {
                logger.info("↳ Graph page: {}", link.url());
            }
            return switch (link.kind()) {
                case TELEGRAPH_PAGE, GRAPH_PAGE -> pageScraper.scrape(target);
                case CHANNEL_POST -> postFetcher.fetch(target);
            };
        } catch (RuntimeException e) {
            logger.error("Unexpected error while fetching {}", link.url(), e);
            return FetchOutcome.failed(link, FetchOutcome.Status.UNEXPECTED_ERROR, String.valueOf(e));
        }
    }
}
