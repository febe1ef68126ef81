package com.harvester.core.crawl;

import com.harvester.api.ChannelMessage;
import com.harvester.api.ChannelRef;
import com.harvester.api.MessageCursor;
import com.harvester.api.MessageFilter;
import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import com.harvester.core.fetch.FetchOutcome;
import com.harvester.core.fetch.ResourceFetcher;
import com.harvester.core.link.ChannelPostAddress;
import com.harvester.core.link.ClassifiedLink;
import com.harvester.core.link.LinkClassifier;
import com.harvester.core.link.LinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Walks the sources of a run (direct links, channels, or every dialog) and
 * hands each discovered link to the {@link ResourceFetcher}.
 */
public class CrawlOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(CrawlOrchestrator.class);

    private final LinkClassifier classifier;
    private final ResourceFetcher fetcher;
    private final MessagingPlatform platform;

    /**
     * @param platform may be null; channel entries are then skipped
     */
    public CrawlOrchestrator(LinkClassifier classifier, ResourceFetcher fetcher, MessagingPlatform platform) {
        this.classifier = classifier;
        this.fetcher = fetcher;
        this.platform = platform;
    }

    /**
     * Process the entries of one run.
     *
     * @param fullCrawl walk whole histories instead of only the newest message with links
     */
    public CrawlReport run(List<String> entries, boolean fullCrawl) {
        CrawlReport report = new CrawlReport();

        if (entries.size() == 1 && entries.get(0).equalsIgnoreCase("all")) {
            crawlAllDialogs(fullCrawl, report);
            logger.info("📊 {}", report.summary());
            return report;
        }

        Set<Long> seenChannels = new HashSet<>();
        List<Future<FetchOutcome>> direct = new ArrayList<>();

        for (int i = 0; i < entries.size(); i++) {
            String entry = entries.get(i);
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Run interrupted, {} entr(ies) not started", entries.size() - i);
                break;
            }

            // @username or bare channel name/id
            if (entry.startsWith("@") || !entry.startsWith("http")) {
                crawlChannelReference(entry, fullCrawl, seenChannels, report);
                continue;
            }

            Optional<ClassifiedLink> exact = classifier.classifyExact(entry);
            if (exact.isEmpty()) {
                logger.warn("Unrecognised input: {}", entry);
                report.unrecognisedEntry();
                continue;
            }

            ClassifiedLink link = exact.get();
            if (link.kind() == LinkKind.CHANNEL_POST && fullCrawl) {
                crawlChannelOfPost(link, seenChannels, report);
            } else {
                direct.add(fetcher.submit(link));
            }
        }

        awaitAll(direct, report);
        logger.info("📊 {}", report.summary());
        return report;
    }

    /**
     * Walk every channel and group the account can see.
     */
    public void crawlAllDialogs(boolean fullCrawl, CrawlReport report) {
        if (!requirePlatform("all dialogs", report)) return;

        List<ChannelRef> dialogs;
        try {
            dialogs = platform.listDialogs();
        } catch (PlatformException e) {
            logger.error("Cannot list dialogs - {}", e.getMessage());
            report.channelSkipped();
            return;
        }

        Set<Long> seen = new HashSet<>();
        for (ChannelRef dialog : dialogs) {
            if (Thread.currentThread().isInterrupted()) break;
            if (!dialog.isChannelOrGroup() || !seen.add(dialog.id())) continue;
            crawlChannel(dialog, fullCrawl, report);
        }
    }

    /**
     * Walk one channel's history, newest message first. In latest-only mode the
     * walk ends after the first message that produced any fetch.
     */
    public void crawlChannel(ChannelRef channel, boolean fullCrawl, CrawlReport report) {
        logger.info("═══ Crawling {} ═══", channel.displayName());

        try (MessageCursor cursor = platform.iterateHistory(channel, MessageFilter.URL)) {
            ChannelMessage message;
            while ((message = cursor.next()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("Crawl of {} interrupted", channel.displayName());
                    return;
                }
                if (!message.hasText()) continue;

                Set<ClassifiedLink> links = classifier.classify(message.text());
                if (links.isEmpty()) continue;

                List<Future<FetchOutcome>> tasks = new ArrayList<>(links.size());
                for (ClassifiedLink link : links) {
                    tasks.add(fetcher.submit(link));
                }
                awaitAll(tasks, report);

                if (!fullCrawl) break;
            }
            report.channelWalked();
        } catch (PlatformException e) {
            logger.error("Channel error {} - {}", channel.displayName(), e.getMessage());
            report.channelSkipped();
        }
    }

    private void crawlChannelReference(String reference, boolean fullCrawl, Set<Long> seen, CrawlReport report) {
        if (!requirePlatform(reference, report)) return;

        ChannelRef channel;
        try {
            channel = platform.resolveChannel(reference);
        } catch (PlatformException e) {
            logger.error("Channel error {} - {}", reference, e.getMessage());
            report.channelSkipped();
            return;
        }
        if (!seen.add(channel.id())) {
            logger.info("Already crawled {} in this run, skipping", channel.displayName());
            return;
        }
        crawlChannel(channel, fullCrawl, report);
    }

    private void crawlChannelOfPost(ClassifiedLink link, Set<Long> seen, CrawlReport report) {
        if (!requirePlatform(link.url(), report)) return;

        ChannelPostAddress address;
        try {
            address = ChannelPostAddress.parse(link.url());
        } catch (IllegalArgumentException e) {
            logger.error("Cannot crawl {} - {}", link.url(), e.getMessage());
            report.channelSkipped();
            return;
        }
        long channelId = address.channelId();
        if (seen.contains(channelId)) {
            logger.info("Already crawled channel {} in this run, skipping", channelId);
            return;
        }

        ChannelRef channel;
        try {
            channel = platform.resolveChannel(address.channelHandle());
        } catch (PlatformException e) {
            logger.error("Cannot crawl {} - {}", link.url(), e.getMessage());
            report.channelSkipped();
            return;
        }
        seen.add(channelId);
        if (channel.id() != channelId && !seen.add(channel.id())) {
            logger.info("Already crawled {} in this run, skipping", channel.displayName());
            return;
        }
        crawlChannel(channel, true, report);
    }

    private boolean requirePlatform(String what, CrawlReport report) {
        if (platform != null) return true;
        logger.error("No messaging platform available - cannot crawl {}", what);
        report.channelSkipped();
        return false;
    }

    private void awaitAll(List<Future<FetchOutcome>> tasks, CrawlReport report) {
        for (int i = 0; i < tasks.size(); i++) {
            try {
                report.record(tasks.get(i).get());
            } catch (InterruptedException e) {
                for (int j = i; j < tasks.size(); j++) {
                    tasks.get(j).cancel(true);
                    report.recordInterrupted();
                }
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                // Only a permit wait can fail here; fetches report their own errors
                logger.warn("Fetch task stopped - {}", String.valueOf(e.getCause()));
                report.recordInterrupted();
            }
        }
    }
}
