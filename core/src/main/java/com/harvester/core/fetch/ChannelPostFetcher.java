package com.harvester.core.fetch;

import com.harvester.api.ChannelMessage;
import com.harvester.api.ChannelRef;
import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import com.harvester.core.link.ChannelPostAddress;
import com.harvester.core.link.ClassifiedLink;
import com.harvester.services.ledger.ProcessedLinkLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Downloads the media attached to a single channel post (t.me/c/... link).
 */
public class ChannelPostFetcher {
    private static final Logger logger = LoggerFactory.getLogger(ChannelPostFetcher.class);

    private final ProcessedLinkLedger ledger;
    private final MessagingPlatform platform;

    /**
     * @param platform may be null when no platform plugin is configured; post
     *                 links are then reported as inaccessible
     */
    public ChannelPostFetcher(ProcessedLinkLedger ledger, MessagingPlatform platform) {
        this.ledger = ledger;
        this.platform = platform;
    }

    public FetchOutcome fetch(FetchTarget target) {
        ClassifiedLink link = target.link();
        String url = link.url();

        if (ledger.isProcessed(url)) {
            logger.debug("History skip: {}", url);
            return FetchOutcome.alreadyProcessed(link);
        }

        ChannelPostAddress address;
        try {
            address = ChannelPostAddress.parse(url);
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot access {} - {}", url, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.ACCESS_ERROR, e.getMessage());
        }
        if (platform == null) {
            logger.warn("Cannot access {} - no messaging platform configured", url);
            return FetchOutcome.failed(link, FetchOutcome.Status.ACCESS_ERROR, "no messaging platform");
        }

        Optional<ChannelMessage> message;
        try {
            ChannelRef channel = platform.resolveChannel(address.channelHandle());
            message = platform.getMessage(channel, address.messageId());
        } catch (PlatformException e) {
            logger.warn("Cannot access {} - {}", url, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.ACCESS_ERROR, e.getMessage());
        }

        if (message.isEmpty() || !message.get().hasMedia()) {
            logger.info("No media in {}", url);
            ledger.markProcessed(url, link.kind().ledgerKind());
            return FetchOutcome.empty(link, "no media");
        }

        Path folder = target.folder();
        logger.info("↳ Telegram post: {}", url);
        try {
            Files.createDirectories(folder);
            Path stored = platform.downloadMedia(message.get(), folder);
            logger.info("    ▸ {}", stored.getFileName());
        } catch (PlatformException e) {
            logger.warn("Cannot download media of {} - {}", url, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.ACCESS_ERROR, e.getMessage());
        } catch (IOException e) {
            logger.warn("Could not store media of {} in {} - {}", url, folder, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.STORAGE_ERROR, e.getMessage());
        }

        ledger.markProcessed(url, link.kind().ledgerKind());
        return FetchOutcome.fetched(link, 1, 0);
    }
}
