package com.harvester.core;

import com.harvester.api.MessagingPlatform;
import com.harvester.common.html.ImageExtractor;
import com.harvester.common.html.JsoupImageExtractor;
import com.harvester.common.http.DocumentClient;
import com.harvester.common.http.HttpDocumentClient;
import com.harvester.core.config.Configuration;
import com.harvester.core.crawl.CrawlOrchestrator;
import com.harvester.core.crawl.CrawlReport;
import com.harvester.core.fetch.ChannelPostFetcher;
import com.harvester.core.fetch.ConcurrencyBudget;
import com.harvester.core.fetch.PageScraper;
import com.harvester.core.fetch.ResourceFetcher;
import com.harvester.core.link.LinkClassifier;
import com.harvester.core.plugin.PlatformLoader;
import com.harvester.services.database.DatabaseService;
import com.harvester.services.database.LedgerMigration;
import com.harvester.services.ledger.ProcessedLinkLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every long-lived component of one harvester process and wires them together.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final Configuration config;
    private final DatabaseService databaseService;
    private final ProcessedLinkLedger ledger;
    private final LinkClassifier classifier;
    private final ConcurrencyBudget linkBudget;
    private final ConcurrencyBudget imageBudget;
    private final DocumentClient documentClient;
    private final MessagingPlatform platform;
    private final ResourceFetcher resourceFetcher;
    private final CrawlOrchestrator orchestrator;
    private final Path downloadRoot;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public Kernel(Configuration config) {
        this(config,
                new HttpDocumentClient(config.userAgent, config.connectTimeoutMs, config.readTimeoutMs),
                new PlatformLoader().load(config));
    }

    /**
     * @param platform may be null; channel entries are then skipped
     */
    public Kernel(Configuration config, DocumentClient documentClient, MessagingPlatform platform) {
        this.config = config;
        this.documentClient = documentClient;
        this.platform = platform;
        this.downloadRoot = Paths.get(config.downloadPath).toAbsolutePath();

        logger.info("⚛️ Kernel booting...");

        this.databaseService = new DatabaseService(config.ledgerPath);
        this.ledger = new ProcessedLinkLedger(databaseService);
        this.classifier = new LinkClassifier();
        this.linkBudget = new ConcurrencyBudget("link", config.linkConcurrency);
        this.imageBudget = new ConcurrencyBudget("image", config.imageConcurrency);

        ImageExtractor imageExtractor = new JsoupImageExtractor();
        PageScraper pageScraper = new PageScraper(ledger, documentClient, imageExtractor, imageBudget,
                config.saveRawDocument);
        ChannelPostFetcher postFetcher = new ChannelPostFetcher(ledger, platform);
        this.resourceFetcher = new ResourceFetcher(pageScraper, postFetcher, linkBudget, downloadRoot);
        this.orchestrator = new CrawlOrchestrator(classifier, resourceFetcher, platform);

        logger.info("✅ Kernel active. Downloads go to {} ({} link / {} image slots)",
                downloadRoot, config.linkConcurrency, config.imageConcurrency);
    }

    public CrawlReport run(List<String> entries, boolean fullCrawl) {
        if (stopped.get()) {
            throw new IllegalStateException("Kernel already shut down");
        }
        return orchestrator.run(entries, fullCrawl);
    }

    public LedgerMigration.Result importLedger(File legacyFile) throws IOException {
        return LedgerMigration.importLinks(legacyFile, ledger, classifier);
    }

    /**
     * Stop workers and close the ledger. Safe to call more than once.
     *
     * @param interrupt abort running fetches instead of letting them finish
     */
    public void shutdown(boolean interrupt) {
        if (stopped.getAndSet(true))
            return;
        logger.info("🛑 Kernel shutting down...");

        if (interrupt) {
            linkBudget.shutdownNow();
            imageBudget.shutdownNow();
            try {
                linkBudget.awaitTermination(5, TimeUnit.SECONDS);
                imageBudget.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else {
            linkBudget.close();
            imageBudget.close();
        }

        if (platform != null) {
            try {
                platform.close();
            } catch (Exception e) {
                logger.warn("Platform {} did not close cleanly", platform.getName(), e);
            }
        }

        ledger.close();
        logger.info("Kernel stopped.");
    }

    // --- Getters ---
    public Configuration getConfig() {
        return config;
    }

    public DatabaseService getDatabaseService() {
        return databaseService;
    }

    public ProcessedLinkLedger getLedger() {
        return ledger;
    }

    public LinkClassifier getClassifier() {
        return classifier;
    }

    public ConcurrencyBudget getLinkBudget() {
        return linkBudget;
    }

    public ConcurrencyBudget getImageBudget() {
        return imageBudget;
    }

    public DocumentClient getDocumentClient() {
        return documentClient;
    }

    public MessagingPlatform getPlatform() {
        return platform;
    }

    public ResourceFetcher getResourceFetcher() {
        return resourceFetcher;
    }

    public CrawlOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public Path getDownloadRoot() {
        return downloadRoot;
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
