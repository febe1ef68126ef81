package com.harvester.core.fetch;

import com.harvester.common.html.ImageExtractor;
import com.harvester.common.http.DocumentClient;
import com.harvester.common.http.FetchedDocument;
import com.harvester.common.http.TransportException;
import com.harvester.common.util.FileNames;
import com.harvester.core.link.ClassifiedLink;
import com.harvester.services.ledger.ProcessedLinkLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Downloads every image of a Telegraph / Graph page.
 * Images go through the shared image budget; the page is recorded in the
 * ledger only after every image attempt has finished.
 */
public class PageScraper {
    private static final Logger logger = LoggerFactory.getLogger(PageScraper.class);
    static final String RAW_DOCUMENT_NAME = "page.html";

    enum ImageResult { WRITTEN, EXISTING, FAILED }

    private final ProcessedLinkLedger ledger;
    private final DocumentClient client;
    private final ImageExtractor imageExtractor;
    private final ConcurrencyBudget imageBudget;
    private final boolean saveRawDocument;

    public PageScraper(ProcessedLinkLedger ledger, DocumentClient client, ImageExtractor imageExtractor,
                       ConcurrencyBudget imageBudget, boolean saveRawDocument) {
        this.ledger = ledger;
        this.client = client;
        this.imageExtractor = imageExtractor;
        this.imageBudget = imageBudget;
        this.saveRawDocument = saveRawDocument;
    }

    public FetchOutcome scrape(FetchTarget target) {
        ClassifiedLink link = target.link();
        String url = link.url();

        if (ledger.isProcessed(url)) {
            logger.debug("History skip: {}", url);
            return FetchOutcome.alreadyProcessed(link);
        }

        FetchedDocument doc;
        try {
            doc = client.get(url);
        } catch (TransportException e) {
            logger.warn("Error fetching {} - {}", url, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.TRANSPORT_ERROR, e.getMessage());
        }
        if (!doc.isSuccess()) {
            logger.warn("Page fetch failed {} (status {})", url, doc.status());
            return FetchOutcome.failed(link, FetchOutcome.Status.TRANSPORT_ERROR, "HTTP " + doc.status());
        }

        Path folder = target.folder();
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            logger.error("Cannot create folder {} for {} - {}", folder, url, e.getMessage());
            return FetchOutcome.failed(link, FetchOutcome.Status.STORAGE_ERROR, e.getMessage());
        }

        if (saveRawDocument) {
            try {
                Files.writeString(folder.resolve(RAW_DOCUMENT_NAME), doc.body(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warn("Could not keep raw page for {} - {}", url, e.getMessage());
            }
        }

        Map<String, String> images = resolveImages(imageExtractor.extractImageSources(doc.body()), link.domainRoot());
        if (images.isEmpty()) {
            logger.info("No images on {}", url);
            ledger.markProcessed(url, link.kind().ledgerKind());
            return FetchOutcome.empty(link, "no images");
        }

        logger.info("↳ {} images detected on {}, downloading…", images.size(), url);

        List<Future<ImageResult>> pending = new ArrayList<>(images.size());
        for (Map.Entry<String, String> image : images.entrySet()) {
            Path file = folder.resolve(image.getKey());
            pending.add(imageBudget.submit(() -> downloadImage(image.getValue(), file)));
        }

        int written = 0;
        int failed = 0;
        for (int i = 0; i < pending.size(); i++) {
            try {
                ImageResult result = pending.get(i).get();
                if (result == ImageResult.FAILED) failed++;
                else written++;
            } catch (InterruptedException e) {
                // The page did not finish: cancel the rest and leave the ledger alone
                cancelFrom(pending, i);
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while downloading images of {}", url);
                return FetchOutcome.interrupted(link);
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof InterruptedException)) {
                    logger.warn("Image task failed on {} - {}", url, String.valueOf(e.getCause()));
                    failed++;
                    continue;
                }
                cancelFrom(pending, i + 1);
                logger.warn("Image downloads of {} were stopped", url);
                return FetchOutcome.interrupted(link);
            } catch (CancellationException e) {
                cancelFrom(pending, i + 1);
                logger.warn("Image downloads of {} were cancelled", url);
                return FetchOutcome.interrupted(link);
            }
        }

        ledger.markProcessed(url, link.kind().ledgerKind());
        if (failed > 0) {
            logger.info("✅ {}: {}/{} images stored, {} failed", url, written, images.size(), failed);
        } else {
            logger.info("✅ {}: {} images stored", url, written);
        }
        return FetchOutcome.fetched(link, written, failed);
    }

    ImageResult downloadImage(String imageUrl, Path file) {
        if (Files.exists(file)) {
            return ImageResult.EXISTING;
        }
        try {
            client.download(imageUrl, file);
            logger.info("    ▸ {}", file.getFileName());
            return ImageResult.WRITTEN;
        } catch (TransportException e) {
            logger.warn("Image download failed {} - {}", imageUrl, e.getMessage());
        } catch (IOException e) {
            logger.warn("Could not store image {} as {} - {}", imageUrl, file, e.getMessage());
        }
        return ImageResult.FAILED;
    }

    /**
     * Absolute http(s) URLs keyed by the file name they are stored under.
     * Two URLs ending in the same name share one file; the first one wins.
     */
    static Map<String, String> resolveImages(Set<String> sources, String domainRoot) {
        Map<String, String> byFileName = new LinkedHashMap<>();
        for (String src : sources) {
            String absolute = resolve(src, domainRoot);
            if (absolute == null) {
                logger.debug("Ignoring image reference {}", src);
                continue;
            }
            byFileName.putIfAbsent(FileNames.fromUrl(absolute), absolute);
        }
        return byFileName;
    }

    static String resolve(String src, String domainRoot) {
        try {
            URI resolved = URI.create(domainRoot + "/").resolve(src.trim());
            String scheme = resolved.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return null;
            }
            return resolved.toString();
        } catch (IllegalArgumentException e) {
            // Unescaped characters; root-relative paths are still usable as plain strings
            return src.startsWith("/") ? domainRoot + src : null;
        }
    }

    private static void cancelFrom(List<Future<ImageResult>> pending, int from) {
        for (int j = from; j < pending.size(); j++) {
            pending.get(j).cancel(true);
        }
    }
}
