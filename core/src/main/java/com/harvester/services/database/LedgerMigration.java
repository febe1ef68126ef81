package com.harvester.services.database;

import com.harvester.core.link.ClassifiedLink;
import com.harvester.core.link.LinkClassifier;
import com.harvester.services.ledger.ProcessedLinkLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Imports a legacy plain text list of processed links (one per line) into the ledger,
 * so links fetched by older tooling are not downloaded again.
 */
public class LedgerMigration {
    private static final Logger logger = LoggerFactory.getLogger(LedgerMigration.class);

    public record Result(int imported, int skipped, int unrecognised) {}

    public static Result importLinks(File linkFile, ProcessedLinkLedger ledger, LinkClassifier classifier)
            throws IOException {
        if (!linkFile.isFile()) {
            throw new IOException("Legacy link list not found: " + linkFile.getAbsolutePath());
        }

        logger.info("🔄 Importing legacy links from {}...", linkFile.getName());

        int imported = 0;
        int skipped = 0;
        int unrecognised = 0;

        try (BufferedReader reader = Files.newBufferedReader(linkFile.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.trim();
                if (entry.isEmpty() || entry.startsWith("#"))
                    continue;

                Optional<ClassifiedLink> link = classifier.classifyExact(entry);
                if (link.isEmpty()) {
                    logger.debug("Not a known link, ignored: {}", entry);
                    unrecognised++;
                    continue;
                }

                if (ledger.isProcessed(entry)) {
                    skipped++;
                    continue;
                }

                ledger.markProcessed(entry, link.get().kind().ledgerKind());
                imported++;
            }
        }

        logger.info("🎉 Import complete! {} imported, {} already known, {} unrecognised",
                imported, skipped, unrecognised);
        return new Result(imported, skipped, unrecognised);
    }
}
