package com.harvester.services.database;

import com.harvester.core.link.LinkClassifier;
import com.harvester.services.ledger.ProcessedLink;
import com.harvester.services.ledger.ProcessedLinkLedger;
import com.harvester.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMigrationTest extends TestBase {

    @Test
    void testImportsKnownLinksOnly() throws IOException {
        ProcessedLinkLedger ledger = newLedger();
        ledger.markProcessed("https://graph.org/Known-03-03", ProcessedLink.Kind.PAGE);

        Path legacy = tempDir.resolve("processed_links.txt");
        Files.writeString(legacy, String.join("\n",
                "# exported by the old script",
                "https://telegra.ph/First-01-01",
                "",
                "   https://t.me/c/1234/56   ",
                "https://graph.org/Known-03-03",
                "https://example.com/not-ours"), StandardCharsets.UTF_8);

        LedgerMigration.Result result = LedgerMigration.importLinks(legacy.toFile(), ledger, new LinkClassifier());

        assertEquals(2, result.imported());
        assertEquals(1, result.skipped());
        assertEquals(1, result.unrecognised());
        assertEquals(ProcessedLink.Kind.PAGE, ledger.find("https://telegra.ph/First-01-01").orElseThrow().kind());
        assertEquals(ProcessedLink.Kind.CHANNEL_POST, ledger.find("https://t.me/c/1234/56").orElseThrow().kind());
        assertFalse(ledger.isProcessed("https://example.com/not-ours"));
    }

    @Test
    void testImportTwiceAddsNothing() throws IOException {
        ProcessedLinkLedger ledger = newLedger();
        Path legacy = tempDir.resolve("links.txt");
        Files.writeString(legacy, "https://telegra.ph/A-01-01\nhttps://telegra.ph/B-01-01\n", StandardCharsets.UTF_8);

        LedgerMigration.importLinks(legacy.toFile(), ledger, new LinkClassifier());
        LedgerMigration.Result second = LedgerMigration.importLinks(legacy.toFile(), ledger, new LinkClassifier());

        assertEquals(0, second.imported());
        assertEquals(2, second.skipped());
        assertEquals(2, ledger.count());
    }

    @Test
    void testMissingFileFails() {
        ProcessedLinkLedger ledger = newLedger();
        File missing = tempDir.resolve("nope.txt").toFile();

        assertThrows(IOException.class, () -> LedgerMigration.importLinks(missing, ledger, new LinkClassifier()));
    }
}
