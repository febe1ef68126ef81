package com.harvester.core;

import com.harvester.core.config.Configuration;
import com.harvester.core.crawl.CrawlReport;
import com.harvester.core.fetch.FetchOutcome;
import com.harvester.test.TestBase;
import com.harvester.test.support.FakeDocumentClient;
import com.harvester.test.support.FakePlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KernelTest extends TestBase {

    private Configuration config;
    private FakeDocumentClient client;

    @BeforeEach
    void init() {
        config = new Configuration();
        config.downloadPath = tempDir.resolve("images").toString();
        config.ledgerPath = ledgerPath();
        config.imageConcurrency = 2;
        client = new FakeDocumentClient()
                .page("https://graph.org/Gallery-07-07", "<img src=\"/file/one.jpg\"><img src=\"/file/two.jpg\">")
                .resource("https://graph.org/file/one.jpg", "1")
                .resource("https://graph.org/file/two.jpg", "2");
    }

    @Test
    void testRunStoresImagesAndRemembersLinks() {
        Kernel kernel = new Kernel(config, client, null);
        try {
            CrawlReport report = kernel.run(List.of("https://graph.org/Gallery-07-07"), false);

            assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
            Path folder = Path.of(config.downloadPath).resolve("Gallery-07-07");
            assertTrue(Files.exists(folder.resolve("one.jpg")));
            assertTrue(Files.exists(folder.resolve("two.jpg")));
            assertTrue(kernel.getLedger().isProcessed("https://graph.org/Gallery-07-07"));
            assertEquals(2, kernel.getImageBudget().getPermits());
        } finally {
            kernel.shutdown(false);
        }

        Kernel restarted = new Kernel(config, client, null);
        try {
            CrawlReport again = restarted.run(List.of("https://graph.org/Gallery-07-07"), false);
            assertEquals(1, again.count(FetchOutcome.Status.ALREADY_PROCESSED));
        } finally {
            restarted.shutdown(false);
        }
    }

    @Test
    void testImportLedger() throws IOException {
        Path legacy = tempDir.resolve("legacy.txt");
        Files.writeString(legacy, "https://graph.org/Gallery-07-07\n", StandardCharsets.UTF_8);
        Kernel kernel = new Kernel(config, client, null);
        try {
            assertEquals(1, kernel.importLedger(legacy.toFile()).imported());
            CrawlReport report = kernel.run(List.of("https://graph.org/Gallery-07-07"), false);
            assertEquals(1, report.count(FetchOutcome.Status.ALREADY_PROCESSED));
            assertTrue(client.getRequestedPages().isEmpty());
        } finally {
            kernel.shutdown(false);
        }
    }

    @Test
    void testShutdownIsIdempotentAndClosesPlatform() {
        FakePlatform platform = new FakePlatform();
        Kernel kernel = new Kernel(config, client, platform);

        kernel.shutdown(true);
        kernel.shutdown(false);

        assertTrue(kernel.isStopped());
        assertTrue(platform.isClosed());
        assertThrows(IllegalStateException.class, () -> kernel.run(List.of("all"), false));
    }
}
