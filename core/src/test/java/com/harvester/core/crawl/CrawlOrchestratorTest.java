package com.harvester.core.crawl;

import com.harvester.api.ChannelRef;
import com.harvester.api.MessagingPlatform;
import com.harvester.common.html.JsoupImageExtractor;
import com.harvester.core.fetch.ChannelPostFetcher;
import com.harvester.core.fetch.FetchOutcome;
import com.harvester.core.fetch.PageScraper;
import com.harvester.core.fetch.ResourceFetcher;
import com.harvester.core.link.LinkClassifier;
import com.harvester.services.ledger.ProcessedLinkLedger;
import com.harvester.test.TestBase;
import com.harvester.test.support.FakeDocumentClient;
import com.harvester.test.support.FakePlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CrawlOrchestratorTest extends TestBase {

    private ProcessedLinkLedger ledger;
    private FakeDocumentClient client;
    private FakePlatform platform;

    @BeforeEach
    void init() {
        ledger = newLedger();
        client = new FakeDocumentClient();
        platform = new FakePlatform();
    }

    private CrawlOrchestrator orchestrator(MessagingPlatform platform) {
        PageScraper scraper = new PageScraper(ledger, client, new JsoupImageExtractor(),
                newBudget("image", 10), true);
        ResourceFetcher fetcher = new ResourceFetcher(scraper, new ChannelPostFetcher(ledger, platform),
                newBudget("link", 4), tempDir.resolve("downloads"));
        return new CrawlOrchestrator(new LinkClassifier(), fetcher, platform);
    }

    private String page(String slug) {
        String url = "https://telegra.ph/" + slug;
        client.page(url, "<img src=\"/file/" + slug + ".jpg\">")
                .resource("https://telegra.ph/file/" + slug + ".jpg", slug);
        return url;
    }

    @Test
    void testFlatListOfLinks() {
        String first = page("First-01-01");
        String second = page("Second-01-01");

        CrawlReport report = orchestrator(platform).run(List.of(first, second), false);

        assertEquals(2, report.count(FetchOutcome.Status.FETCHED));
        assertEquals(2, report.getFilesWritten());
        assertTrue(Files.exists(tempDir.resolve("downloads/First-01-01/First-01-01.jpg")));
        assertTrue(ledger.isProcessed(first));
        assertTrue(ledger.isProcessed(second));
    }

    @Test
    void testSecondRunSkipsProcessedLinks() {
        String first = page("Again-01-01");

        orchestrator(platform).run(List.of(first), false);
        CrawlReport report = orchestrator(platform).run(List.of(first), false);

        assertEquals(1, report.count(FetchOutcome.Status.ALREADY_PROCESSED));
        assertEquals(1, client.getRequestedPages().size());
    }

    @Test
    void testUnrecognisedEntryDoesNotStopTheRun() {
        String first = page("Ok-01-01");

        CrawlReport report = orchestrator(platform).run(List.of("https://example.com/page", first), false);

        assertEquals(1, report.getUnrecognisedEntries());
        assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
    }

    @Test
    void testFailingLinkDoesNotAffectOthers() {
        client.unreachable("https://telegra.ph/Down-01-01");
        String ok = page("Up-01-01");

        CrawlReport report = orchestrator(platform).run(List.of("https://telegra.ph/Down-01-01", ok), false);

        assertEquals(1, report.count(FetchOutcome.Status.TRANSPORT_ERROR));
        assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
        assertFalse(ledger.isProcessed("https://telegra.ph/Down-01-01"));
    }

    @Test
    void testInaccessibleChannelBetweenTwoAccessibleOnes() {
        ChannelRef a = platform.channel(1, "Alpha", "alpha");
        ChannelRef b = platform.channel(2, "Beta", "beta");
        platform.post(a, 10, "read " + page("Alpha-01-01"));
        platform.post(b, 20, "read " + page("Beta-01-01"));

        CrawlReport report = orchestrator(platform).run(List.of("@alpha", "@gone", "@beta"), false);

        assertEquals(2, report.getChannelsWalked());
        assertEquals(1, report.getChannelsSkipped());
        assertTrue(ledger.isProcessed("https://telegra.ph/Alpha-01-01"));
        assertTrue(ledger.isProcessed("https://telegra.ph/Beta-01-01"));
    }

    @Test
    void testMalformedPostIdsAreSkippedInFullMode() {
        String ok = page("Ok-01-01");

        CrawlReport report = orchestrator(platform).run(List.of(
                "https://t.me/c/123456789012345678901/5",
                "https://t.me/c/\u0661\u0662\u0663/5",
                ok), true);

        assertEquals(2, report.getChannelsSkipped());
        assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
        assertTrue(ledger.isProcessed(ok));
    }

    @Test
    void testMalformedPostIdsAreAccessErrorsInLatestMode() {
        String ok = page("Ok-01-01");

        CrawlReport report = orchestrator(platform).run(List.of(
                "https://t.me/c/123456789012345678901/5",
                "https://t.me/c/\u0661\u0662\u0663/5",
                ok), false);

        assertEquals(2, report.count(FetchOutcome.Status.ACCESS_ERROR));
        assertEquals(0, report.count(FetchOutcome.Status.UNEXPECTED_ERROR));
        assertTrue(ledger.isProcessed(ok));
    }

    @Test
    void testInterruptedRunLeavesLedgerUntouched() throws Exception {
        String slow = page("Slow-01-01");
        client.latency(1000);
        CrawlOrchestrator orchestrator = orchestrator(platform);

        AtomicReference<CrawlReport> report = new AtomicReference<>();
        Thread runner = new Thread(() -> report.set(orchestrator.run(List.of(slow), false)), "run");
        runner.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (client.getRequestedDownloads().isEmpty()) {
            assertTrue(System.currentTimeMillis() < deadline, "image download never started");
            Thread.sleep(10);
        }
        runner.interrupt();
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertEquals(1, report.get().count(FetchOutcome.Status.INTERRUPTED));
        assertEquals(0, report.get().count(FetchOutcome.Status.FETCHED));
        assertFalse(ledger.isProcessed(slow));
    }

    @Test
    void testLatestOnlyStopsAtNewestMessageWithLinks() {
        ChannelRef channel = platform.channel(1, "Alpha", "alpha");
        platform.post(channel, 1, "old " + page("Old-01-01"))
                .post(channel, 2, "newer " + page("Newer-01-01") + " and " + page("Newer-02-02"))
                .post(channel, 3, "chatter with https://example.com/unrelated");

        CrawlReport report = orchestrator(platform).run(List.of("@alpha"), false);

        assertEquals(2, report.count(FetchOutcome.Status.FETCHED));
        assertTrue(ledger.isProcessed("https://telegra.ph/Newer-01-01"));
        assertTrue(ledger.isProcessed("https://telegra.ph/Newer-02-02"));
        assertFalse(ledger.isProcessed("https://telegra.ph/Old-01-01"));
        assertEquals(2, platform.getMessagesRead());
    }

    @Test
    void testFullCrawlWalksWholeHistory() {
        ChannelRef channel = platform.channel(1, "Alpha", "alpha");
        platform.post(channel, 1, page("Old-01-01"))
                .post(channel, 2, "no link at all")
                .post(channel, 3, page("New-01-01"));

        CrawlReport report = orchestrator(platform).run(List.of("alpha"), true);

        assertEquals(2, report.count(FetchOutcome.Status.FETCHED));
        assertEquals(1, report.getChannelsWalked());
    }

    @Test
    void testSameChannelIsCrawledOncePerRun() {
        ChannelRef channel = platform.channel(1, "Alpha", "alpha");
        platform.post(channel, 1, page("Only-01-01"));

        CrawlReport report = orchestrator(platform).run(List.of("@alpha", "Alpha", "1"), true);

        assertEquals(1, report.getChannelsWalked());
        assertEquals(1, report.totalLinks());
    }

    @Test
    void testAllWalksChannelsAndGroupsOnly() {
        ChannelRef channel = platform.channel(1, "Alpha", "alpha");
        ChannelRef group = platform.add(new ChannelRef(2, "Group", null, ChannelRef.Type.GROUP));
        ChannelRef chat = platform.add(new ChannelRef(3, "Friend", null, ChannelRef.Type.PRIVATE));
        platform.post(channel, 1, page("FromChannel-01-01"))
                .post(group, 1, page("FromGroup-01-01"))
                .post(chat, 1, page("FromChat-01-01"));

        CrawlReport report = orchestrator(platform).run(List.of("all"), false);

        assertEquals(2, report.getChannelsWalked());
        assertTrue(ledger.isProcessed("https://telegra.ph/FromGroup-01-01"));
        assertFalse(ledger.isProcessed("https://telegra.ph/FromChat-01-01"));
    }

    @Test
    void testPostLinkIsFetchedDirectlyInLatestMode() {
        ChannelRef channel = platform.channel(1234, "Art", "art");
        platform.postWithMedia(channel, 56, "cover", "56.jpg");

        CrawlReport report = orchestrator(platform).run(List.of("https://t.me/c/1234/56"), false);

        assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
        assertEquals(0, report.getChannelsWalked());
        assertTrue(Files.exists(tempDir.resolve("downloads/tg_1234_56/56.jpg")));
    }

    @Test
    void testPostLinkCrawlsItsChannelInFullMode() {
        ChannelRef channel = platform.channel(1234, "Art", "art");
        platform.post(channel, 1, page("One-01-01")).post(channel, 2, page("Two-01-01"));

        CrawlReport report = orchestrator(platform).run(
                List.of("https://t.me/c/1234/1", "https://t.me/c/1234/2", "@art"), true);

        assertEquals(1, report.getChannelsWalked());
        assertEquals(2, report.count(FetchOutcome.Status.FETCHED));
    }

    @Test
    void testChannelsAreSkippedWithoutPlatform() {
        String ok = page("Solo-01-01");

        CrawlReport report = orchestrator(null).run(List.of("@alpha", ok, "https://t.me/c/1/2"), false);

        assertEquals(1, report.getChannelsSkipped());
        assertEquals(1, report.count(FetchOutcome.Status.FETCHED));
        assertEquals(1, report.count(FetchOutcome.Status.ACCESS_ERROR));
    }
}
