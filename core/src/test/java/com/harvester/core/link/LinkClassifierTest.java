package com.harvester.core.link;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LinkClassifierTest {

    private final LinkClassifier classifier = new LinkClassifier();

    @Test
    void testFindsEveryKindInFreeText() {
        String text = "New chapter https://telegra.ph/Chapter-12-05-01 mirror: http://graph.org/Chapter-12-05-01\n"
                + "Source post https://t.me/c/1234567890/42 and https://example.com/other";

        Set<ClassifiedLink> links = classifier.classify(text);

        assertEquals(Set.of(
                new ClassifiedLink("https://telegra.ph/Chapter-12-05-01", LinkKind.TELEGRAPH_PAGE),
                new ClassifiedLink("http://graph.org/Chapter-12-05-01", LinkKind.GRAPH_PAGE),
                new ClassifiedLink("https://t.me/c/1234567890/42", LinkKind.CHANNEL_POST)), links);
    }

    @Test
    void testRepeatedLinkIsReportedOnce() {
        Set<ClassifiedLink> links = classifier.classify(
                "https://telegra.ph/Same-01-01 and again https://telegra.ph/Same-01-01");

        assertEquals(1, links.size());
    }

    @Test
    void testSlugStopsAtQueryAndPunctuation() {
        Set<String> urls = classifier.classify("(https://telegra.ph/Example-01-01?ref=feed).").stream()
                .map(ClassifiedLink::url)
                .collect(Collectors.toSet());

        assertEquals(Set.of("https://telegra.ph/Example-01-01"), urls);
    }

    @Test
    void testUnicodeSlug() {
        Set<ClassifiedLink> links = classifier.classify("https://telegra.ph/Привет-мир-05-01");

        assertEquals("https://telegra.ph/Привет-мир-05-01", links.iterator().next().url());
    }

    @Test
    void testLookalikesAreIgnored() {
        List<String> texts = List.of(
                "https://telegram.ph/Example",
                "https://t.me/somechannel/15",
                "ftp://telegra.ph/Example",
                "https://graph.org/");

        for (String text : texts) {
            assertTrue(classifier.classify(text).isEmpty(), text);
        }
        assertTrue(classifier.classify(null).isEmpty());
        assertTrue(classifier.classify("").isEmpty());
    }

    @Test
    void testClassifyExact() {
        assertEquals(LinkKind.CHANNEL_POST, classifier.classifyExact(" https://t.me/c/99/1 ").orElseThrow().kind());
        assertEquals(LinkKind.GRAPH_PAGE, classifier.classifyExact("https://graph.org/A-1").orElseThrow().kind());
        assertTrue(classifier.classifyExact("see https://telegra.ph/A-1").isEmpty());
        assertTrue(classifier.classifyExact("@channel").isEmpty());
        assertTrue(classifier.classifyExact(null).isEmpty());
    }

    @Test
    void testLinkHelpers() {
        ClassifiedLink link = new ClassifiedLink("https://telegra.ph/Example-01-01/", LinkKind.TELEGRAPH_PAGE);

        assertEquals("https://telegra.ph", link.domainRoot());
        assertEquals("Example-01-01", link.lastPathSegment());
        assertTrue(LinkKind.GRAPH_PAGE.isPage());
        assertFalse(LinkKind.CHANNEL_POST.isPage());
    }
}
