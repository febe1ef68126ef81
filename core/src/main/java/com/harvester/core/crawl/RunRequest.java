package com.harvester.core.crawl;

import java.util.List;

/**
 * One invocation of the harvester as given on the command line.
 */
public record RunRequest(
        List<String> entries,   // @usernames, channel names, t.me/c links, page links or "all"
        Boolean fullCrawl,      // null = use the configured default
        String downloadDir,     // null = use the configured default
        String configFile,
        String importLedgerFile // legacy link list to import before crawling, may be null
) {
    public boolean isAllDialogs() {
        return entries.size() == 1 && entries.get(0).equalsIgnoreCase("all");
    }

    public boolean hasEntries() {
        return !entries.isEmpty();
    }
}
