package com.harvester.core.link;

import com.harvester.services.ledger.ProcessedLink;

import java.util.regex.Pattern;

/**
 * The closed set of link shapes the harvester understands.
 */
public enum LinkKind {
    TELEGRAPH_PAGE("https?://telegra\\.ph/[\\w-]+", ProcessedLink.Kind.PAGE),
    GRAPH_PAGE("https?://graph\\.org/[\\w-]+", ProcessedLink.Kind.PAGE),
    CHANNEL_POST("https?://t\\.me/c/\\d+/\\d+", ProcessedLink.Kind.CHANNEL_POST);

    private final Pattern pattern;
    private final ProcessedLink.Kind ledgerKind;

    LinkKind(String regex, ProcessedLink.Kind ledgerKind) {
        // Page slugs may contain non-ASCII letters
        this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
        this.ledgerKind = ledgerKind;
    }

    public Pattern pattern() {
        return pattern;
    }

    public ProcessedLink.Kind ledgerKind() {
        return ledgerKind;
    }

    public boolean isPage() {
        return ledgerKind == ProcessedLink.Kind.PAGE;
    }
}
