package com.harvester.core.link;

import java.net.URI;

/**
 * A raw link tagged with the shape it matched.
 */
public record ClassifiedLink(String url, LinkKind kind) {

    /**
     * Scheme and authority of the link, used to resolve relative references.
     */
    public String domainRoot() {
        URI uri = URI.create(url);
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }

    /**
     * Last non-empty path segment, e.g. "Example-01-01" for https://telegra.ph/Example-01-01.
     */
    public String lastPathSegment() {
        String trimmed = url;
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return kind + " " + url;
    }
}
