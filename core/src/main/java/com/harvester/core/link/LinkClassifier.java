package com.harvester.core.link;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds the recognised links inside arbitrary text.
 * Pure function: no I/O and no knowledge of what was already processed.
 */
public class LinkClassifier {

    /**
     * Every distinct link in the text, each kind matched independently.
     */
    public Set<ClassifiedLink> classify(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySet();
        }

        Set<ClassifiedLink> links = new LinkedHashSet<>();
        for (LinkKind kind : LinkKind.values()) {
            Matcher m = kind.pattern().matcher(text);
            while (m.find()) {
                links.add(new ClassifiedLink(m.group(), kind));
            }
        }
        return links;
    }

    /**
     * Kind of an entry that consists of exactly one link and nothing else.
     */
    public Optional<ClassifiedLink> classifyExact(String entry) {
        if (entry == null) return Optional.empty();
        String candidate = entry.trim();
        for (LinkKind kind : LinkKind.values()) {
            if (kind.pattern().matcher(candidate).matches()) {
                return Optional.of(new ClassifiedLink(candidate, kind));
            }
        }
        return Optional.empty();
    }
}
