package com.harvester.common.html;

import java.util.Set;

public interface ImageExtractor {
    /**
     * Raw src values of every image in the document, as written in the markup.
     */
    Set<String> extractImageSources(String html);
}
