package com.harvester.common.html;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class JsoupImageExtractor implements ImageExtractor {

    @Override
    public Set<String> extractImageSources(String html) {
        if (html == null || html.isBlank()) return Collections.emptySet();

        Document doc = Jsoup.parse(html);
        Set<String> sources = new LinkedHashSet<>();
        for (Element img : doc.select("img[src]")) {
            String src = img.attr("src").trim();
            if (!src.isEmpty()) sources.add(src);
        }
        return sources;
    }
}
