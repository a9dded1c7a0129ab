package com.policyparser.discovery.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

@Component
public class PageTextExtractor {
    private static final int MIN_MAIN_CHARS = 500;

    public record PageContent(String title, String text) {
    }

    public PageContent extract(String html, String url) {
        if (html == null || html.isBlank()) return new PageContent("", "");
        Document doc = Jsoup.parse(html, url == null ? "" : url);
        String title = doc.title();
        doc.select("script, noscript, style, svg, iframe, template, header, nav, aside, form").remove();

        Elements mains = doc.select("main, article, [role=main], #content, .content, .policy, .legal-content");
        StringBuilder sb = new StringBuilder();
        for (Element e : mains) {
            String t = e.text();
            if (t.length() > sb.length()) {
                sb.setLength(0);
                sb.append(t);
            }
        }
        String text = sb.length() >= MIN_MAIN_CHARS ? sb.toString() : doc.body() == null ? doc.text() : doc.body().text();
        if (title.isBlank()) {
            Element h1 = doc.selectFirst("h1");
            if (h1 != null) title = h1.text();
        }
        return new PageContent(title.trim(), text.trim());
    }
}
