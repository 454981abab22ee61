package com.ragsync.collect;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

public class HtmlPageParser {
    private static final String BOILERPLATE = "script, style, noscript, header, footer, nav, aside, form";
    private static final String[] MAIN_REGIONS = {"main", "#main", "article", ".main", ".mainContents"};

    public HtmlPage parse(byte[] body, String charset, String baseUrl) throws IOException {
        Document document = Jsoup.parse(new ByteArrayInputStream(body), charset, baseUrl);
        return parse(document);
    }

    public HtmlPage parse(String html, String baseUrl) {
        return parse(Jsoup.parse(html, baseUrl));
    }

    HtmlPage parse(Document document) {
        List<String> links = extractLinks(document);

        document.select(BOILERPLATE).remove();

        String title = document.title().strip();
        Element h1 = document.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            title = h1.text().strip();
        }

        Element target = mainRegion(document);
        String text = extractText(target).replaceAll("\n{3,}", "\n\n");
        return new HtmlPage(title, text, links);
    }

    private static Element mainRegion(Document document) {
        for (String selector : MAIN_REGIONS) {
            Element region = document.selectFirst(selector);
            if (region != null) {
                return region;
            }
        }
        return document.body() != null ? document.body() : document;
    }

    private static List<String> extractLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String absolute = anchor.absUrl("href");
            if (!absolute.isBlank()) {
                links.add(absolute);
            }
        }
        return new ArrayList<>(links);
    }

    static String extractText(Element root) {
        List<String> pieces = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    String piece = ((TextNode) node).getWholeText().strip();
                    if (!piece.isEmpty()) {
                        pieces.add(piece);
                    }
                }
            }
        }, root);
        return String.join("\n", pieces);
    }
}
