package com.ragsync.collect;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.ingest.RawDocument;
import com.ragsync.runtime.AppConfig.StatuteSourceConfig;

public class StatuteApiCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(StatuteApiCollector.class);
    private static final String[] LIST_ENTRY_TAGS = {"LawNameListInfo", "LawInfo"};
    private static final String[] BODY_TAGS = {"LawFullText", "LawBody"};

    private final String source;
    private final String baseUrl;
    private final String lawUrlPrefix;
    private final List<String> keywords;
    private final int maxLaws;
    private final int category;
    private final Duration delay;
    private final TitleMatchRules rules;
    private final PageFetcher fetcher;
    private final Sleeper sleeper;

    public StatuteApiCollector(StatuteSourceConfig config, PageFetcher fetcher, Sleeper sleeper) {
        this.source = config.getSource();
        this.baseUrl = stripTrailingSlash(config.getBaseUrl());
        this.lawUrlPrefix = config.getLawUrlPrefix();
        this.keywords = List.copyOf(config.getKeywords());
        this.maxLaws = config.getMaxLaws();
        this.category = config.getCategory();
        this.delay = Duration.ofMillis(Math.round(config.getDelaySeconds() * 1000));
        this.rules = new TitleMatchRules(
                config.getExactAllow(),
                config.getPrefixAllow(),
                config.getIncludeSuffixes(),
                config.getExcludePhrases());
        this.fetcher = fetcher;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return "statutes";
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public CollectorResult collect() throws IOException {
        List<RawDocument> documents = new ArrayList<>();
        int failures = 0;
        try {
            List<LawListing> laws = fetchLawList();
            List<TitleMatchRules.Match> selected = rules.select(keywords, laws, maxLaws);
            log.info("Statute list entries={} keywords={} selected={}", laws.size(), keywords.size(), selected.size());

            for (TitleMatchRules.Match match : selected) {
                if (!delay.isZero()) {
                    sleeper.sleep(delay);
                }
                LawListing law = match.law();
                FetchResult fetched = fetcher.fetch(baseUrl + "/lawdata/" + law.lawId());
                if (!fetched.isSuccess()) {
                    failures++;
                    continue;
                }
                LawText text = parseLawText(fetched.text());
                if (text == null) {
                    log.warn("Law {} returned an error result", law.lawId());
                    failures++;
                    continue;
                }
                Map<String, String> extra = new LinkedHashMap<>();
                extra.put("law_id", law.lawId());
                extra.put("law_no", law.lawNo());
                String title = text.title().isBlank() ? law.title() : text.title();
                documents.add(new RawDocument(source, title, lawUrlPrefix + law.lawId(), text.body(), extra));
                log.debug("Fetched law {} rank={} title={}", law.lawId(), match.rank(), title);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Statute collection interrupted after {} laws", documents.size());
            return new CollectorResult(name(), source, documents, false, failures + 1);
        }
        return new CollectorResult(name(), source, documents, failures == 0, failures);
    }

    List<LawListing> fetchLawList() throws IOException, InterruptedException {
        String url = baseUrl + "/lawlists/" + category;
        FetchResult fetched = fetcher.fetch(url);
        if (!fetched.isSuccess()) {
            throw new IOException("Law list " + url + " unavailable: " + fetched.status() + " " + fetched.error());
        }
        return parseLawList(fetched.text());
    }

    static List<LawListing> parseLawList(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        List<LawListing> laws = new ArrayList<>();
        for (String tag : LIST_ENTRY_TAGS) {
            for (Element entry : document.select(tag)) {
                String lawId = childText(entry, "LawId");
                String lawName = childText(entry, "LawName");
                if (lawId.isEmpty() || lawName.isEmpty()) {
                    continue;
                }
                String lawNo = childText(entry, "LawNo");
                if (lawNo.isEmpty()) {
                    lawNo = childText(entry, "LawNum");
                }
                laws.add(new LawListing(lawId, lawName, lawNo));
            }
            if (!laws.isEmpty()) {
                break;
            }
        }
        return laws;
    }

    /** Returns {@code null} when the API reports a non-zero result code. */
    static LawText parseLawText(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        Element code = document.selectFirst("Result > Code");
        if (code != null && !code.text().strip().equals("0")) {
            return null;
        }
        String title = childText(document, "LawTitle");
        if (title.isEmpty()) {
            title = childText(document, "LawName");
        }

        Element body = document;
        for (String tag : BODY_TAGS) {
            Element candidate = document.selectFirst(tag);
            if (candidate != null) {
                body = candidate;
                break;
            }
        }

        List<String> lines = new ArrayList<>();
        for (Element element : body.getAllElements()) {
            String own = element.ownText().strip();
            if (!own.isEmpty()) {
                lines.add(own);
            }
        }
        return new LawText(title, String.join("\n", lines));
    }

    private static String childText(Element parent, String tag) {
        Element element = parent.selectFirst(tag);
        return element == null ? "" : element.text().strip();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record LawText(String title, String body) {
    }
}
