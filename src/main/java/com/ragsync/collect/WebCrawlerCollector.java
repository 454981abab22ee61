package com.ragsync.collect;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragsync.ingest.RawDocument;
import com.ragsync.runtime.AppConfig.CrawlSourceConfig;

public class WebCrawlerCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(WebCrawlerCollector.class);
    private static final Pattern BINARY_EXTENSION = Pattern.compile("\\.(pdf|zip|xls|xlsx|doc|docx)$", Pattern.CASE_INSENSITIVE);

    private final String name;
    private final String source;
    private final List<String> seeds;
    private final int maxPages;
    private final Duration delay;
    private final List<String> allowedPrefixes;
    private final Set<String> allowedHosts;
    private final List<Pattern> excludeUrl;
    private final List<Pattern> skipSaveTitle;
    private final List<Pattern> skipSaveUrl;
    private final Map<String, String> extra;
    private final PageFetcher fetcher;
    private final HtmlPageParser parser;
    private final Sleeper sleeper;

    public WebCrawlerCollector(String name, CrawlSourceConfig config, PageFetcher fetcher, Sleeper sleeper) {
        this(name, config, fetcher, new HtmlPageParser(), sleeper);
    }

    WebCrawlerCollector(String name, CrawlSourceConfig config, PageFetcher fetcher, HtmlPageParser parser, Sleeper sleeper) {
        this.name = name;
        this.source = config.getSource() == null || config.getSource().isBlank() ? name : config.getSource();
        this.seeds = List.copyOf(config.getSeeds());
        this.maxPages = config.getMaxPages();
        this.delay = Duration.ofMillis(Math.round(config.getDelaySeconds() * 1000));
        this.allowedHosts = hostsOf(seeds);
        this.allowedPrefixes = config.getAllowedPrefixes().isEmpty()
                ? defaultPrefixes(seeds)
                : List.copyOf(config.getAllowedPrefixes());
        this.excludeUrl = compile(config.getExcludeUrlRegex());
        this.skipSaveTitle = compile(config.getSkipSaveTitleRegex());
        this.skipSaveUrl = compile(config.getSkipSaveUrlRegex());
        this.extra = Map.copyOf(config.getExtra());
        this.fetcher = fetcher;
        this.parser = parser;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public CollectorResult collect() throws IOException {
        Deque<String> frontier = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        List<RawDocument> documents = new ArrayList<>();
        int failures = 0;

        for (String seed : seeds) {
            normalizeUrl(seed, seed).filter(this::isAllowed).ifPresent(frontier::add);
        }

        try {
            while (!frontier.isEmpty() && seen.size() < maxPages) {
                String url = frontier.poll();
                if (seen.contains(url) || matchesAny(excludeUrl, url)) {
                    continue;
                }
                if (!seen.isEmpty() && !delay.isZero()) {
                    sleeper.sleep(delay);
                }
                seen.add(url);

                FetchResult fetched = fetcher.fetch(url);
                if (fetched.isRetryable()) {
                    failures++;
                    continue;
                }
                if (!fetched.isSuccess() || !isHtml(fetched.contentType())) {
                    continue;
                }

                HtmlPage page;
                try {
                    page = parser.parse(fetched.body(), fetched.charset(), url);
                } catch (IOException e) {
                    log.warn("Unable to parse {}: {}", url, e.getMessage());
                    failures++;
                    continue;
                }

                if (shouldSave(url, page.title())) {
                    String title = page.title().isBlank() ? url : page.title();
                    documents.add(new RawDocument(source, title, url, page.text(), extra));
                }

                for (String link : page.links()) {
                    normalizeUrl(link, url)
                            .filter(this::isAllowed)
                            .filter(candidate -> !matchesAny(excludeUrl, candidate))
                            .filter(candidate -> !BINARY_EXTENSION.matcher(candidate).find())
                            .filter(candidate -> !seen.contains(candidate))
                            .ifPresent(frontier::add);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Crawl {} interrupted after {} pages", name, seen.size());
            return new CollectorResult(name, source, documents, false, failures + 1);
        }

        boolean truncated = frontier.stream().anyMatch(url -> !seen.contains(url) && !matchesAny(excludeUrl, url));
        log.info("Crawl {} finished pages={} documents={} failures={} truncated={}",
                name, seen.size(), documents.size(), failures, truncated);
        return new CollectorResult(name, source, documents, !truncated && failures == 0, failures);
    }

    boolean isAllowed(String url) {
        if (allowedPrefixes.stream().noneMatch(url::startsWith)) {
            return false;
        }
        String host = URI.create(url).getHost();
        return host != null && allowedHosts.contains(host.toLowerCase(Locale.ROOT));
    }

    private boolean shouldSave(String url, String title) {
        if (!title.isBlank() && matchesAny(skipSaveTitle, title)) {
            return false;
        }
        return !matchesAny(skipSaveUrl, url);
    }

    static Optional<String> normalizeUrl(String href, String baseUrl) {
        try {
            URI resolved = new URI(baseUrl).resolve(href.strip());
            String scheme = resolved.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return Optional.empty();
            }
            String absolute = resolved.toString();
            int fragment = absolute.indexOf('#');
            return Optional.of(fragment >= 0 ? absolute.substring(0, fragment) : absolute);
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Ignoring malformed link {} on {}", href, baseUrl);
            return Optional.empty();
        }
    }

    private static boolean isHtml(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.equals("text/html") || lower.equals("application/xhtml+xml");
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static List<Pattern> compile(List<String> regexes) {
        return regexes.stream()
                .filter(regex -> regex != null && !regex.isBlank())
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static Set<String> hostsOf(List<String> urls) {
        Set<String> hosts = new LinkedHashSet<>();
        for (String url : urls) {
            normalizeUrl(url, url)
                    .map(URI::create)
                    .map(URI::getHost)
                    .ifPresent(host -> hosts.add(host.toLowerCase(Locale.ROOT)));
        }
        return hosts;
    }

    private static List<String> defaultPrefixes(List<String> urls) {
        List<String> prefixes = new ArrayList<>();
        for (String url : urls) {
            normalizeUrl(url, url).map(URI::create).ifPresent(uri -> {
                String prefix = uri.getScheme() + "://" + uri.getRawAuthority() + "/";
                if (!prefixes.contains(prefix)) {
                    prefixes.add(prefix);
                }
            });
        }
        return prefixes;
    }
}
