package com.ragsync.collect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Picks the law that best answers a title keyword. Rules are evaluated in declaration order of
 * {@link Rank}; the first rule that accepts a title decides its rank. Titles containing an
 * exclude phrase never match.
 */
public class TitleMatchRules {

    public enum Rank {
        EXACT,
        ALLOWLISTED,
        PREFIX_WITH_SUFFIX,
        CONTAINS
    }

    public record Match(LawListing law, Rank rank) {
    }

    private static final Comparator<Match> PRECEDENCE = Comparator
            .comparing(Match::rank)
            .thenComparingInt(match -> match.law().title().length())
            .thenComparing(match -> match.law().lawId());

    private final Set<String> exactAllow;
    private final List<String> prefixAllow;
    private final List<String> includeSuffixes;
    private final List<String> excludePhrases;
    private final Map<Rank, BiPredicate<String, String>> rules = new LinkedHashMap<>();

    public TitleMatchRules(List<String> exactAllow, List<String> prefixAllow, List<String> includeSuffixes, List<String> excludePhrases) {
        this.exactAllow = Set.copyOf(exactAllow);
        this.prefixAllow = List.copyOf(prefixAllow);
        this.includeSuffixes = List.copyOf(includeSuffixes);
        this.excludePhrases = List.copyOf(excludePhrases);

        rules.put(Rank.EXACT, (keyword, title) -> title.equals(keyword));
        rules.put(Rank.ALLOWLISTED, (keyword, title) -> this.exactAllow.contains(title) && title.contains(keyword));
        rules.put(Rank.PREFIX_WITH_SUFFIX, this::prefixWithSuffix);
        rules.put(Rank.CONTAINS, (keyword, title) -> title.contains(keyword));
    }

    public Optional<Rank> rank(String keyword, String title) {
        if (keyword == null || keyword.isBlank() || title == null) {
            return Optional.empty();
        }
        String normalizedTitle = title.strip();
        if (excludePhrases.stream().anyMatch(phrase -> !phrase.isBlank() && normalizedTitle.contains(phrase))) {
            return Optional.empty();
        }
        String normalizedKeyword = keyword.strip();
        for (Map.Entry<Rank, BiPredicate<String, String>> rule : rules.entrySet()) {
            if (rule.getValue().test(normalizedKeyword, normalizedTitle)) {
                return Optional.of(rule.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<Match> best(String keyword, List<LawListing> laws) {
        List<Match> matches = new ArrayList<>();
        for (LawListing law : laws) {
            rank(keyword, law.title()).ifPresent(rank -> matches.add(new Match(law, rank)));
        }
        return matches.stream().min(PRECEDENCE);
    }

    public List<Match> select(List<String> keywords, List<LawListing> laws, int maxLaws) {
        Map<String, Match> selected = new LinkedHashMap<>();
        for (String keyword : keywords) {
            if (selected.size() >= maxLaws) {
                break;
            }
            best(keyword, laws).ifPresent(match -> selected.putIfAbsent(match.law().lawId(), match));
        }
        return new ArrayList<>(selected.values());
    }

    private boolean prefixWithSuffix(String keyword, String title) {
        boolean prefixed = title.startsWith(keyword) || prefixAllow.stream()
                .anyMatch(prefix -> !prefix.isBlank() && title.startsWith(prefix) && title.contains(keyword));
        return prefixed && includeSuffixes.stream().anyMatch(suffix -> !suffix.isBlank() && title.endsWith(suffix));
    }
}
