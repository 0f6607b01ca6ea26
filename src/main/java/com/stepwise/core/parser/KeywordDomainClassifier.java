package com.stepwise.core.parser;

import com.stepwise.core.model.DomainTag;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword-set classifier. A description matching keywords of exactly one domain
 * gets that domain; no match or matches in several domains yield
 * {@link DomainTag#GENERAL}.
 * <p>
 * Matching is case-insensitive on word boundaries, so "ui" does not match "build".
 */
public class KeywordDomainClassifier implements DomainClassifier {

    public static final Map<DomainTag, List<String>> DEFAULT_KEYWORDS = Map.of(
            DomainTag.BACKEND, List.of("api", "endpoint", "service", "controller", "server",
                    "backend", "handler", "middleware", "repository"),
            DomainTag.FRONTEND, List.of("ui", "frontend", "component", "page", "css", "react",
                    "view", "button", "form", "layout", "style"),
            DomainTag.DATABASE, List.of("database", "db", "migration", "schema", "table", "index",
                    "sql", "query", "column", "alembic"),
            DomainTag.TEST, List.of("test", "tests", "fixture", "fixtures", "coverage", "e2e")
    );

    private final Map<DomainTag, List<Pattern>> patterns = new EnumMap<>(DomainTag.class);

    public KeywordDomainClassifier() {
        this(DEFAULT_KEYWORDS);
    }

    public KeywordDomainClassifier(Map<DomainTag, List<String>> keywords) {
        keywords.forEach((domain, words) -> {
            if (domain == DomainTag.GENERAL || words == null) {
                return;
            }
            patterns.put(domain, words.stream()
                    .filter(w -> w != null && !w.isBlank())
                    .map(w -> Pattern.compile("\\b" + Pattern.quote(w.strip().toLowerCase(Locale.ROOT)) + "\\b"))
                    .toList());
        });
    }

    @Override
    public DomainTag classify(String description) {
        if (description == null || description.isBlank()) {
            return DomainTag.GENERAL;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        var matched = new HashSet<DomainTag>();
        for (var entry : patterns.entrySet()) {
            for (Pattern p : entry.getValue()) {
                if (p.matcher(lower).find()) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched.size() == 1 ? matched.iterator().next() : DomainTag.GENERAL;
    }
}
