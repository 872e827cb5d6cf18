package com.tribune.aggregator.processor;

import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.service.CategoryService;
import com.tribune.aggregator.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword / source / domain rules. A category matches when any single rule of any type hits;
 * articles matching nothing get the {@code uncategorized} sentinel. The rule set is passed in
 * by the caller and never loaded here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleCategorizer {

    private final CategoryService categoryService;

    public List<String> categorize(Article article, List<Category> categories) {
        try {
            List<String> matches = new ArrayList<>();
            String haystack = (article.getTitle() + " " + article.getSummary()).toLowerCase(Locale.ROOT);
            Optional<String> host = UrlUtils.host(article.getUrl());

            for (Category category : categories) {
                if (category.isSentinel()) continue;

                if (matchesKeyword(haystack, category.getKeywords())
                        || matchesSource(article.getSourceId(), category.getSourceIds())
                        || host.map(h -> matchesDomain(h, category.getDomains())).orElse(false)) {
                    matches.add(category.getSlug());
                }
            }

            if (matches.isEmpty()) {
                return List.of(categoryService.getOrCreateUncategorized());
            }
            return matches;

        } catch (RuntimeException e) {
            log.warn("Categorize: failed, falling back to sentinel url={} err={}", article.getUrl(), e.toString());
            return sentinelOrEmpty();
        }
    }

    /**
     * Categorizes a batch against one rule set. Keys are article ids, in input order.
     */
    public Map<String, List<String>> categorizeAll(List<Article> articles, List<Category> categories) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Article article : articles) {
            out.put(article.getId(), categorize(article, categories));
        }
        return out;
    }

    private List<String> sentinelOrEmpty() {
        try {
            return List.of(categoryService.getOrCreateUncategorized());
        } catch (RuntimeException e) {
            log.warn("Categorize: sentinel unavailable, leaving article uncategorized err={}", e.toString());
            return List.of();
        }
    }

    private static boolean matchesKeyword(String haystack, Collection<String> keywords) {
        if (keywords == null) return false;
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) continue;
            if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static boolean matchesSource(Long sourceId, Collection<Long> sourceIds) {
        return sourceId != null && sourceIds != null && sourceIds.contains(sourceId);
    }

    private static boolean matchesDomain(String host, Collection<String> domains) {
        if (domains == null) return false;
        for (String domain : domains) {
            if (domain == null || domain.isBlank()) continue;
            if (host.contains(domain.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
