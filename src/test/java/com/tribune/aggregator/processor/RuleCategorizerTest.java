package com.tribune.aggregator.processor;

import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.service.CategoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleCategorizerTest {

    @Mock CategoryService categoryService;

    RuleCategorizer categorizer;

    final Category tech = Category.builder().id(1L).slug("tech").name("Tech")
            .keywords(Set.of("AI", "chip")).build();
    final Category sport = Category.builder().id(2L).slug("sport").name("Sport")
            .sourceIds(Set.of(99L)).build();
    final Category science = Category.builder().id(3L).slug("science").name("Science")
            .domains(Set.of("nature.com")).build();
    final Category sentinel = Category.builder().id(4L).slug(Category.UNCATEGORIZED_SLUG).name("Uncategorized")
            .keywords(Set.of("the")).build();

    final List<Category> rules = List.of(tech, sport, science, sentinel);

    @BeforeEach
    void setUp() {
        categorizer = new RuleCategorizer(categoryService);
    }

    @Test
    void categorize_keywordMatch_isCaseInsensitiveSubstring() {
        Article a = article("New ai CHIPSET unveiled", "", 1L, "https://example.com/x");

        assertEquals(List.of("tech"), categorizer.categorize(a, rules));
        verifyNoInteractions(categoryService);
    }

    @Test
    void categorize_keywordInSummary_matches() {
        Article a = article("Quarterly results", "Demand for chips grew", 1L, "https://example.com/x");

        assertEquals(List.of("tech"), categorizer.categorize(a, rules));
    }

    @Test
    void categorize_sourceAndDomainRules_collectAllMatches() {
        Article a = article("Something about ai", "", 99L, "https://www.nature.com/articles/1");

        assertThat(categorizer.categorize(a, rules)).containsExactly("tech", "sport", "science");
    }

    @Test
    void categorize_noMatch_returnsOnlySentinel_evenIfSentinelRulesWouldMatch() {
        when(categoryService.getOrCreateUncategorized()).thenReturn(Category.UNCATEGORIZED_SLUG);
        Article a = article("the weather today", "the clouds", 5L, "https://weather.example.com/");

        assertEquals(List.of("uncategorized"), categorizer.categorize(a, rules));
    }

    @Test
    void categorize_malformedUrl_disablesOnlyDomainCheck() {
        Article a = article("ai news", "", 5L, "ht tp://bad url");

        assertEquals(List.of("tech"), categorizer.categorize(a, rules));
    }

    @Test
    void categorize_internalFailure_fallsBackToSentinel() {
        when(categoryService.getOrCreateUncategorized()).thenReturn(Category.UNCATEGORIZED_SLUG);
        Article a = article(null, null, 5L, "https://x.example.com/");
        List<Category> broken = new java.util.ArrayList<>();
        broken.add(null);

        assertEquals(List.of("uncategorized"), categorizer.categorize(a, broken));
    }

    @Test
    void categorize_sentinelUnavailable_returnsEmpty() {
        when(categoryService.getOrCreateUncategorized()).thenThrow(new IllegalStateException("db down"));
        Article a = article("nothing relevant", "", 5L, "https://x.example.com/");

        assertTrue(categorizer.categorize(a, rules).isEmpty());
    }

    @Test
    void categorize_totality_nonEmptyForAnyArticle() {
        when(categoryService.getOrCreateUncategorized()).thenReturn(Category.UNCATEGORIZED_SLUG);
        List<Article> articles = List.of(
                article("ai", "", 1L, "https://a.example.com"),
                article("", "", 1L, "https://b.example.com"),
                article("x", "y", 99L, "not-a-url"),
                article("z", "", 2L, "https://sub.nature.com/z")
        );

        for (Article a : articles) {
            assertThat(categorizer.categorize(a, rules)).isNotEmpty();
        }
    }

    @Test
    void categorizeAll_keysByArticleId() {
        when(categoryService.getOrCreateUncategorized()).thenReturn(Category.UNCATEGORIZED_SLUG);
        Article a = article("ai", "", 1L, "https://a.example.com/1");
        a.setId("id-a");
        Article b = article("sports", "", 1L, "https://a.example.com/2");
        b.setId("id-b");

        Map<String, List<String>> out = categorizer.categorizeAll(List.of(a, b), rules);

        assertThat(out.keySet()).containsExactly("id-a", "id-b");
        assertEquals(List.of("tech"), out.get("id-a"));
        assertEquals(List.of("uncategorized"), out.get("id-b"));
    }

    private static Article article(String title, String summary, Long sourceId, String url) {
        return Article.builder()
                .id("id")
                .title(title)
                .summary(summary)
                .sourceId(sourceId)
                .url(url)
                .build();
    }
}
