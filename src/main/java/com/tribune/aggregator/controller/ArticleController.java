package com.tribune.aggregator.controller;

import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.service.ArticleService;
import com.tribune.aggregator.service.SerendipityService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/articles")
@RequiredArgsConstructor
public class ArticleController {

    private static final int MAX_LIMIT = 200;

    private final ArticleService articleService;
    private final SerendipityService serendipityService;

    @GetMapping
    public ResponseEntity<List<ArticleResponse>> latest(
            @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        checkLimit(limit);
        return ResponseEntity.ok(toResponses(articleService.latest(limit)));
    }

    @GetMapping("/source/{sourceId}")
    public ResponseEntity<List<ArticleResponse>> bySource(
            @PathVariable("sourceId") Long sourceId,
            @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        checkLimit(limit);
        return ResponseEntity.ok(toResponses(articleService.latestForSource(sourceId, limit)));
    }

    @GetMapping("/serendipity")
    public ResponseEntity<List<ArticleResponse>> serendipity(
            @RequestParam(name = "count", required = false) Integer count,
            @RequestParam(name = "days", required = false) Integer days
    ) {
        if (count != null && count > MAX_LIMIT) {
            throw new IllegalArgumentException("count must be <= " + MAX_LIMIT);
        }
        return ResponseEntity.ok(toResponses(serendipityService.serendipity(count, days)));
    }

    private static void checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    private static List<ArticleResponse> toResponses(List<Article> articles) {
        return articles.stream().map(ArticleResponse::from).toList();
    }

    public record ArticleResponse(
            String id,
            String title,
            String url,
            Long sourceId,
            String sourceName,
            String summary,
            String author,
            Instant publishedDate,
            String imageUrl,
            Instant fetchedAt,
            List<String> categories,
            String extractedSummary,
            Integer wordCount
    ) {
        static ArticleResponse from(Article a) {
            return new ArticleResponse(
                    a.getId(),
                    a.getTitle(),
                    a.getUrl(),
                    a.getSourceId(),
                    a.getSourceName(),
                    a.getSummary(),
                    a.getAuthor(),
                    a.getPublishedDate(),
                    a.getImageUrl(),
                    a.getFetchedAt(),
                    List.copyOf(a.getCategories()),
                    a.getExtractedSummary(),
                    a.getWordCount()
            );
        }
    }
}
