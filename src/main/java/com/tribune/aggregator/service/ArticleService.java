package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleService {

    private final ArticleRepository articleRepository;

    public boolean exists(String id) {
        return articleRepository.existsById(id);
    }

    /**
     * Inserts the article unless its id is already stored. An existing row is never
     * overwritten; a concurrent insert of the same id loses on the primary key.
     *
     * @return true when this call created the row
     */
    public boolean insertIfAbsent(Article article) {
        if (articleRepository.existsById(article.getId())) {
            return false;
        }
        try {
            articleRepository.saveAndFlush(article);
            return true;
        } catch (DataIntegrityViolationException dup) {
            log.debug("Duplicate article (db) id={} url={}, skipping", article.getId(), article.getUrl());
            return false;
        }
    }

    public List<Article> latest(int limit) {
        return articleRepository.findAllByOrderByFetchedAtDesc(PageRequest.of(0, limit));
    }

    public List<Article> latestForSource(Long sourceId, int limit) {
        return articleRepository.findBySourceIdOrderByFetchedAtDesc(sourceId, PageRequest.of(0, limit));
    }

    /**
     * Articles fetched within the last {@code days} days, newest first.
     */
    public List<Article> fetchedWithin(int days) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(days));
        return articleRepository.findByFetchedAtGreaterThanEqualOrderByFetchedAtDesc(cutoff);
    }
}
