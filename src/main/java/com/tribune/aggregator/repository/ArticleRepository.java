package com.tribune.aggregator.repository;

import com.tribune.aggregator.domain.entity.Article;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ArticleRepository extends JpaRepository<Article, String> {

    List<Article> findByFetchedAtGreaterThanEqualOrderByFetchedAtDesc(Instant cutoff);

    List<Article> findBySourceIdOrderByFetchedAtDesc(Long sourceId, Pageable pageable);

    List<Article> findAllByOrderByFetchedAtDesc(Pageable pageable);

    // Derived delete loads each row so the category collection rows go with it.
    @Transactional
    long deleteByFetchedAtBefore(Instant cutoff);
}
