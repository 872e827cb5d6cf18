package com.tribune.aggregator.repository;

import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.SourceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface SourceRepository extends JpaRepository<Source, Long> {

    List<Source> findAllByEnabledTrue();

    /*
     * Health updates are single UPDATE statements so that concurrent writers cannot lose
     * increments. All right-hand sides read the pre-update row. The running total only grows
     * on success, so total / successes is the average per successful fetch.
     */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update Source s
           set s.lastFetchedAt = :now,
               s.lastSuccessAt = :now,
               s.consecutiveFailures = 0,
               s.status = com.tribune.aggregator.domain.enums.SourceStatus.ACTIVE,
               s.errorMessage = '',
               s.totalArticlesFetched = s.totalArticlesFetched + :count,
               s.averageArticlesPerFetch = cast(s.totalArticlesFetched + :count as Double)
                                           / (s.successfulFetches + 1),
               s.successfulFetches = s.successfulFetches + 1
           where s.id = :id
           """)
    int recordSuccess(@Param("id") Long id, @Param("now") Instant now, @Param("count") long count);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update Source s
           set s.lastFetchedAt = :now,
               s.consecutiveFailures = s.consecutiveFailures + 1,
               s.errorMessage = :message,
               s.status = case
                              when s.consecutiveFailures + 1 >= :threshold
                                  then com.tribune.aggregator.domain.enums.SourceStatus.ERROR
                              else s.status
                          end
           where s.id = :id
           """)
    int recordFailure(@Param("id") Long id,
                      @Param("now") Instant now,
                      @Param("message") String message,
                      @Param("threshold") int threshold);

    /*
     * Admin edits touch configuration columns only, so they never write back health
     * counters read before a concurrent run updated them.
     */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update Source s
           set s.name = :#{#src.name},
               s.url = :#{#src.url},
               s.strategy = :#{#src.strategy},
               s.selectors.articleContainer = :#{#src.selectors?.articleContainer},
               s.selectors.headline = :#{#src.selectors?.headline},
               s.selectors.link = :#{#src.selectors?.link},
               s.selectors.summary = :#{#src.selectors?.summary},
               s.selectors.image = :#{#src.selectors?.image},
               s.selectors.date = :#{#src.selectors?.date},
               s.category = :#{#src.category},
               s.updateFrequency = :#{#src.updateFrequency},
               s.priority = :#{#src.priority},
               s.notes = :#{#src.notes},
               s.updatedAt = :now
           where s.id = :#{#src.id}
           """)
    int updateConfiguration(@Param("src") Source src, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update Source s
           set s.enabled = :enabled,
               s.status = :status,
               s.updatedAt = :now
           where s.id = :id
           """)
    int updateEnabled(@Param("id") Long id,
                      @Param("enabled") boolean enabled,
                      @Param("status") SourceStatus status,
                      @Param("now") Instant now);
}
