package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.sampler.DistributionSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SerendipityService {

    private final ArticleService articleService;
    private final DistributionSampler distributionSampler;

    @Value("${serendipity.default-count:30}")
    private int defaultCount;

    @Value("${serendipity.window-days:3}")
    private int defaultWindowDays;

    public List<Article> serendipity(Integer count, Integer windowDays) {
        int target = count != null ? count : defaultCount;
        int days = windowDays != null ? windowDays : defaultWindowDays;
        if (target < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1");
        }

        List<Article> pool = articleService.fetchedWithin(days);
        List<Article> picked = distributionSampler.sample(pool, target);
        log.info("Serendipity: pool={} days={} target={} returned={}", pool.size(), days, target, picked.size());
        return picked;
    }
}
