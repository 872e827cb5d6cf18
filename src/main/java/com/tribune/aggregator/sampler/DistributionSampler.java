package com.tribune.aggregator.sampler;

import com.tribune.aggregator.domain.entity.Article;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Source-balanced random selection. Each source gets an equal quota of the target, the
 * first {@code target % sources} sources (in order of first appearance in the pool) one
 * extra; quota a source cannot fill is drawn from the articles other sources did not
 * contribute. Inputs are never modified, and all randomness comes from the injected
 * {@link Random}, so a seeded instance gives reproducible output.
 */
@Slf4j
@Component
public class DistributionSampler {

    private final Random random;

    public DistributionSampler(@Qualifier("serendipityRandom") Random random) {
        this.random = random;
    }

    public List<Article> sample(List<Article> pool, int target) {
        if (target <= 0 || pool == null || pool.isEmpty()) {
            return List.of();
        }
        if (pool.size() <= target) {
            return shuffled(pool);
        }

        Map<Long, List<Article>> bySource = new LinkedHashMap<>();
        for (Article article : pool) {
            bySource.computeIfAbsent(article.getSourceId(), k -> new ArrayList<>()).add(article);
        }

        int sourceCount = bySource.size();
        int perSource = target / sourceCount;
        int remainder = target % sourceCount;
        log.debug("Sampler: pool={} target={} sources={} perSource={} remainder={}",
                pool.size(), target, sourceCount, perSource, remainder);

        List<Article> selected = new ArrayList<>(target);
        Map<String, Article> leftovers = new LinkedHashMap<>();

        int visited = 0;
        for (Map.Entry<Long, List<Article>> entry : bySource.entrySet()) {
            int quota = visited < remainder ? perSource + 1 : perSource;
            List<Article> taken = shuffled(entry.getValue()).subList(0, Math.min(quota, entry.getValue().size()));
            selected.addAll(taken);

            if (taken.size() < quota) {
                log.debug("Sampler: sourceId={} short by {}", entry.getKey(), quota - taken.size());
                for (Map.Entry<Long, List<Article>> other : bySource.entrySet()) {
                    if (Objects.equals(other.getKey(), entry.getKey())) continue;
                    for (Article a : other.getValue()) {
                        leftovers.putIfAbsent(a.getId(), a);
                    }
                }
            }
            visited++;
        }

        int needed = target - selected.size();
        if (needed > 0 && !leftovers.isEmpty()) {
            Set<String> selectedIds = new HashSet<>();
            for (Article a : selected) selectedIds.add(a.getId());

            List<Article> available = leftovers.values().stream()
                    .filter(a -> !selectedIds.contains(a.getId()))
                    .toList();
            List<Article> fill = shuffled(available);
            selected.addAll(fill.subList(0, Math.min(needed, fill.size())));
        }

        List<Article> result = shuffled(selected);
        return result.size() > target ? new ArrayList<>(result.subList(0, target)) : result;
    }

    /**
     * Uniform random subset of {@code count} articles, ignoring sources.
     */
    public List<Article> randomSample(List<Article> pool, int count) {
        if (count <= 0 || pool == null || pool.isEmpty()) {
            return List.of();
        }
        List<Article> all = shuffled(pool);
        return all.size() > count ? new ArrayList<>(all.subList(0, count)) : all;
    }

    private <T> List<T> shuffled(List<T> items) {
        List<T> copy = new ArrayList<>(items);
        Collections.shuffle(copy, random);
        return copy;
    }
}
