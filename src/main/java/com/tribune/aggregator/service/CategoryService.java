package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.exception.NotFoundException;
import com.tribune.aggregator.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    static final String UNCATEGORIZED_NAME = "Uncategorized";
    static final int UNCATEGORIZED_ORDER = 999;

    private final CategoryRepository categoryRepository;

    private volatile boolean sentinelExists;

    /**
     * Rule set as of now, in display order. Callers load this once per run.
     */
    public List<Category> loadRuleSet() {
        return categoryRepository.findAllByOrderByDisplayOrderAsc();
    }

    /**
     * Returns the sentinel's slug, creating the row on first use. Concurrent callers may both
     * try to insert; the unique slug lets exactly one win and the other re-reads.
     */
    public String getOrCreateUncategorized() {
        if (sentinelExists) {
            return Category.UNCATEGORIZED_SLUG;
        }

        if (categoryRepository.findBySlug(Category.UNCATEGORIZED_SLUG).isEmpty()) {
            Category sentinel = Category.builder()
                    .name(UNCATEGORIZED_NAME)
                    .slug(Category.UNCATEGORIZED_SLUG)
                    .description("Articles that match no category rule")
                    .displayOrder(UNCATEGORIZED_ORDER)
                    .build();
            try {
                categoryRepository.saveAndFlush(sentinel);
                log.info("Categories: created sentinel slug={}", Category.UNCATEGORIZED_SLUG);
            } catch (DataIntegrityViolationException race) {
                log.debug("Categories: sentinel created concurrently, re-reading");
                categoryRepository.findBySlug(Category.UNCATEGORIZED_SLUG)
                        .orElseThrow(() -> new IllegalStateException("Sentinel category missing after conflict", race));
            }
        }

        sentinelExists = true;
        return Category.UNCATEGORIZED_SLUG;
    }

    public Category create(Category category) {
        if (categoryRepository.findBySlug(category.getSlug()).isPresent()) {
            throw new IllegalArgumentException("Category slug already exists: " + category.getSlug());
        }
        try {
            return categoryRepository.save(category);
        } catch (DataIntegrityViolationException e) {
            throw new IllegalArgumentException("Category slug already exists: " + category.getSlug());
        }
    }

    public void delete(Long id) {
        Category category = categoryRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Category not found: " + id));
        if (category.isSentinel()) {
            throw new IllegalArgumentException("The uncategorized category cannot be deleted");
        }
        categoryRepository.delete(category);
    }
}
