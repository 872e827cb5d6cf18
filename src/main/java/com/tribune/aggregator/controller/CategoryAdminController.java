package com.tribune.aggregator.controller;

import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.service.CategoryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/admin/categories")
@RequiredArgsConstructor
public class CategoryAdminController {

    private final CategoryService categoryService;

    @GetMapping
    public ResponseEntity<List<CategoryResponse>> listCategories() {
        return ResponseEntity.ok(categoryService.loadRuleSet().stream().map(CategoryResponse::from).toList());
    }

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(@RequestBody @Valid CategoryCreateRequest request) {
        Category category = Category.builder()
                .name(request.name())
                .slug(request.slug())
                .description(request.description() != null ? request.description() : "")
                .keywords(request.keywords() != null ? new HashSet<>(request.keywords()) : new HashSet<>())
                .sourceIds(request.sourceIds() != null ? new HashSet<>(request.sourceIds()) : new HashSet<>())
                .domains(request.domains() != null ? new HashSet<>(request.domains()) : new HashSet<>())
                .displayOrder(request.displayOrder() != null ? request.displayOrder() : 0)
                .build();
        return ResponseEntity.ok(CategoryResponse.from(categoryService.create(category)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteCategory(@PathVariable("id") Long id) {
        categoryService.delete(id);
        return ResponseEntity.noContent().build();
    }

    public record CategoryCreateRequest(
            @NotBlank String name,
            @NotBlank @Pattern(regexp = "[a-z0-9]+(-[a-z0-9]+)*") String slug,
            String description,
            Set<String> keywords,
            Set<Long> sourceIds,
            Set<String> domains,
            Integer displayOrder
    ) {}

    public record CategoryResponse(
            Long id,
            String name,
            String slug,
            String description,
            Set<String> keywords,
            Set<Long> sourceIds,
            Set<String> domains,
            int displayOrder,
            Instant createdAt
    ) {
        static CategoryResponse from(Category c) {
            return new CategoryResponse(
                    c.getId(),
                    c.getName(),
                    c.getSlug(),
                    c.getDescription(),
                    Set.copyOf(c.getKeywords()),
                    Set.copyOf(c.getSourceIds()),
                    Set.copyOf(c.getDomains()),
                    c.getDisplayOrder(),
                    c.getCreatedAt()
            );
        }
    }
}
