package com.tribune.aggregator.domain.dto;

import java.util.List;

public record TextExtractionResult(
        boolean success,
        String fullText,
        List<String> paragraphs,
        int wordCount,
        String error
) {
    private static final int MIN_WORDS = 50;
    private static final int MIN_PARAGRAPHS = 2;

    public static TextExtractionResult of(List<String> paragraphs) {
        String text = String.join("\n\n", paragraphs);
        int words = text.isBlank() ? 0 : text.trim().split("\\s+").length;
        return new TextExtractionResult(true, text, List.copyOf(paragraphs), words, null);
    }

    public static TextExtractionResult failed(String error) {
        return new TextExtractionResult(false, "", List.of(), 0, error);
    }

    /** True when the extraction looks like a real article body rather than page chrome. */
    public boolean isUsable() {
        return success && !fullText.isBlank() && wordCount >= MIN_WORDS && paragraphs.size() >= MIN_PARAGRAPHS;
    }
}
