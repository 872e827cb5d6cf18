package com.tribune.aggregator.util;

import com.tribune.aggregator.domain.dto.SummaryResult;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lead-sentence summaries: take the first sentences of a body text and bound the length.
 */
@UtilityClass
public class ExtractiveSummarizer {

    private static final List<String> ABBREVIATIONS = List.of(
            "Mrs.", "Mr.", "Ms.", "Dr.", "Inc.", "Ltd.", "Jr.", "Sr.", "U.S.", "U.K.", "etc."
    );

    // Stands in for an abbreviation's dots while splitting.
    private static final char DOT = '\u0000';

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final int MIN_SENTENCE_LENGTH = 20;

    public SummaryResult shortSummary(String text) {
        return summarize(text, 2, 200, 80);
    }

    public SummaryResult mediumSummary(String text) {
        return summarize(text, 3, 300, 150);
    }

    public SummaryResult summarize(String text, int sentenceCount, int maxLength, int minLength) {
        if (text == null || text.isBlank()) {
            return SummaryResult.failed("No text provided");
        }

        List<String> sentences = splitIntoSentences(text);
        if (sentences.isEmpty()) {
            return SummaryResult.failed("No sentences found");
        }

        List<String> selected = new ArrayList<>(sentences.subList(0, Math.min(sentenceCount, sentences.size())));
        String summary = String.join(" ", selected);

        while (summary.length() < minLength && selected.size() < sentences.size()) {
            selected.add(sentences.get(selected.size()));
            summary = String.join(" ", selected);
        }

        if (summary.length() > maxLength) {
            summary = summary.substring(0, maxLength).trim();
            int lastPeriod = summary.lastIndexOf('.');
            if (lastPeriod > minLength) {
                summary = summary.substring(0, lastPeriod + 1);
            } else {
                summary = summary + "...";
            }
        }

        return new SummaryResult(true, summary.trim(), List.copyOf(selected), SummaryResult.EXTRACTIVE, null);
    }

    List<String> splitIntoSentences(String text) {
        String protectedText = text;
        for (String abbreviation : ABBREVIATIONS) {
            protectedText = protectedText.replace(abbreviation, abbreviation.replace('.', DOT));
        }

        return Arrays.stream(SENTENCE_END.split(protectedText))
                .map(String::trim)
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .map(s -> s.replace(DOT, '.'))
                .map(s -> s.endsWith(".") || s.endsWith("!") || s.endsWith("?") ? s : s + ".")
                .toList();
    }
}
