package com.tribune.aggregator.util;

import com.tribune.aggregator.domain.dto.SummaryResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExtractiveSummarizerTest {

    @Test
    void summarize_emptyText_fails() {
        SummaryResult r = ExtractiveSummarizer.shortSummary("   ");
        assertFalse(r.success());
        assertEquals("No text provided", r.error());
    }

    @Test
    void summarize_onlyShortFragments_fails() {
        SummaryResult r = ExtractiveSummarizer.shortSummary("Yes. No. Maybe so.");
        assertFalse(r.success());
        assertEquals("No sentences found", r.error());
    }

    @Test
    void splitIntoSentences_keepsAbbreviationsIntact() {
        List<String> sentences = ExtractiveSummarizer.splitIntoSentences(
                "Mr. Smith met Dr. Jones in the U.S. capital on Monday. The talks covered trade and tariffs! Short one.");

        assertThat(sentences).containsExactly(
                "Mr. Smith met Dr. Jones in the U.S. capital on Monday.",
                "The talks covered trade and tariffs."
        );
    }

    @Test
    void shortSummary_takesTwoSentences() {
        String text = "The city council approved the new budget late on Tuesday night. "
                + "Spending on parks will rise by ten percent next year. "
                + "Opposition members said the plan was rushed through.";

        SummaryResult r = ExtractiveSummarizer.shortSummary(text);

        assertTrue(r.success());
        assertEquals(SummaryResult.EXTRACTIVE, r.method());
        assertEquals("The city council approved the new budget late on Tuesday night. "
                + "Spending on parks will rise by ten percent next year.", r.summary());
        assertEquals(2, r.sentences().size());
    }

    @Test
    void summarize_addsSentencesUntilMinLength() {
        String text = "First sentence is fairly short here. Second sentence is also quite short. "
                + "Third sentence pushes the total length further.";

        SummaryResult r = ExtractiveSummarizer.summarize(text, 1, 500, 60);

        assertEquals(2, r.sentences().size());
        assertThat(r.summary().length()).isGreaterThanOrEqualTo(60);
    }

    @Test
    void summarize_tooLong_endsAtPeriodOrEllipsis() {
        String longSentence = "This sentence keeps going with many words about nothing in particular "
                + "and it never seems to end because it was written to be very long indeed";

        SummaryResult cut = ExtractiveSummarizer.summarize(longSentence, 1, 50, 10);
        assertTrue(cut.summary().endsWith("..."));
        assertThat(cut.summary().length()).isLessThanOrEqualTo(53);

        String twoSentences = "The first sentence is complete and tidy. The second sentence runs on and on past the limit.";
        SummaryResult atPeriod = ExtractiveSummarizer.summarize(twoSentences, 2, 60, 20);
        assertEquals("The first sentence is complete and tidy.", atPeriod.summary());
    }
}
