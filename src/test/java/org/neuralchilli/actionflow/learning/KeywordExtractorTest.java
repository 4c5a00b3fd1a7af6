package org.neuralchilli.actionflow.learning;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordExtractorTest {

    @Test
    void shouldExtractSortedKeywordsWithoutStopwords() {
        Set<String> keywords = KeywordExtractor.extract("Share the Q3 Report with the Finance team, and email it!");

        assertThat(keywords).containsExactly("email", "finance", "report", "share", "team");
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertThat(KeywordExtractor.extract(null)).isEmpty();
        assertThat(KeywordExtractor.extract("   ")).isEmpty();
        assertThat(KeywordExtractor.extract("to be or it")).isEmpty();
    }

    @Test
    void shouldComputeJaccardSimilarity() {
        Set<String> request = Set.of("share", "report", "finance");

        assertThat(KeywordExtractor.jaccard(request, Set.of("share", "report", "finance"))).isEqualTo(1.0);
        assertThat(KeywordExtractor.jaccard(request, Set.of("calendar", "meeting"))).isEqualTo(0.0);
        assertThat(KeywordExtractor.jaccard(request, Set.of("share", "report", "team", "email")))
                .isCloseTo(2.0 / 5.0, within(1e-9));
    }

    @Test
    void shouldTreatEmptySetsAsDissimilar() {
        assertThat(KeywordExtractor.jaccard(Set.of(), Set.of())).isZero();
        assertThat(KeywordExtractor.jaccard(Set.of("share"), Set.of())).isZero();
    }
}
