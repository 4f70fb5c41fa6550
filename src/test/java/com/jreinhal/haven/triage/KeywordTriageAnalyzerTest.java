package com.jreinhal.haven.triage;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class KeywordTriageAnalyzerTest {

    private final KeywordTriageAnalyzer analyzer = new KeywordTriageAnalyzer();

    @Test
    @DisplayName("Should flag critical words in first-occurrence order")
    void flagsCriticalWords() {
        TriageResult result = analyzer.analyze("L'enfant a peur et a été battu");

        assertThat(result.isCritical()).isTrue();
        assertThat(result.matchedWords()).containsExactly("peur", "battu");
    }

    @Test
    void matchesInflectedForms() {
        TriageResult result = analyzer.analyze("Il y a eu des VIOLENCES et du sang");

        assertThat(result.isCritical()).isTrue();
        assertThat(result.matchedWords()).contains("violences", "sang");
    }

    @Test
    void reportsEachSurfaceFormOnce() {
        assertThat(analyzer.analyze("peur, peur et encore peur").matchedWords()).containsExactly("peur");
    }

    @Test
    void neutralTextIsNotCritical() {
        TriageResult result = analyzer.analyze("Le repas était bon");

        assertThat(result.isCritical()).isFalse();
        assertThat(result.matchedWords()).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankInputIsNone(String text) {
        assertThat(analyzer.analyze(text)).isEqualTo(TriageResult.NONE);
    }
}
