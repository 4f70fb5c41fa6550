package com.jreinhal.haven.triage;

import java.util.List;

/**
 * Advisory triage outcome. {@code matchedWords} holds surface forms in first-occurrence order.
 */
public record TriageResult(boolean isCritical, List<String> matchedWords) {

    public static final TriageResult NONE = new TriageResult(false, List.of());

    public TriageResult {
        matchedWords = matchedWords == null ? List.of() : List.copyOf(matchedWords);
    }
}
