package com.jreinhal.haven.triage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tartarus.snowball.ext.FrenchStemmer;

/**
 * Flags French narratives that contain urgency-indicating vocabulary.
 *
 * Each word is reduced with the Snowball French stemmer and compared to a fixed list of
 * critical stems, by equality or prefix overlap in either direction. The result is
 * advisory; it never changes a report's urgency.
 */
@Component
public class KeywordTriageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(KeywordTriageAnalyzer.class);

    static final List<String> CRITICAL_STEMS = List.of(
            "sang",
            "frap",
            "violenc",
            "abus",
            "suicid",
            "arm",
            "dang",
            "urg",
            "peur",
            "mal",
            "mort",
            "battu");

    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final int MIN_TOKEN_LENGTH = 2;

    public TriageResult analyze(String text) {
        if (text == null || text.isBlank()) {
            return TriageResult.NONE;
        }
        String normalized = text.trim().toLowerCase(Locale.FRENCH);
        // Snowball stemmers keep state; one per call.
        FrenchStemmer stemmer = new FrenchStemmer();
        Set<String> matched = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(normalized);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() < MIN_TOKEN_LENGTH) {
                continue;
            }
            if (isCritical(stem(stemmer, token))) {
                matched.add(token);
            }
        }
        if (!matched.isEmpty()) {
            log.debug("Triage flagged {} critical term(s)", matched.size());
        }
        return new TriageResult(!matched.isEmpty(), new ArrayList<>(matched));
    }

    static String stem(FrenchStemmer stemmer, String token) {
        stemmer.setCurrent(token);
        stemmer.stem();
        return stemmer.getCurrent();
    }

    static boolean isCritical(String stem) {
        for (String root : CRITICAL_STEMS) {
            if (stem.equals(root) || stem.startsWith(root) || root.startsWith(stem)) {
                return true;
            }
        }
        return false;
    }
}
