package com.example.highlight_planner.scoring;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Share of prompt words (three letters or longer) that also occur in the transcript.
 */
@Component
public class KeywordOverlapPromptSimilarity implements PromptSimilarityScorer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    @Override
    public double similarity(String prompt, String transcript) {
        if (prompt == null || prompt.isBlank() || transcript == null || transcript.isBlank()) {
            return 0.0;
        }
        Set<String> promptTokens = tokens(prompt);
        if (promptTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> transcriptTokens = tokens(transcript);
        long hits = promptTokens.stream().filter(transcriptTokens::contains).count();
        return hits / (double) promptTokens.size();
    }

    static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() >= MIN_TOKEN_LENGTH) {
                out.add(raw);
            }
        }
        return out;
    }
}
