package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.KeywordHit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Numbers the final clips chronologically and gives each a keyword title.
 */
@Component
public class ClipLabeler {

    static final String FALLBACK_TITLE = "Highlight";
    static final String SEPARATOR = " • ";

    public List<Clip> label(List<Clip> clips) {
        List<Clip> ordered = new ArrayList<>(clips);
        ordered.sort(Clip.BY_START);
        List<Clip> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Clip clip = ordered.get(i);
            String clipId = String.format(Locale.ROOT, "clip_%03d", i + 1);
            out.add(clip.withLabel(clipId, keywordTitle(clip.keywords(), 3, FALLBACK_TITLE)));
        }
        return out;
    }

    /**
     * Top {@code limit} distinct keywords by weight joined by " • ", or {@code fallback}.
     */
    public static String keywordTitle(List<KeywordHit> keywords, int limit, String fallback) {
        if (keywords == null || keywords.isEmpty()) {
            return fallback;
        }
        Set<String> tokens = keywords.stream()
                .sorted(Comparator.comparingDouble(KeywordHit::weight).reversed().thenComparing(KeywordHit::token))
                .map(KeywordHit::token)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return tokens.stream().limit(limit).collect(Collectors.joining(SEPARATOR));
    }
}
