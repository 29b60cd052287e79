package com.example.highlight_planner.service.split;

import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.KeywordHit;
import com.example.highlight_planner.util.TitleText;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based part titles: "A vs B" when two entities show up among the top keywords, a single
 * entity headline, a keyword headline, or the plain base title. Part index and date are always
 * appended.
 */
public class PartTitleGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    static final int TOP_CLIPS = 5;
    static final int KEYWORDS_PER_CLIP = 3;

    private final List<String> entities;
    private final boolean useEntities;
    private final int maxLength;

    public PartTitleGenerator(List<String> entities, boolean useEntities, int maxLength) {
        this.entities = entities == null ? List.of()
                : entities.stream().filter(e -> e != null && !e.isBlank())
                .map(e -> e.trim().toLowerCase(Locale.ROOT)).toList();
        this.useEntities = useEntities;
        this.maxLength = maxLength;
    }

    public String generate(List<Clip> partClips, int partNumber, int totalParts, LocalDate date, String baseTitle) {
        String base = baseTitle == null || baseTitle.isBlank() ? "Highlights" : baseTitle.trim();
        List<String> found = new ArrayList<>();
        List<String> regular = new ArrayList<>();
        collect(partClips, found, regular);

        String headline;
        if (useEntities && found.size() >= 2) {
            headline = found.get(0) + " vs " + found.get(1) + " - " + base;
        } else if (useEntities && found.size() == 1) {
            headline = found.get(0) + " - " + base;
        } else if (regular.size() >= 2) {
            headline = base + ": " + capitalize(regular.get(0)) + ", " + capitalize(regular.get(1));
        } else if (regular.size() == 1) {
            headline = base + ": " + capitalize(regular.get(0));
        } else {
            headline = base;
        }
        String title = headline + " | Part " + partNumber + "/" + totalParts;
        if (date != null) {
            title += " | " + DATE.format(date);
        }
        return TitleText.truncate(title, maxLength);
    }

    private void collect(List<Clip> partClips, List<String> found, List<String> regular) {
        List<Clip> top = new ArrayList<>(partClips);
        top.sort(Clip.BY_SCORE_DESC);
        for (Clip clip : top.subList(0, Math.min(TOP_CLIPS, top.size()))) {
            List<KeywordHit> hits = new ArrayList<>(clip.keywords());
            hits.sort(Comparator.comparingDouble(KeywordHit::weight).reversed().thenComparing(KeywordHit::token));
            for (KeywordHit hit : hits.subList(0, Math.min(KEYWORDS_PER_CLIP, hits.size()))) {
                String token = hit.token();
                if (isEntity(token)) {
                    String name = capitalize(token);
                    if (!found.contains(name)) {
                        found.add(name);
                    }
                } else if (!regular.contains(token)) {
                    regular.add(token);
                }
            }
        }
    }

    private boolean isEntity(String token) {
        if (entities.isEmpty()) {
            return Character.isUpperCase(token.codePointAt(0));
        }
        String lower = token.toLowerCase(Locale.ROOT);
        return entities.stream().anyMatch(lower::contains);
    }

    private static String capitalize(String token) {
        if (token.isEmpty()) {
            return token;
        }
        return token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1);
    }
}
