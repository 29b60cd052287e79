package com.example.highlight_planner.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextFormatTest {

    @Test
    void readableDurations() {
        assertThat(DurationFormat.readable(3900)).isEqualTo("1h 5m");
        assertThat(DurationFormat.readable(750)).isEqualTo("12m 30s");
        assertThat(DurationFormat.readable(45)).isEqualTo("45s");
    }

    @Test
    void truncateEndsWithEllipsis() {
        assertThat(TitleText.truncate("short", 10)).isEqualTo("short");
        assertThat(TitleText.truncate("abc defgh", 7)).isEqualTo("abc...");
        assertThat(TitleText.truncate(null, 10)).isEmpty();
    }

    @Test
    void truncateKeepsEmojiWhole() {
        String title = "ab\uD83D\uDE00cdefgh";

        assertThat(TitleText.truncate(title, 6)).isEqualTo("ab...");
        assertThat(TitleText.truncate(title, 7)).isEqualTo("ab\uD83D\uDE00...");
    }
}
