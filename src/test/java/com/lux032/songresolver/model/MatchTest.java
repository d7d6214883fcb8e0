package com.lux032.songresolver.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchTest {

    @Test
    @DisplayName("sentinel holds an empty song with zero scores")
    void sentinel() {
        Match sentinel = Match.sentinel();

        assertThat(sentinel.getSong()).isEqualTo(new Song("", "", ""));
        assertThat(sentinel.getScore()).isEqualTo(new Score(0.0, 0, ReleaseTier.NONE));
        assertThat(sentinel.isSentinel()).isTrue();
        assertThat(new Match(Song.UNKNOWN, new Score(0.0, 0, ReleaseTier.NONE)).isSentinel()).isTrue();
        assertThat(new Match(Song.UNKNOWN, new Score(0.5, 0, ReleaseTier.NONE)).isSentinel()).isFalse();
    }

    @Test
    @DisplayName("rank weights the file score above any release tier")
    void rank() {
        assertThat(new Score(0.9, 95, ReleaseTier.NONE).rank())
            .isGreaterThan(new Score(0.9, 94, ReleaseTier.ALBUM).rank());
        assertThat(new Score(0.1, 80, ReleaseTier.SINGLE).rank())
            .isGreaterThan(new Score(0.9, 80, ReleaseTier.COMPILATION).rank());
        assertThat(new Score(0.1, 80, ReleaseTier.SINGLE).rank())
            .isEqualTo(new Score(0.9, 80, ReleaseTier.SINGLE).rank());
    }

    @Test
    @DisplayName("song fields are never null")
    void songRejectsNull() {
        assertThatThrownBy(() -> new Song(null, "Title", "Album")).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("manual correction keeps previous values for blank fields")
    void manualCorrection() {
        Song guess = new Song("Artist", "Song", "Song - Single");

        assertThat(ManualCorrection.keepAll().applyTo(guess)).isEqualTo(guess);
        assertThat(new ManualCorrection("", "  ", "Real Album", false).applyTo(guess))
            .isEqualTo(new Song("Artist", "Song", "Real Album"));
        assertThat(new ManualCorrection("Other", null, null, true).applyTo(guess))
            .isEqualTo(new Song("Other", "Song", "Song - Single"));
    }

    @Test
    @DisplayName("fallback release carries the single suffix and the NONE tier")
    void fallbackRelease() {
        assertThat(Release.fallbackFor("Song")).isEqualTo(new Release("Song - Single", ReleaseTier.NONE));
    }
}
