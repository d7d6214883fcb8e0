package com.lux032.songresolver.model;

import lombok.Value;

/**
 * 人工修正输入，空白字段表示保留原值
 */
@Value
public class ManualCorrection {

    private static final ManualCorrection KEEP = new ManualCorrection(null, null, null, false);

    String artist;
    String title;
    String album;
    boolean submit;  // 是否将修正结果提交到 AcoustID

    public static ManualCorrection keepAll() {
        return KEEP;
    }

    public Song applyTo(Song song) {
        return new Song(
            pick(artist, song.getArtist()),
            pick(title, song.getTitle()),
            pick(album, song.getAlbum()));
    }

    private static String pick(String override, String previous) {
        return (override == null || override.isBlank()) ? previous : override.trim();
    }
}
