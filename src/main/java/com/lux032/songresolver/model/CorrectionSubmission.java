package com.lux032.songresolver.model;

import lombok.Value;

/**
 * 提交到 AcoustID 的众包修正数据
 */
@Value
public class CorrectionSubmission {
    int duration;
    String fingerprint;
    String artist;
    String track;
    String album;
    String albumArtist;
    String fileFormat;

    public static CorrectionSubmission of(AudioFingerprint fingerprint, Song song, String fileFormat) {
        return new CorrectionSubmission(
            fingerprint.getDuration(),
            fingerprint.getFingerprint(),
            song.getArtist(),
            song.getTitle(),
            song.getAlbum(),
            song.getArtist(),
            fileFormat);
    }
}
