package com.lux032.songresolver.service;

import com.lux032.songresolver.model.AudioFingerprint;
import com.lux032.songresolver.model.CorrectionSubmission;
import com.lux032.songresolver.model.Song;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 重新计算指纹并提交到 AcoustID
 */
@Slf4j
public class AcoustIdCorrectionSubmitter implements CorrectionSubmitter {

    private final AudioFingerprintService fingerprintService;
    private final AcoustIdClient acoustIdClient;

    public AcoustIdCorrectionSubmitter(AudioFingerprintService fingerprintService, AcoustIdClient acoustIdClient) {
        this.fingerprintService = fingerprintService;
        this.acoustIdClient = acoustIdClient;
    }

    @Override
    public void submit(Path audioFile, Song song) throws IOException, InterruptedException {
        AudioFingerprint fingerprint = fingerprintService.generateFingerprint(audioFile);
        CorrectionSubmission submission = CorrectionSubmission.of(fingerprint, song, fileFormat(audioFile));
        log.info("提交修正: {} -> {}", audioFile.getFileName(), song.displayName());
        acoustIdClient.submit(submission);
    }

    static String fileFormat(Path audioFile) {
        String name = audioFile.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(dotIndex + 1).toUpperCase(Locale.ROOT) : "";
    }
}
