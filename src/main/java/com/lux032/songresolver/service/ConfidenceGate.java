package com.lux032.songresolver.service;

import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.Match;
import com.lux032.songresolver.model.ReleaseTier;
import com.lux032.songresolver.model.Score;

/**
 * 置信度检查
 * 声学匹配度、文件名相似度、发行等级三项必须同时达到阈值
 * 零值候选在任何阈值下都不通过
 */
public class ConfidenceGate {

    private final double minAudioScore;
    private final int minFileScore;
    private final ReleaseTier minReleaseTier;

    public ConfidenceGate(ResolverConfig config) {
        this(config.getMinAudioScore(), config.getMinFileScore(), config.getMinReleaseTier());
    }

    public ConfidenceGate(double minAudioScore, int minFileScore, ReleaseTier minReleaseTier) {
        this.minAudioScore = minAudioScore;
        this.minFileScore = minFileScore;
        this.minReleaseTier = minReleaseTier;
    }

    public boolean isConfident(Match match) {
        if (match.isSentinel()) {
            return false;
        }
        Score score = match.getScore();
        return score.getAudio() >= minAudioScore
            && score.getFile() >= minFileScore
            && score.getRelease().isAtLeast(minReleaseTier);
    }
}
