package com.lux032.songresolver.model;

import lombok.Value;

/**
 * 候选歌曲及其评分
 */
@Value
public class Match {

    private static final Match SENTINEL = new Match(Song.UNKNOWN, new Score(0.0, 0, ReleaseTier.NONE));

    Song song;
    Score score;

    /**
     * 零值候选，保证选择总有结果，且永远无法通过置信度检查
     */
    public static Match sentinel() {
        return SENTINEL;
    }

    public boolean isSentinel() {
        return SENTINEL.equals(this);
    }
}
