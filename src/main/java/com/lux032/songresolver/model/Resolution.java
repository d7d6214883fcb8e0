package com.lux032.songresolver.model;

import lombok.Value;
import lombok.With;

/**
 * 单个文件的识别结果
 * song 为当前采用的歌曲信息，初始为最佳候选，人工修正后替换
 */
@Value
@With
public class Resolution {
    String fileName;
    Match match;
    boolean confident;
    ResolutionState state;
    Song song;

    /**
     * SKIPPED 以外的终态都会交给标签写入
     */
    public boolean hasFinalSong() {
        return state.isTerminal() && state != ResolutionState.SKIPPED;
    }
}
