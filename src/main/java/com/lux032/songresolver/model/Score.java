package com.lux032.songresolver.model;

import lombok.Value;

/**
 * 候选的综合评分
 */
@Value
public class Score {

    private static final int FILE_WEIGHT = 1000;

    double audio;  // 声学匹配度 0-1
    int file;      // 文件名相似度 0-100
    ReleaseTier release;

    /**
     * 候选排序键，文件名相似度优先，发行等级次之；声学匹配度不参与排序
     */
    public int rank() {
        return file * FILE_WEIGHT + release.ordinal();
    }
}
