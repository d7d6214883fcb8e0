package com.lux032.songresolver.model;

import lombok.Value;

/**
 * 由单个 release-group 分级得出的专辑信息
 */
@Value
public class Release {
    String title;
    ReleaseTier tier;

    /**
     * 没有可分级的 release-group 时使用的兜底专辑，等级低于 SINGLE
     */
    public static Release fallbackFor(String recordingTitle) {
        return new Release(recordingTitle + " - Single", ReleaseTier.NONE);
    }
}
