package com.lux032.songresolver.model;

import lombok.NonNull;
import lombok.Value;

/**
 * 最终确认的歌曲信息
 * 空字符串表示未知，字段永不为 null
 */
@Value
public class Song {

    public static final Song UNKNOWN = new Song("", "", "");

    @NonNull String artist;
    @NonNull String title;
    @NonNull String album;

    /**
     * 用于文件名相似度比较的 "艺术家 - 标题" 形式
     */
    public String displayName() {
        return artist + " - " + title;
    }
}
