package com.lux032.songresolver.model;

import lombok.Value;

import java.util.List;

/**
 * 指纹查询返回的一条录音候选
 */
@Value
public class Recording {
    String artist;
    String title;
    List<Release> releases;

    public String displayName() {
        return artist + " - " + title;
    }
}
