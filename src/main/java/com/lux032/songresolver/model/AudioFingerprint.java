package com.lux032.songresolver.model;

import lombok.Value;

/**
 * fpcalc 生成的音频指纹
 */
@Value
public class AudioFingerprint {
    int duration; // 时长（秒）
    String fingerprint;
}
