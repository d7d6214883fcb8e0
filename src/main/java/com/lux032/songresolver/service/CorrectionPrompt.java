package com.lux032.songresolver.service;

import com.lux032.songresolver.model.ManualCorrection;
import com.lux032.songresolver.model.Song;

/**
 * 人工修正的请求/响应步骤
 */
public interface CorrectionPrompt {

    /**
     * 向用户展示当前最佳猜测并获取修正
     *
     * @param fileName 音频文件名
     * @param bestGuess 当前最佳候选
     * @param confident 最佳候选是否通过了置信度检查（强制人工确认时可能为 true）
     * @return 修正内容，不修正时返回 {@link ManualCorrection#keepAll()}
     */
    ManualCorrection requestCorrection(String fileName, Song bestGuess, boolean confident);
}
