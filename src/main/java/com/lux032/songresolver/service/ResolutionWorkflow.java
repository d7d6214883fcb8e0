package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.LookupResult;
import com.lux032.songresolver.model.ManualCorrection;
import com.lux032.songresolver.model.Match;
import com.lux032.songresolver.model.Resolution;
import com.lux032.songresolver.model.ResolutionState;
import com.lux032.songresolver.model.Song;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 单个文件的识别流程
 * LOOKED_UP -> AUTO_ACCEPTED | NEEDS_REVIEW -> SKIPPED | MANUALLY_CORRECTED
 */
@Slf4j
public class ResolutionWorkflow {

    private final CandidateExtractor candidateExtractor;
    private final MatchSelector matchSelector;
    private final ConfidenceGate confidenceGate;
    private final CorrectionPrompt correctionPrompt;
    private final CorrectionSubmitter correctionSubmitter;
    private final boolean skipUnconfident;
    private final boolean forceManual;

    public ResolutionWorkflow(ResolverConfig config,
                              CandidateExtractor candidateExtractor,
                              MatchSelector matchSelector,
                              ConfidenceGate confidenceGate,
                              CorrectionPrompt correctionPrompt,
                              CorrectionSubmitter correctionSubmitter) {
        this.candidateExtractor = candidateExtractor;
        this.matchSelector = matchSelector;
        this.confidenceGate = confidenceGate;
        this.correctionPrompt = correctionPrompt;
        this.correctionSubmitter = correctionSubmitter;
        this.skipUnconfident = config.isSkipUnconfident();
        this.forceManual = config.isForceManual();
    }

    /**
     * 完整流程：选出最佳候选、检查置信度，必要时跳过或人工修正
     */
    public Resolution resolve(Path audioFile, JsonNode response) {
        Resolution resolution = decide(lookedUp(audioFile.getFileName().toString(), response));
        if (resolution.getState() == ResolutionState.NEEDS_REVIEW) {
            resolution = review(resolution, audioFile);
        }
        return resolution;
    }

    /**
     * 解析查询响应并选出最佳候选
     */
    public Resolution lookedUp(String fileName, JsonNode response) {
        List<LookupResult> results = candidateExtractor.extract(response);
        Match match = matchSelector.select(results, fileName);
        boolean confident = confidenceGate.isConfident(match);
        log.info("{} --> {} [{}] (文件名相似度: {}, 声学匹配度: {}, 发行等级: {}, 可信: {})",
            fileName, match.getSong().displayName(), match.getSong().getAlbum(),
            match.getScore().getFile(), match.getScore().getAudio(), match.getScore().getRelease(), confident);
        return new Resolution(fileName, match, confident, ResolutionState.LOOKED_UP, match.getSong());
    }

    public Resolution decide(Resolution resolution) {
        requireState(resolution, ResolutionState.LOOKED_UP);
        if (resolution.isConfident() && !forceManual) {
            return resolution.withState(ResolutionState.AUTO_ACCEPTED);
        }
        if (resolution.isConfident()) {
            log.debug("已启用强制人工确认: {}", resolution.getFileName());
        } else {
            log.warn("识别置信度低: {}", resolution.getFileName());
        }
        return resolution.withState(ResolutionState.NEEDS_REVIEW);
    }

    /**
     * 处理待人工确认的结果：跳过，或请求人工修正并按需提交修正
     */
    public Resolution review(Resolution resolution, Path audioFile) {
        requireState(resolution, ResolutionState.NEEDS_REVIEW);
        if (skipUnconfident) {
            log.info("跳过低置信度匹配: {}", resolution.getFileName());
            return resolution.withState(ResolutionState.SKIPPED);
        }

        ManualCorrection correction = correctionPrompt.requestCorrection(
            resolution.getFileName(), resolution.getSong(), resolution.isConfident());
        Song corrected = correction.applyTo(resolution.getSong());
        log.debug("使用人工修正后的歌曲信息: {}", corrected);

        if (correction.isSubmit()) {
            submitQuietly(audioFile, corrected);
        }
        return resolution.withSong(corrected).withState(ResolutionState.MANUALLY_CORRECTED);
    }

    /**
     * 提交失败不影响本次结果
     */
    private void submitQuietly(Path audioFile, Song song) {
        try {
            correctionSubmitter.submit(audioFile, song);
        } catch (IOException e) {
            log.warn("提交修正到 AcoustID 失败: {} - {}", audioFile.getFileName(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("提交修正被中断: {}", audioFile.getFileName());
        } catch (RuntimeException e) {
            log.warn("提交修正到 AcoustID 失败: {}", audioFile.getFileName(), e);
        }
    }

    private static void requireState(Resolution resolution, ResolutionState expected) {
        if (resolution.getState() != expected) {
            throw new IllegalStateException(
                "无效的状态转换: " + resolution.getState() + " (期望 " + expected + ")");
        }
    }
}
