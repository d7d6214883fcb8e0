package com.lux032.songresolver.core;

import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.service.AcoustIdClient;
import com.lux032.songresolver.service.AcoustIdCorrectionSubmitter;
import com.lux032.songresolver.service.AudioFingerprintService;
import com.lux032.songresolver.service.BatchResolver;
import com.lux032.songresolver.service.CandidateExtractor;
import com.lux032.songresolver.service.ConfidenceGate;
import com.lux032.songresolver.service.ConsoleCorrectionPrompt;
import com.lux032.songresolver.service.CorrectionPrompt;
import com.lux032.songresolver.service.FileRelocationService;
import com.lux032.songresolver.service.MatchSelector;
import com.lux032.songresolver.service.ReleaseClassifier;
import com.lux032.songresolver.service.ResolutionWorkflow;
import com.lux032.songresolver.service.TagWriterService;
import com.lux032.songresolver.util.FilenameScorer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 应用程序生命周期管理器
 * 负责按依赖顺序创建和关闭所有服务
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final ResolverConfig config;

    private AudioFingerprintService fingerprintService;
    private AcoustIdClient acoustIdClient;
    private ResolutionWorkflow workflow;
    private BatchResolver batchResolver;

    public ApplicationLifecycleManager(ResolverConfig config) {
        this.config = config;
    }

    /**
     * 使用控制台交互初始化所有服务
     */
    public void initializeServices() {
        initializeServices(new ConsoleCorrectionPrompt(config.canSubmitCorrections()));
    }

    public void initializeServices(CorrectionPrompt correctionPrompt) {
        log.info("初始化服务 (分级方案: {})", config.getTierScheme());

        // Level 1: 外部工具与网络客户端
        fingerprintService = new AudioFingerprintService(config);
        acoustIdClient = new AcoustIdClient(config);

        // Level 2: 识别核心
        ReleaseClassifier releaseClassifier = new ReleaseClassifier(config);
        CandidateExtractor candidateExtractor = new CandidateExtractor(releaseClassifier);
        MatchSelector matchSelector = new MatchSelector(new FilenameScorer(), releaseClassifier);
        ConfidenceGate confidenceGate = new ConfidenceGate(config);
        workflow = new ResolutionWorkflow(
            config,
            candidateExtractor,
            matchSelector,
            confidenceGate,
            correctionPrompt,
            new AcoustIdCorrectionSubmitter(fingerprintService, acoustIdClient)
        );

        // Level 3: 批处理
        batchResolver = new BatchResolver(
            fingerprintService,
            acoustIdClient,
            workflow,
            new FileRelocationService(config),
            new TagWriterService(),
            config.getParallelism()
        );

        log.info("所有服务已就绪");
    }

    public boolean isFpcalcAvailable() {
        return fingerprintService.isFpcalcAvailable();
    }

    /**
     * 关闭所有服务
     */
    public void shutdown() {
        if (acoustIdClient != null) {
            try {
                acoustIdClient.close();
            } catch (IOException e) {
                log.warn("关闭 AcoustID 客户端失败", e);
            }
        }
        log.debug("服务已关闭");
    }
}
