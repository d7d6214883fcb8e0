package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.songresolver.model.AudioFingerprint;
import com.lux032.songresolver.model.BatchReport;
import com.lux032.songresolver.model.FileOutcome;
import com.lux032.songresolver.model.Resolution;
import com.lux032.songresolver.model.ResolutionState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 批量识别服务
 * 每个文件独立处理：生成指纹 -> 查询 -> 识别流程 -> 移动文件并写入标签
 * 单个文件失败只记录日志，不中断整个批次
 */
@Slf4j
public class BatchResolver {

    private final AudioFingerprintService fingerprintService;
    private final AcoustIdClient acoustIdClient;
    private final ResolutionWorkflow workflow;
    private final FileRelocationService relocationService;
    private final TagWriterService tagWriter;
    private final int parallelism;

    public BatchResolver(AudioFingerprintService fingerprintService,
                         AcoustIdClient acoustIdClient,
                         ResolutionWorkflow workflow,
                         FileRelocationService relocationService,
                         TagWriterService tagWriter,
                         int parallelism) {
        this.fingerprintService = fingerprintService;
        this.acoustIdClient = acoustIdClient;
        this.workflow = workflow;
        this.relocationService = relocationService;
        this.tagWriter = tagWriter;
        this.parallelism = Math.max(1, parallelism);
    }

    public BatchReport resolveAll(List<Path> audioFiles) throws InterruptedException {
        log.info("开始处理 {} 个文件 (并行度: {})", audioFiles.size(), parallelism);
        List<FileOutcome> outcomes = parallelism == 1
            ? resolveSequentially(audioFiles)
            : resolveConcurrently(audioFiles);

        BatchReport report = new BatchReport(outcomes);
        log.info("处理完成 - 成功: {}/{}, 自动接受: {}, 人工修正: {}, 跳过: {}",
            report.countSuccessful(), outcomes.size(),
            report.countInState(ResolutionState.AUTO_ACCEPTED),
            report.countInState(ResolutionState.MANUALLY_CORRECTED),
            report.countInState(ResolutionState.SKIPPED));
        return report;
    }

    private List<FileOutcome> resolveSequentially(List<Path> audioFiles) throws InterruptedException {
        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path audioFile : audioFiles) {
            outcomes.add(resolveFile(audioFile));
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("批处理被中断");
            }
        }
        return outcomes;
    }

    private List<FileOutcome> resolveConcurrently(List<Path> audioFiles) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path audioFile : audioFiles) {
                futures.add(executor.submit(() -> resolveFile(audioFile)));
            }
            List<FileOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Path audioFile = audioFiles.get(i);
                    log.error("处理文件失败: {}", audioFile.getFileName(), e.getCause());
                    outcomes.add(FileOutcome.failed(audioFile, null, String.valueOf(e.getCause())));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 处理单个文件，所有异常都转换为失败结果
     */
    public FileOutcome resolveFile(Path audioFile) {
        log.info("开始处理文件: {}", audioFile);
        Resolution resolution = null;
        try {
            AudioFingerprint fingerprint = fingerprintService.generateFingerprint(audioFile);
            JsonNode response = acoustIdClient.lookup(fingerprint);
            resolution = workflow.resolve(audioFile, response);

            Path destination;
            if (resolution.getState() == ResolutionState.SKIPPED) {
                destination = relocationService.moveToSkipped(audioFile);
            } else {
                destination = relocationService.relocateResolved(audioFile, resolution.getSong());
                tagWriter.writeTags(destination, resolution.getSong());
                log.info("结果已写入: {}", destination);
            }
            return FileOutcome.completed(audioFile, destination, resolution);

        } catch (IOException e) {
            log.error("处理文件失败: {} - {}", audioFile.getFileName(), e.getMessage(), e);
            return FileOutcome.failed(audioFile, resolution, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("处理文件被中断: {}", audioFile.getFileName());
            return FileOutcome.failed(audioFile, resolution, "interrupted");
        } catch (RuntimeException e) {
            log.error("处理文件失败: {}", audioFile.getFileName(), e);
            return FileOutcome.failed(audioFile, resolution, e.toString());
        }
    }
}
