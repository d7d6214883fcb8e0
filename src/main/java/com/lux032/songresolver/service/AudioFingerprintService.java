package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.AudioFingerprint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * 音频指纹服务
 * 使用 fpcalc (Chromaprint) 生成音频指纹
 */
@Slf4j
public class AudioFingerprintService {

    private static final long FPCALC_TIMEOUT_SECONDS = 120;
    private static final long VERSION_CHECK_TIMEOUT_SECONDS = 10;

    private final String fpcalcPath;
    private final long timeoutSeconds;
    private final ObjectMapper objectMapper;

    public AudioFingerprintService(ResolverConfig config) {
        this(config, FPCALC_TIMEOUT_SECONDS);
    }

    AudioFingerprintService(ResolverConfig config, long timeoutSeconds) {
        this.fpcalcPath = config.getFpcalcPath();
        this.timeoutSeconds = timeoutSeconds;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 生成音频指纹
     */
    public AudioFingerprint generateFingerprint(Path audioFile) throws IOException, InterruptedException {
        if (!Files.isRegularFile(audioFile)) {
            throw new FingerprintException("音频文件不存在: " + audioFile.toAbsolutePath());
        }

        // 输出写入临时文件，等待进程时才能真正受超时限制
        Path outputFile = Files.createTempFile("fpcalc-", ".json");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(
                fpcalcPath,
                "-json",
                audioFile.toAbsolutePath().toString()
            );
            processBuilder.redirectError(ProcessBuilder.Redirect.DISCARD);
            processBuilder.redirectOutput(outputFile.toFile());

            Process process;
            try {
                process = processBuilder.start();
            } catch (IOException e) {
                throw new FingerprintException("无法启动 fpcalc: " + fpcalcPath, e);
            }

            boolean finished;
            try {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new FingerprintException("fpcalc 执行超时: " + audioFile.getFileName());
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new FingerprintException("fpcalc 执行失败，退出码: " + exitCode);
            }

            AudioFingerprint fingerprint = parse(Files.readString(outputFile, StandardCharsets.UTF_8));
            log.info("成功生成音频指纹 - 文件: {}, 时长: {}秒", audioFile.getFileName(), fingerprint.getDuration());
            return fingerprint;
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    /**
     * 解析 fpcalc -json 输出
     */
    AudioFingerprint parse(String jsonOutput) throws FingerprintException {
        log.debug("fpcalc 输出: {}", jsonOutput);
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonOutput);
        } catch (IOException e) {
            throw new FingerprintException("fpcalc 输出无法解析", e);
        }
        String fingerprint = root.path("fingerprint").asText("");
        if (fingerprint.isEmpty()) {
            throw new FingerprintException("fpcalc 输出中缺少 fingerprint 字段");
        }
        // fpcalc 输出的时长是浮点数
        return new AudioFingerprint((int) root.path("duration").asDouble(), fingerprint);
    }

    /**
     * 检查 fpcalc 工具是否可用
     */
    public boolean isFpcalcAvailable() {
        try {
            ProcessBuilder pb = new ProcessBuilder(fpcalcPath, "-version");
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            if (!process.waitFor(VERSION_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
