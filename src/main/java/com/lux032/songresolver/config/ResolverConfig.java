package com.lux032.songresolver.config;

import com.lux032.songresolver.model.ReleaseTier;
import com.lux032.songresolver.model.ReleaseTierScheme;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * 歌曲识别配置类
 * 由调用方显式创建并注入到各个服务，不使用全局单例
 */
@Slf4j
@Data
public class ResolverConfig {

    public static final String ENV_APPLICATION_KEY = "ACOUSTID_APPLICATION_API_KEY";
    public static final String ENV_USER_KEY = "ACOUSTID_USER_API_KEY";

    // AcoustID 配置
    private String acoustIdApiKey;
    private String acoustIdUserKey; // 提交修正时使用的用户 Key
    private String acoustIdApiUrl;
    private String acoustIdSubmitUrl;
    private String userAgent;
    private int httpTimeoutSeconds;
    private int maxRetries;
    private long retryDelayMillis;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // fpcalc 工具路径
    private String fpcalcPath;

    // 文件处理配置
    private String outputDirectory;
    private String skipDirectory;
    private boolean keepOriginal;
    private int parallelism;

    // 识别策略配置
    private boolean skipUnconfident;
    private boolean forceManual;
    private ReleaseTierScheme tierScheme;

    // 置信度阈值
    private double minAudioScore;
    private int minFileScore;
    private ReleaseTier minReleaseTier;

    public ResolverConfig() {
        // 默认配置
        this.acoustIdApiUrl = "https://api.acoustid.org/v2/lookup";
        this.acoustIdSubmitUrl = "https://api.acoustid.org/v2/submit";
        this.userAgent = "SongResolver/1.0 ( contact@example.com )";
        this.httpTimeoutSeconds = 30;
        this.maxRetries = 3;
        this.retryDelayMillis = 5000;
        this.proxyEnabled = false;
        this.proxyPort = 0;
        this.fpcalcPath = "fpcalc";
        this.outputDirectory = "finished";
        this.skipDirectory = "skipped";
        this.keepOriginal = false;
        this.parallelism = 1;
        this.skipUnconfident = false;
        this.forceManual = false;
        this.tierScheme = ReleaseTierScheme.FIVE_TIER;
        this.minAudioScore = 0.40;
        this.minFileScore = 70;
        this.minReleaseTier = ReleaseTier.SINGLE;
    }

    /**
     * 从配置文件加载配置，文件不存在时使用默认配置
     * 配置文件中未给出的 API Key 从环境变量读取
     */
    public static ResolverConfig load(Path configFile) throws IOException {
        return load(configFile, System.getenv());
    }

    static ResolverConfig load(Path configFile, Map<String, String> environment) throws IOException {
        ResolverConfig config = new ResolverConfig();
        if (configFile != null && Files.isRegularFile(configFile)) {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(configFile);
                 InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            config.apply(props);
            log.info("已加载配置文件: {}", configFile);
        } else {
            log.info("未找到配置文件 {}，使用默认配置", configFile);
        }

        if (isBlank(config.acoustIdApiKey)) {
            config.acoustIdApiKey = environment.get(ENV_APPLICATION_KEY);
        }
        if (isBlank(config.acoustIdUserKey)) {
            config.acoustIdUserKey = environment.get(ENV_USER_KEY);
        }
        return config;
    }

    /**
     * 用属性覆盖当前配置，未出现的键保持原值
     */
    public void apply(Properties props) {
        if (props.containsKey("acoustid.apiKey")) {
            this.acoustIdApiKey = props.getProperty("acoustid.apiKey");
        }
        if (props.containsKey("acoustid.userKey")) {
            this.acoustIdUserKey = props.getProperty("acoustid.userKey");
        }
        if (props.containsKey("acoustid.apiUrl")) {
            this.acoustIdApiUrl = props.getProperty("acoustid.apiUrl");
        }
        if (props.containsKey("acoustid.submitUrl")) {
            this.acoustIdSubmitUrl = props.getProperty("acoustid.submitUrl");
        }
        if (props.containsKey("http.userAgent")) {
            this.userAgent = props.getProperty("http.userAgent");
        }
        this.httpTimeoutSeconds = intProperty(props, "http.timeoutSeconds", httpTimeoutSeconds);
        this.maxRetries = intProperty(props, "acoustid.maxRetries", maxRetries);
        this.retryDelayMillis = longProperty(props, "acoustid.retryDelayMillis", retryDelayMillis);

        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled"));
        }
        if (props.containsKey("proxy.host")) {
            this.proxyHost = props.getProperty("proxy.host");
        }
        this.proxyPort = intProperty(props, "proxy.port", proxyPort);

        if (props.containsKey("fpcalc.path")) {
            this.fpcalcPath = props.getProperty("fpcalc.path");
        }

        if (props.containsKey("file.outputDirectory")) {
            this.outputDirectory = props.getProperty("file.outputDirectory");
        }
        if (props.containsKey("file.skipDirectory")) {
            this.skipDirectory = props.getProperty("file.skipDirectory");
        }
        if (props.containsKey("file.keepOriginal")) {
            this.keepOriginal = Boolean.parseBoolean(props.getProperty("file.keepOriginal"));
        }
        this.parallelism = intProperty(props, "batch.parallelism", parallelism);

        if (props.containsKey("resolve.skipUnconfident")) {
            this.skipUnconfident = Boolean.parseBoolean(props.getProperty("resolve.skipUnconfident"));
        }
        if (props.containsKey("resolve.forceManual")) {
            this.forceManual = Boolean.parseBoolean(props.getProperty("resolve.forceManual"));
        }
        if (props.containsKey("resolve.tierScheme")) {
            try {
                this.tierScheme = ReleaseTierScheme.valueOf(props.getProperty("resolve.tierScheme").trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                log.warn("无效的分级方案配置: {}，使用 {}", props.getProperty("resolve.tierScheme"), tierScheme);
            }
        }

        if (props.containsKey("confidence.minAudioScore")) {
            try {
                this.minAudioScore = Double.parseDouble(props.getProperty("confidence.minAudioScore"));
            } catch (NumberFormatException e) {
                log.warn("无效的声学匹配度阈值配置: {}", props.getProperty("confidence.minAudioScore"));
            }
        }
        this.minFileScore = intProperty(props, "confidence.minFileScore", minFileScore);
        if (props.containsKey("confidence.minReleaseTier")) {
            try {
                this.minReleaseTier = ReleaseTier.fromName(props.getProperty("confidence.minReleaseTier"));
            } catch (IllegalArgumentException e) {
                log.warn("无效的发行等级阈值配置: {}", props.getProperty("confidence.minReleaseTier"));
            }
        }
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (isBlank(acoustIdApiKey)) {
            log.error("AcoustID API Key 未配置 (acoustid.apiKey 或环境变量 {})", ENV_APPLICATION_KEY);
            return false;
        }
        if (isBlank(outputDirectory)) {
            log.error("输出目录未配置");
            return false;
        }
        if (skipUnconfident && isBlank(skipDirectory)) {
            log.error("启用跳过低置信度匹配时必须配置跳过目录");
            return false;
        }
        if (parallelism < 1) {
            log.error("并行度必须大于 0: {}", parallelism);
            return false;
        }
        if (isBlank(acoustIdUserKey)) {
            log.warn("AcoustID 用户 Key 未配置，人工修正结果将无法提交");
        }
        return true;
    }

    public boolean canSubmitCorrections() {
        return !isBlank(acoustIdApiKey) && !isBlank(acoustIdUserKey);
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("无效的整数配置 {}: {}", key, props.getProperty(key));
            return defaultValue;
        }
    }

    private static long longProperty(Properties props, String key, long defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("无效的整数配置 {}: {}", key, props.getProperty(key));
            return defaultValue;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
