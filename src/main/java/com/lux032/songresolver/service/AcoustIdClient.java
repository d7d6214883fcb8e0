package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.AudioFingerprint;
import com.lux032.songresolver.model.CorrectionSubmission;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * AcoustID Web 服务客户端
 * 负责指纹查询和众包修正提交
 */
@Slf4j
public class AcoustIdClient implements Closeable {

    static final String LOOKUP_META = "recordings releasegroups compress";

    private final ResolverConfig config;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AcoustIdClient(ResolverConfig config) {
        this.config = config;
        this.httpClient = createHttpClient(config);
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    private CloseableHttpClient createHttpClient(ResolverConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(config.getHttpTimeoutSeconds()))
            .setResponseTimeout(Timeout.ofSeconds(config.getHttpTimeoutSeconds()))
            .build();
        builder.setDefaultRequestConfig(requestConfig);
        // 重试统一由 postWithRetry 处理
        builder.disableAutomaticRetries();

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.info("AcoustID 客户端使用代理: {}:{}", config.getProxyHost(), config.getProxyPort());
        }

        return builder.build();
    }

    /**
     * 通过指纹查询候选录音（带重试机制）
     *
     * @return 原始响应 JSON，交给 {@link CandidateExtractor} 解析
     * @throws LookupServiceException 重试耗尽或遇到不可重试的错误
     */
    public JsonNode lookup(AudioFingerprint fingerprint) throws LookupServiceException {
        if (config.getAcoustIdApiKey() == null || config.getAcoustIdApiKey().isEmpty()) {
            throw new IllegalStateException("AcoustID API Key 未配置");
        }

        List<NameValuePair> params = new ArrayList<>();
        params.add(new BasicNameValuePair("format", "json"));
        params.add(new BasicNameValuePair("client", config.getAcoustIdApiKey()));
        params.add(new BasicNameValuePair("duration", String.valueOf(fingerprint.getDuration())));
        params.add(new BasicNameValuePair("fingerprint", fingerprint.getFingerprint()));
        params.add(new BasicNameValuePair("meta", LOOKUP_META));

        log.debug("AcoustID 查询 - duration: {}, meta: {}", fingerprint.getDuration(), LOOKUP_META);
        return postWithRetry(config.getAcoustIdApiUrl(), params);
    }

    /**
     * 提交人工修正后的元数据
     */
    public void submit(CorrectionSubmission submission) throws LookupServiceException {
        if (!config.canSubmitCorrections()) {
            throw new IllegalStateException("AcoustID 用户 Key 未配置，无法提交");
        }

        List<NameValuePair> params = new ArrayList<>();
        params.add(new BasicNameValuePair("format", "json"));
        params.add(new BasicNameValuePair("client", config.getAcoustIdApiKey()));
        params.add(new BasicNameValuePair("user", config.getAcoustIdUserKey()));
        params.add(new BasicNameValuePair("duration.0", String.valueOf(submission.getDuration())));
        params.add(new BasicNameValuePair("fingerprint.0", submission.getFingerprint()));
        params.add(new BasicNameValuePair("artist.0", submission.getArtist()));
        params.add(new BasicNameValuePair("track.0", submission.getTrack()));
        params.add(new BasicNameValuePair("album.0", submission.getAlbum()));
        params.add(new BasicNameValuePair("albumartist.0", submission.getAlbumArtist()));
        params.add(new BasicNameValuePair("fileformat.0", submission.getFileFormat()));

        JsonNode response = postWithRetry(config.getAcoustIdSubmitUrl(), params);
        log.info("AcoustID 修正提交成功: {} - {} ({})",
            submission.getArtist(), submission.getTrack(), response.path("submissions").size());
    }

    private JsonNode postWithRetry(String url, List<NameValuePair> params) throws LookupServiceException {
        int maxRetries = Math.max(0, config.getMaxRetries());
        LookupServiceException lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return post(url, params);
            } catch (LookupServiceException e) {
                lastException = e;
                if (!e.isRetryable() || attempt == maxRetries) {
                    break;
                }
                log.warn("AcoustID 请求失败(第{}/{}次重试): {} - {}毫秒后重试",
                    attempt + 1, maxRetries, e.getMessage(), config.getRetryDelayMillis());
                try {
                    Thread.sleep(config.getRetryDelayMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LookupServiceException("重试等待被中断", ie);
                }
            }
        }

        log.error("AcoustID 请求失败: {}", lastException.getMessage());
        throw lastException;
    }

    private JsonNode post(String url, List<NameValuePair> params) throws LookupServiceException {
        HttpPost httpPost = new HttpPost(url);
        httpPost.setEntity(new UrlEncodedFormEntity(params, StandardCharsets.UTF_8));
        httpPost.setHeader("User-Agent", config.getUserAgent());

        try (CloseableHttpResponse response = httpClient.execute(httpPost)) {
            int statusCode = response.getCode();
            String responseBody = response.getEntity() == null
                ? ""
                : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);

            if (statusCode != 200) {
                // 5xx 和 429 可以重试，其余视为请求本身有误
                boolean retryable = statusCode >= 500 || statusCode == 429;
                throw new LookupServiceException(
                    "AcoustID API 返回状态码 " + statusCode + ": " + abbreviate(responseBody), retryable);
            }

            JsonNode root = objectMapper.readTree(responseBody);
            String status = root.path("status").asText("");
            if (!"ok".equals(status)) {
                throw new LookupServiceException(
                    "AcoustID API 返回错误: " + root.path("error").path("message").asText(status), false);
            }
            return root;
        } catch (ParseException e) {
            throw new LookupServiceException("解析响应失败", e);
        } catch (LookupServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new LookupServiceException("AcoustID 请求失败: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    /**
     * 关闭客户端
     */
    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
