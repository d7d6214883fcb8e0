package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.songresolver.model.LookupResult;
import com.lux032.songresolver.model.Recording;
import com.lux032.songresolver.model.Release;
import com.lux032.songresolver.util.ArtistJoiner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 候选提取服务
 * 将 AcoustID 查询响应转换为带分级专辑的录音候选列表
 * 缺失字段只会减少候选数量，不会抛出异常
 */
@Slf4j
public class CandidateExtractor {

    private final ReleaseClassifier releaseClassifier;
    private final ObjectMapper objectMapper;

    public CandidateExtractor(ReleaseClassifier releaseClassifier) {
        this.releaseClassifier = releaseClassifier;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 解析 JSON 文本形式的响应
     */
    public List<LookupResult> extract(String json) throws IOException {
        return extract(objectMapper.readTree(json));
    }

    public List<LookupResult> extract(JsonNode response) {
        List<LookupResult> lookupResults = new ArrayList<>();
        JsonNode results = response == null ? null : response.path("results");
        if (results == null || !results.isArray()) {
            log.warn("查询响应中缺少 results 字段");
            return lookupResults;
        }

        int dropped = 0;
        for (JsonNode result : results) {
            JsonNode score = result.path("score");
            JsonNode recordings = result.path("recordings");
            if (!score.isNumber() || !recordings.isArray()) {
                log.debug("跳过缺少 score 或 recordings 的结果: {}", result.path("id").asText(""));
                continue;
            }

            List<Recording> parsed = new ArrayList<>();
            for (JsonNode recording : recordings) {
                Recording candidate = toRecording(recording);
                if (candidate == null) {
                    dropped++;
                    continue;
                }
                parsed.add(candidate);
            }
            lookupResults.add(new LookupResult(score.asDouble(), parsed));
        }

        if (dropped > 0) {
            log.debug("丢弃了 {} 条缺少 artists/title 的录音", dropped);
        }
        return lookupResults;
    }

    /**
     * @return 缺少艺术家或标题时返回 null
     */
    private Recording toRecording(JsonNode recording) {
        JsonNode artists = recording.path("artists");
        JsonNode titleNode = recording.path("title");
        if (!artists.isArray() || !titleNode.isTextual()) {
            return null;
        }
        String artist = ArtistJoiner.join(artists);
        String title = titleNode.asText();
        if (artist.isEmpty() || title.isEmpty()) {
            return null;
        }

        List<Release> releases = new ArrayList<>();
        JsonNode releaseGroups = recording.path("releasegroups");
        if (releaseGroups.isArray()) {
            for (JsonNode releaseGroup : releaseGroups) {
                releaseClassifier.classify(releaseGroup, artist).ifPresent(releases::add);
            }
        }
        return new Recording(artist, title, releases);
    }
}
