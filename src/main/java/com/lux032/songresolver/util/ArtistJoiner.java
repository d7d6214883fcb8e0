package com.lux032.songresolver.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 艺术家署名拼接工具
 * 按顺序拼接每个署名片段的 name 与 joinphrase，不额外插入分隔符
 */
public final class ArtistJoiner {

    private ArtistJoiner() {
    }

    /**
     * @param credits AcoustID 返回的 artists 数组，缺失或非数组时返回空字符串
     */
    public static String join(JsonNode credits) {
        if (credits == null || !credits.isArray()) {
            return "";
        }
        StringBuilder joined = new StringBuilder();
        for (JsonNode credit : credits) {
            joined.append(credit.path("name").asText(""));
            joined.append(credit.path("joinphrase").asText(""));
        }
        return joined.toString();
    }
}
