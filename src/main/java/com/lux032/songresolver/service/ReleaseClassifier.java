package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.Recording;
import com.lux032.songresolver.model.Release;
import com.lux032.songresolver.model.ReleaseTier;
import com.lux032.songresolver.model.ReleaseTierScheme;
import com.lux032.songresolver.util.ArtistJoiner;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 发行分级服务
 * 根据 release-group 的主类型、副类型和艺术家判断可信度等级
 */
@Slf4j
public class ReleaseClassifier {

    private static final String TYPE_ALBUM = "Album";
    private static final String TYPE_SINGLE = "Single";
    private static final String SINGLE_SUFFIX = " - Single";

    private final ReleaseTierScheme scheme;

    public ReleaseClassifier(ResolverConfig config) {
        this(config.getTierScheme());
    }

    public ReleaseClassifier(ReleaseTierScheme scheme) {
        this.scheme = scheme;
    }

    public ReleaseTierScheme getScheme() {
        return scheme;
    }

    /**
     * 对单个 release-group 分级
     *
     * @param releaseGroup AcoustID 返回的 release-group 节点
     * @param recordingArtist 录音的艺术家，用于判断是否同一艺术家
     * @return 分级结果；缺少 type 或无法分级时为空，不参与专辑选择
     */
    public Optional<Release> classify(JsonNode releaseGroup, String recordingArtist) {
        JsonNode typeNode = releaseGroup.path("type");
        if (!typeNode.isTextual()) {
            return Optional.empty();
        }
        String type = typeNode.asText();
        String title = releaseGroup.path("title").asText("");
        boolean sameArtist = isSameArtist(releaseGroup, recordingArtist);
        JsonNode secondaryTypes = releaseGroup.path("secondarytypes");
        boolean hasSecondaryTypes = secondaryTypes.isArray() && secondaryTypes.size() > 0;

        ReleaseTier tier = scheme == ReleaseTierScheme.TWO_TIER
            ? classifyTwoTier(type, sameArtist, hasSecondaryTypes)
            : classifyFiveTier(type, sameArtist, hasSecondaryTypes);

        if (tier == ReleaseTier.NONE) {
            return Optional.empty();
        }
        if (tier == ReleaseTier.SINGLE) {
            title = title + SINGLE_SUFFIX;
        }
        return Optional.of(new Release(title, tier));
    }

    private ReleaseTier classifyFiveTier(String type, boolean sameArtist, boolean hasSecondaryTypes) {
        boolean album = TYPE_ALBUM.equalsIgnoreCase(type);
        boolean single = TYPE_SINGLE.equalsIgnoreCase(type);
        if (!album && !single) {
            return ReleaseTier.NONE;
        }
        if (!sameArtist) {
            return ReleaseTier.MIX;
        }
        if (hasSecondaryTypes) {
            return ReleaseTier.COMPILATION;
        }
        return album ? ReleaseTier.ALBUM : ReleaseTier.SINGLE;
    }

    private ReleaseTier classifyTwoTier(String type, boolean sameArtist, boolean hasSecondaryTypes) {
        if (TYPE_ALBUM.equalsIgnoreCase(type) && sameArtist && !hasSecondaryTypes) {
            return ReleaseTier.ALBUM;
        }
        // 只接受纯单曲，Remix、Live 等附加类型不计入
        if (TYPE_SINGLE.equalsIgnoreCase(type) && !hasSecondaryTypes) {
            return ReleaseTier.SINGLE;
        }
        return ReleaseTier.NONE;
    }

    /**
     * compress 模式下与录音相同的 release-group 艺术家会被省略，缺失视为同一艺术家
     */
    private boolean isSameArtist(JsonNode releaseGroup, String recordingArtist) {
        JsonNode artists = releaseGroup.path("artists");
        if (!artists.isArray()) {
            return true;
        }
        return ArtistJoiner.join(artists).equals(recordingArtist);
    }

    /**
     * 选出录音的最佳专辑：等级最高者，同级取最先出现的；没有任何可分级的 release-group 时返回兜底专辑
     */
    public Release selectRelease(Recording recording) {
        return selectRelease(recording.getReleases(), recording.getTitle());
    }

    public Release selectRelease(List<Release> releases, String recordingTitle) {
        Release best = null;
        for (Release release : releases) {
            if (best == null || release.getTier().compareTo(best.getTier()) > 0) {
                best = release;
            }
        }
        return best != null ? best : Release.fallbackFor(recordingTitle);
    }
}
