package com.lux032.songresolver.service;

import com.lux032.songresolver.model.LookupResult;
import com.lux032.songresolver.model.Match;
import com.lux032.songresolver.model.Recording;
import com.lux032.songresolver.model.Release;
import com.lux032.songresolver.model.Score;
import com.lux032.songresolver.model.Song;
import com.lux032.songresolver.util.FilenameScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 最佳候选选择服务
 * 排序键为 文件名相似度*1000 + 发行等级，声学匹配度只用于之后的置信度检查
 * 排序键相同时取最先出现的候选（零值候选排在最前）
 */
@Slf4j
public class MatchSelector {

    private final FilenameScorer filenameScorer;
    private final ReleaseClassifier releaseClassifier;

    public MatchSelector(FilenameScorer filenameScorer, ReleaseClassifier releaseClassifier) {
        this.filenameScorer = filenameScorer;
        this.releaseClassifier = releaseClassifier;
    }

    /**
     * 为每条录音生成候选，第一个元素始终是零值候选
     *
     * @param fileName 音频文件名，比较前会去掉目录和扩展名
     */
    public List<Match> candidates(List<LookupResult> results, String fileName) {
        String baseName = FilenameScorer.baseName(fileName);
        List<Match> matches = new ArrayList<>();
        matches.add(Match.sentinel());

        for (LookupResult result : results) {
            for (Recording recording : result.getRecordings()) {
                int fileScore = filenameScorer.score(baseName, recording.displayName());
                Release release = releaseClassifier.selectRelease(recording);
                Song song = new Song(recording.getArtist(), recording.getTitle(), release.getTitle());
                Score score = new Score(result.getAudioScore(), fileScore, release.getTier());
                log.debug("候选: {} [{}] - 文件名相似度: {}, 发行等级: {}, 声学匹配度: {}",
                    song.displayName(), song.getAlbum(), fileScore, release.getTier(), result.getAudioScore());
                matches.add(new Match(song, score));
            }
        }
        return matches;
    }

    public Match select(List<LookupResult> results, String fileName) {
        Match best = null;
        for (Match match : candidates(results, fileName)) {
            // 严格大于才替换，保持先到先得
            if (best == null || match.getScore().rank() > best.getScore().rank()) {
                best = match;
            }
        }
        return best;
    }
}
