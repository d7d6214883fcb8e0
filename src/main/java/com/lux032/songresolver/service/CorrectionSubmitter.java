package com.lux032.songresolver.service;

import com.lux032.songresolver.model.Song;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 将人工修正结果回传到指纹服务
 */
public interface CorrectionSubmitter {

    void submit(Path audioFile, Song song) throws IOException, InterruptedException;
}
