package com.lux032.songresolver.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * 批处理中单个文件的处理结果
 */
@Value
public class FileOutcome {
    Path source;
    Path destination;     // 失败时为 null
    Resolution resolution; // 查询或指纹失败时为 null
    String error;

    public static FileOutcome completed(Path source, Path destination, Resolution resolution) {
        return new FileOutcome(source, destination, resolution, null);
    }

    public static FileOutcome failed(Path source, Resolution resolution, String error) {
        return new FileOutcome(source, null, resolution, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
