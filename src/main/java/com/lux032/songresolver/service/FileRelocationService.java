package com.lux032.songresolver.service;

import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.Song;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * 文件移动服务
 * 识别成功的文件按 "艺术家 - 标题" 重命名到输出目录，被跳过的文件原样放入跳过目录
 * 所有操作串行执行；目标文件名已被其他文件占用时追加序号，不覆盖已有文件
 */
@Slf4j
public class FileRelocationService {

    private final Path outputDirectory;
    private final Path skipDirectory;
    private final boolean keepOriginal;

    public FileRelocationService(ResolverConfig config) {
        this.outputDirectory = Paths.get(config.getOutputDirectory());
        this.skipDirectory = config.getSkipDirectory() == null ? null : Paths.get(config.getSkipDirectory());
        this.keepOriginal = config.isKeepOriginal();
    }

    /**
     * 将识别完成的文件放入输出目录
     *
     * @return 新文件路径
     */
    public Path relocateResolved(Path source, Song song) throws IOException {
        String fileName = sanitizeFileName(song.displayName()) + extensionOf(source);
        return copyOrMove(source, outputDirectory.resolve(fileName));
    }

    /**
     * 将未处理的文件原样放入跳过目录
     */
    public Path moveToSkipped(Path source) throws IOException {
        if (skipDirectory == null) {
            throw new IllegalStateException("跳过目录未配置");
        }
        Path destination = copyOrMove(source, skipDirectory.resolve(source.getFileName().toString()));
        log.info("已跳过处理，文件放入: {}", destination);
        return destination;
    }

    synchronized Path copyOrMove(Path source, Path destination) throws IOException {
        Files.createDirectories(destination.toAbsolutePath().getParent());

        if (Files.exists(destination) && Files.isSameFile(source, destination)) {
            if (keepOriginal) {
                log.warn("虽然指定了保留原文件，但源文件与目标相同，将直接修改: {}", source);
            } else {
                log.debug("源文件已在目标位置: {}", destination);
            }
            return destination;
        }

        Path target = uniqueDestination(destination);
        if (!target.equals(destination)) {
            log.warn("目标文件已存在: {}，改用: {}", destination.getFileName(), target.getFileName());
        }

        if (keepOriginal) {
            log.debug("复制文件: {} -> {}", source, target);
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        } else {
            log.debug("移动文件: {} -> {}", source, target);
            Files.move(source, target);
        }
        return target;
    }

    /**
     * 目标已存在时依次尝试 "名称 (2).ext"、"名称 (3).ext" ...
     */
    private static Path uniqueDestination(Path destination) {
        if (!Files.exists(destination)) {
            return destination;
        }
        String name = destination.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        String base = dotIndex > 0 ? name.substring(0, dotIndex) : name;
        String extension = dotIndex > 0 ? name.substring(dotIndex) : "";

        Path candidate;
        int counter = 2;
        do {
            candidate = destination.resolveSibling(base + " (" + counter++ + ")" + extension);
        } while (Files.exists(candidate));
        return candidate;
    }

    /**
     * 清理文件名中的非法字符
     */
    static String sanitizeFileName(String name) {
        if (name == null) {
            return "";
        }
        // 替换 Windows 文件名中的非法字符
        return name
            .replaceAll("[\\\\/:*?\"<>|]", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(dotIndex) : "";
    }
}
