package com.lux032.songresolver;

import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.core.ApplicationLifecycleManager;
import com.lux032.songresolver.model.BatchReport;
import com.lux032.songresolver.model.FileOutcome;
import ch.qos.logback.classic.Level;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 歌曲识别命令行入口
 * 用法: song-resolver [-k] [-s] [-m] [-v] [-od DIR] [-sd DIR] [-c FILE] FILE...
 */
@Slf4j
public class Main {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage: song-resolver [options] FILE...",
        "  -k,  --keep                    Keep original files instead of moving them",
        "  -s,  --skip                    Place unconfident matches in the skip directory instead of asking",
        "  -m,  --manual                  Always ask for manual corrections, even for confident matches",
        "  -od, --output-directory DIR    Directory for resolved files",
        "  -sd, --skip-directory DIR      Directory for skipped files",
        "  -c,  --config FILE             Configuration file (default: config.properties)",
        "  -v,  --verbose                 Increase log verbosity (repeat for more: -v debug, -vv trace)",
        "  -h,  --help                    Show this help");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_FAILURE;
        }
        if (commandLine.help) {
            System.out.println(USAGE);
            return EXIT_SUCCESS;
        }
        applyLogLevel(logLevel(commandLine.verbosity));

        ApplicationLifecycleManager lifecycleManager = null;
        try {
            // 1. 加载配置，命令行参数优先
            ResolverConfig config = ResolverConfig.load(commandLine.configFile);
            commandLine.applyTo(config);
            if (!config.isValid()) {
                return EXIT_FAILURE;
            }

            // 2. 初始化服务
            lifecycleManager = new ApplicationLifecycleManager(config);
            lifecycleManager.initializeServices();
            if (!lifecycleManager.isFpcalcAvailable()) {
                log.error("未找到 fpcalc ({})，请安装 Chromaprint", config.getFpcalcPath());
                return EXIT_FAILURE;
            }

            // 3. 处理文件
            BatchReport report = lifecycleManager.getBatchResolver().resolveAll(commandLine.files);
            for (FileOutcome outcome : report.getOutcomes()) {
                if (!outcome.isSuccess()) {
                    log.error("失败: {} - {}", outcome.getSource(), outcome.getError());
                }
            }
            return report.allSucceeded() ? EXIT_SUCCESS : EXIT_FAILURE;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("处理被中断");
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("运行失败", e);
            return EXIT_FAILURE;
        } finally {
            if (lifecycleManager != null) {
                lifecycleManager.shutdown();
            }
        }
    }

    /**
     * 默认 INFO，每个 -v 降低一级
     */
    static Level logLevel(int verbosity) {
        if (verbosity >= 2) {
            return Level.TRACE;
        }
        return verbosity == 1 ? Level.DEBUG : Level.INFO;
    }

    static void applyLogLevel(Level level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        } else {
            log.warn("日志实现不是 Logback，忽略日志级别设置: {}", level);
        }
    }

    /**
     * 命令行参数
     */
    static final class CommandLine {
        boolean keep;
        boolean skip;
        boolean manual;
        boolean help;
        int verbosity;
        String outputDirectory;
        String skipDirectory;
        Path configFile = Paths.get("config.properties");
        final List<Path> files = new ArrayList<>();

        static CommandLine parse(String[] args) {
            CommandLine commandLine = new CommandLine();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-k":
                    case "--keep":
                        commandLine.keep = true;
                        break;
                    case "-s":
                    case "--skip":
                        commandLine.skip = true;
                        break;
                    case "-m":
                    case "--manual":
                        commandLine.manual = true;
                        break;
                    case "-v":
                    case "--verbose":
                        commandLine.verbosity++;
                        break;
                    case "-vv":
                        commandLine.verbosity += 2;
                        break;
                    case "-h":
                    case "--help":
                        commandLine.help = true;
                        break;
                    case "-od":
                    case "--output-directory":
                        commandLine.outputDirectory = value(args, ++i, arg);
                        break;
                    case "-sd":
                    case "--skip-directory":
                        commandLine.skipDirectory = value(args, ++i, arg);
                        break;
                    case "-c":
                    case "--config":
                        commandLine.configFile = Paths.get(value(args, ++i, arg));
                        break;
                    default:
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        commandLine.files.add(Paths.get(arg));
                }
            }
            if (commandLine.files.isEmpty() && !commandLine.help) {
                throw new IllegalArgumentException("No input files given");
            }
            return commandLine;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for option: " + option);
            }
            return args[index];
        }

        void applyTo(ResolverConfig config) {
            if (keep) {
                config.setKeepOriginal(true);
            }
            if (skip) {
                config.setSkipUnconfident(true);
            }
            if (manual) {
                config.setForceManual(true);
            }
            if (outputDirectory != null) {
                config.setOutputDirectory(outputDirectory);
            }
            if (skipDirectory != null) {
                config.setSkipDirectory(skipDirectory);
            }
        }
    }
}
