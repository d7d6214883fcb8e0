package com.lux032.songresolver;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.lux032.songresolver.config.ResolverConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MainTest {

    @Test
    @DisplayName("parses flags, directories and files")
    void parsesArguments() {
        Main.CommandLine commandLine = Main.CommandLine.parse(new String[]{
            "-k", "--skip", "-od", "out", "-sd", "skip", "-c", "my.properties", "a.mp3", "b.flac"});

        assertThat(commandLine.keep).isTrue();
        assertThat(commandLine.skip).isTrue();
        assertThat(commandLine.manual).isFalse();
        assertThat(commandLine.configFile).isEqualTo(Paths.get("my.properties"));
        assertThat(commandLine.files).containsExactly(Paths.get("a.mp3"), Paths.get("b.flac"));
    }

    @Test
    @DisplayName("command line options override the configuration")
    void appliesToConfig() {
        ResolverConfig config = new ResolverConfig();

        Main.CommandLine.parse(new String[]{"-m", "-k", "-sd", "aside", "x.mp3"}).applyTo(config);

        assertThat(config.isForceManual()).isTrue();
        assertThat(config.isKeepOriginal()).isTrue();
        assertThat(config.isSkipUnconfident()).isFalse();
        assertThat(config.getSkipDirectory()).isEqualTo("aside");
        assertThat(config.getOutputDirectory()).isEqualTo("finished");
    }

    @Test
    @DisplayName("rejects unknown options, missing values and empty file lists")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> Main.CommandLine.parse(new String[]{"--bogus", "a.mp3"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("--bogus");
        assertThatThrownBy(() -> Main.CommandLine.parse(new String[]{"a.mp3", "-od"}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.CommandLine.parse(new String[]{"-k"}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("help and usage errors produce exit codes without processing")
    void exitCodes() {
        assertThat(Main.run(new String[]{"--help"})).isEqualTo(Main.EXIT_SUCCESS);
        assertThat(Main.run(new String[]{})).isEqualTo(Main.EXIT_FAILURE);
    }

    @Test
    @DisplayName("each verbose flag lowers the log level by one step")
    void verbosity() {
        assertThat(Main.CommandLine.parse(new String[]{"a.mp3"}).verbosity).isZero();
        assertThat(Main.CommandLine.parse(new String[]{"-v", "--verbose", "a.mp3"}).verbosity).isEqualTo(2);
        assertThat(Main.CommandLine.parse(new String[]{"-vv", "a.mp3"}).verbosity).isEqualTo(2);

        assertThat(Main.logLevel(0)).isEqualTo(Level.INFO);
        assertThat(Main.logLevel(1)).isEqualTo(Level.DEBUG);
        assertThat(Main.logLevel(3)).isEqualTo(Level.TRACE);
    }

    @Test
    @DisplayName("the chosen level is applied to the root logger")
    void appliesRootLevel() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level previous = root.getLevel();
        try {
            Main.applyLogLevel(Level.DEBUG);

            assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        } finally {
            root.setLevel(previous);
        }
    }
}
