package com.lux032.songresolver.service;

import com.lux032.songresolver.model.ManualCorrection;
import com.lux032.songresolver.model.Song;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * 基于标准输入输出的人工修正
 * 并行处理时同一时刻只允许一个文件进行交互
 */
@Slf4j
public class ConsoleCorrectionPrompt implements CorrectionPrompt {

    private static final Set<String> YES = Set.of("y", "yes", "t", "true", "on", "1");
    private static final Set<String> NO = Set.of("n", "no", "f", "false", "off", "0");

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean submissionAvailable;

    public ConsoleCorrectionPrompt(boolean submissionAvailable) {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
            submissionAvailable);
    }

    public ConsoleCorrectionPrompt(BufferedReader in, PrintStream out, boolean submissionAvailable) {
        this.in = in;
        this.out = out;
        this.submissionAvailable = submissionAvailable;
    }

    @Override
    public synchronized ManualCorrection requestCorrection(String fileName, Song bestGuess, boolean confident) {
        if (confident) {
            out.println("Auto tagging finished confidently, manual review was requested");
        } else {
            out.println("Auto tagging finished with a low confidence level");
        }
        out.println("Filename: " + fileName);
        out.println("Artist: " + bestGuess.getArtist());
        out.println("Title: " + bestGuess.getTitle());
        out.println("Album: " + bestGuess.getAlbum());

        if (!askYesNo("Perform manual adjustments? ")) {
            return ManualCorrection.keepAll();
        }

        out.println("Leave individual fields blank to keep the old value");
        String artist = ask("New Artist: ");
        String title = ask("New Title: ");
        String album = ask("New Album: ");

        boolean submit = submissionAvailable && askYesNo("Submit new tags to the AcoustID web service? ");
        return new ManualCorrection(artist, title, album, submit);
    }

    private boolean askYesNo(String prompt) {
        while (true) {
            String answer = ask(prompt);
            if (answer == null) {
                log.warn("标准输入已关闭，按 \"否\" 处理");
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            if (YES.contains(normalized)) {
                return true;
            }
            if (NO.contains(normalized)) {
                return false;
            }
            out.println("Please answer y(es) or n(o)!");
        }
    }

    /**
     * @return 读到的一行，输入结束时为 null
     */
    private String ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("读取用户输入失败", e);
        }
    }
}
