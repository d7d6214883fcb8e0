package com.lux032.songresolver.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * 文件名相似度评分
 * 实现 token set ratio：对词序和重复词不敏感，容忍任一侧的多余词（如 "(Official Video)"）
 */
public class FilenameScorer {

    /**
     * 计算两个字符串的相似度
     *
     * @return 0-100 的整数，相同字符串为 100，任一侧无有效词为 0
     */
    public int score(String first, String second) {
        String processed1 = normalize(first);
        String processed2 = normalize(second);
        if (processed1.isEmpty() || processed2.isEmpty()) {
            return 0;
        }

        Set<String> tokens1 = new TreeSet<>(Arrays.asList(processed1.split(" ")));
        Set<String> tokens2 = new TreeSet<>(Arrays.asList(processed2.split(" ")));

        Set<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> diff1to2 = new TreeSet<>(tokens1);
        diff1to2.removeAll(tokens2);
        Set<String> diff2to1 = new TreeSet<>(tokens2);
        diff2to1.removeAll(tokens1);

        String sortedIntersection = String.join(" ", intersection);
        String combined1to2 = (sortedIntersection + " " + String.join(" ", diff1to2)).trim();
        String combined2to1 = (sortedIntersection + " " + String.join(" ", diff2to1)).trim();

        int best = ratio(sortedIntersection, combined1to2);
        best = Math.max(best, ratio(sortedIntersection, combined2to1));
        best = Math.max(best, ratio(combined1to2, combined2to1));
        return best;
    }

    /**
     * 小写化，非字母数字字符替换为空格并压缩空白
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append(' ');
            }
        });
        return sb.toString().toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * 基于插入/删除编辑距离的相似度百分比，等价于 2*LCS/(len1+len2)
     * 恰好为 .5 时取偶数（银行家舍入）
     */
    static int ratio(String s1, String s2) {
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }
        int lcs = longestCommonSubsequence(s1, s2);
        return (int) Math.rint(200.0 * lcs / (s1.length() + s2.length()));
    }

    private static int longestCommonSubsequence(String s1, String s2) {
        int m = s1.length();
        int n = s2.length();
        // 滚动数组
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }

    /**
     * 去掉目录和扩展名，得到用于比较的文件基本名
     */
    public static String baseName(String fileName) {
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }
}
