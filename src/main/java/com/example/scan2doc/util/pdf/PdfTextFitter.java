package com.example.scan2doc.util.pdf;

import com.example.scan2doc.util.pdf.dto.FitResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把文本塞进检测框：二分查找字号 + 按实际字宽折行
 *
 * 字号范围 6~200pt，迭代 12 次；行高 = 1.2 × 字号。
 * 折行按 "连续非空白 / 连续空白" 切分单词，单词本身超宽时逐字拆开（兼容中文无空格的情况）。
 * 输入中的换行（表格行）始终保留。
 */
public final class PdfTextFitter {

    public static final float MIN_FONT_SIZE = 6f;
    public static final float MAX_FONT_SIZE = 200f;
    public static final float LINE_HEIGHT_FACTOR = 1.2f;
    private static final int ITERATIONS = 12;

    private static final Pattern TOKEN = Pattern.compile("(\\S+|\\s+)");

    private PdfTextFitter() {
    }

    /**
     * 求能放进框内的最大字号
     *
     * 示例：框 100x20pt 放一行 "Hello" → 字号约 16pt（受高度限制：16 × 1.2 ≤ 20）
     *
     * @return 都放不下时返回最小字号 6pt 及按换行拆开的原文
     */
    public static FitResult fit(String text, float boxWidth, float boxHeight, TextMeasurer measurer) {
        float min = MIN_FONT_SIZE;
        float max = MAX_FONT_SIZE;
        float bestSize = MIN_FONT_SIZE;
        List<String> bestLines = Arrays.asList(text.split("\n", -1));

        for (int i = 0; i < ITERATIONS; i++) {
            float size = (min + max) / 2;
            List<String> lines = breakLines(text, boxWidth, size, measurer);
            float required = lines.size() * size * LINE_HEIGHT_FACTOR;
            if (required <= boxHeight) {
                bestSize = size;
                bestLines = lines;
                min = size;
            } else {
                max = size;
            }
        }
        return new FitResult(bestSize, bestLines);
    }

    /**
     * 按给定字号折行（每行宽度 ≤ maxWidth，单个字符超宽时除外）
     */
    public static List<String> breakLines(String text, float maxWidth, float fontSize, TextMeasurer measurer) {
        List<String> all = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            all.addAll(breakParagraph(paragraph, maxWidth, fontSize, measurer));
        }
        return all.isEmpty() ? Collections.singletonList(text) : all;
    }

    private static List<String> breakParagraph(String paragraph, float maxWidth, float fontSize, TextMeasurer measurer) {
        List<String> lines = new ArrayList<>();
        String current = "";
        Matcher matcher = TOKEN.matcher(paragraph);
        while (matcher.find()) {
            String token = matcher.group();
            String trial = current + token;
            if (measurer.widthOf(trial, fontSize) <= maxWidth) {
                current = trial;
                continue;
            }

            // 空白超宽时挂在行尾，不单独成行
            if (token.trim().isEmpty()) {
                current = trial;
                continue;
            }
            if (!current.isEmpty()) {
                lines.add(current);
            }
            if (measurer.widthOf(token, fontSize) > maxWidth) {
                current = splitLongToken(token, maxWidth, fontSize, measurer, lines);
            } else {
                current = token;
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    private static String splitLongToken(String token, float maxWidth, float fontSize, TextMeasurer measurer,
                                         List<String> lines) {
        StringBuilder fragment = new StringBuilder();
        int offset = 0;
        while (offset < token.length()) {
            int codePoint = token.codePointAt(offset);
            String ch = new String(Character.toChars(codePoint));
            if (measurer.widthOf(fragment + ch, fontSize) > maxWidth) {
                if (fragment.length() > 0) {
                    lines.add(fragment.toString());
                }
                fragment.setLength(0);
            }
            fragment.append(ch);
            offset += Character.charCount(codePoint);
        }
        return fragment.toString();
    }
}
