package com.example.scan2doc.util.pdf.dto;

import java.util.List;

/**
 * 文本适配结果：字号 + 折行后的各行
 */
public class FitResult {

    private final float fontSize;
    private final List<String> lines;

    public FitResult(float fontSize, List<String> lines) {
        this.fontSize = fontSize;
        this.lines = lines;
    }

    public float getFontSize() {
        return fontSize;
    }

    public List<String> getLines() {
        return lines;
    }

    @Override
    public String toString() {
        return "FitResult{fontSize=" + fontSize + ", lines=" + lines.size() + "}";
    }
}
