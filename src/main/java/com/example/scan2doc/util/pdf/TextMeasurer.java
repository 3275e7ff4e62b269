package com.example.scan2doc.util.pdf;

/**
 * 文本宽度测量（单位：PDF 点）
 */
@FunctionalInterface
public interface TextMeasurer {

    float widthOf(String text, float fontSize);
}
