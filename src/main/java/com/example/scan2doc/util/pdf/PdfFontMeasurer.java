package com.example.scan2doc.util.pdf;

import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

/**
 * 基于 PDFBox 字体度量的 {@link TextMeasurer}
 *
 * 字体无法编码的字符（例如 Helvetica 遇到中文）按一个字号宽估算，
 * 保证排版仍然能进行；真正绘制时该行会失败并被跳过。
 */
public class PdfFontMeasurer implements TextMeasurer {

    private final PDFont font;

    public PdfFontMeasurer(PDFont font) {
        this.font = font;
    }

    @Override
    public float widthOf(String text, float fontSize) {
        try {
            return font.getStringWidth(text) / 1000f * fontSize;
        } catch (IOException | IllegalArgumentException e) {
            return estimate(text, fontSize);
        }
    }

    private float estimate(String text, float fontSize) {
        float width = 0;
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            String ch = new String(Character.toChars(codePoint));
            try {
                width += font.getStringWidth(ch) / 1000f * fontSize;
            } catch (IOException | IllegalArgumentException e) {
                width += fontSize;
            }
            offset += Character.charCount(codePoint);
        }
        return width;
    }
}
