package com.example.scan2doc.util.pdf;

import com.example.scan2doc.util.pdf.dto.FitResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class PdfTextFitterTest {

    /**
     * 每个字符宽 0.5 × 字号
     */
    private final TextMeasurer halfEm = (text, fontSize) -> text.length() * fontSize * 0.5f;

    /**
     * 每个字符宽 0.5pt（与字号无关）
     */
    private final TextMeasurer fixed = (text, fontSize) -> text.length() * 0.5f;

    @Test
    void singleLineIsLimitedByBoxHeight() {
        FitResult result = PdfTextFitter.fit("Hello", 100, 20, halfEm);

        assertEquals(Collections.singletonList("Hello"), result.getLines());
        assertTrue(result.getFontSize() * PdfTextFitter.LINE_HEIGHT_FACTOR <= 20f);
        assertTrue(result.getFontSize() > 15f);
    }

    @Test
    void singleLineIsLimitedByBoxWidth() {
        FitResult result = PdfTextFitter.fit("Hello", 25, 20, halfEm);

        assertEquals(1, result.getLines().size());
        assertTrue(result.getFontSize() <= 10f);
        assertTrue(result.getFontSize() > 9f);
    }

    @Test
    void fallsBackToMinimumSizeWhenNothingFits() {
        String text = "far too much text\nfor this box";
        FitResult result = PdfTextFitter.fit(text, 10, 5, halfEm);

        assertEquals(PdfTextFitter.MIN_FONT_SIZE, result.getFontSize());
        assertEquals(Arrays.asList("far too much text", "for this box"), result.getLines());
    }

    @Test
    void wrapsOnWordBoundaries() {
        assertEquals(Arrays.asList("aaa bbb ", "ccc"), PdfTextFitter.breakLines("aaa bbb ccc", 3.5f, 12, fixed));
    }

    @Test
    void splitsOverlongWordsByCharacter() {
        assertEquals(Arrays.asList("abcd", "efgh", "ij"), PdfTextFitter.breakLines("abcdefghij", 2f, 12, fixed));
        assertEquals(Arrays.asList("中文", "排版", "测试"), PdfTextFitter.breakLines("中文排版测试", 1f, 12, fixed));
    }

    @Test
    void keepsExplicitLineBreaks() {
        assertEquals(Arrays.asList("a", "b"), PdfTextFitter.breakLines("a\nb", 100, 12, fixed));
        assertEquals(Collections.singletonList(""), PdfTextFitter.breakLines("", 100, 12, fixed));
    }
}
