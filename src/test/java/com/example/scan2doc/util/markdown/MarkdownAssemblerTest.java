package com.example.scan2doc.util.markdown;

import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.util.ocr.dto.ImageDims;
import com.example.scan2doc.util.ocr.dto.OcrBox;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownAssemblerTest {

    private static final String CELL = "<td width=\"50%\" style=\"border: none; vertical-align: top;\">";

    private final MarkdownAssembler assembler = new MarkdownAssembler();

    @Test
    void returnsRawTextWhenNoTagsFound() throws Exception {
        assertEquals("Hello World", assembler.assemble(new OcrResult("Hello World", null, null), null));
    }

    @Test
    void keepsTextOutsideTags() throws Exception {
        String raw = "Intro\n<|ref|>text<|/ref|><|det|>[[0,10,100,50]]<|/det|>First Block\n"
                + "IMPORTANT GAP TEXT\n"
                + "<|ref|>text<|/ref|><|det|>[[0,60,100,100]]<|/det|>Second Block";
        String result = assembler.assemble(new OcrResult(raw, null, null), null);

        assertTrue(result.startsWith("Intro\n\nFirst Block"));
        assertTrue(result.contains("IMPORTANT GAP TEXT"));
        assertTrue(result.endsWith("Second Block"));
    }

    @Test
    void rendersSideBySideBlocksAsLayoutTable() throws Exception {
        String raw = "<|ref|>text<|/ref|><|det|>[[0,100,450,300]]<|/det|>Left Text"
                + "<|ref|>image<|/ref|><|det|>[[550,100,1000,300]]<|/det|>";
        OcrResult ocr = new OcrResult(raw,
                Collections.singletonList(new OcrBox("image", new double[]{550, 100, 1000, 300})),
                new ImageDims(1000, 1000));

        String result = assembler.assemble(ocr, Collections.singletonMap(0, "img-right"));

        String expected = MarkdownAssembler.LAYOUT_TABLE_OPEN
                + CELL + "Left Text</td>"
                + CELL + "<img src=\"scan2doc-img:img-right\" alt=\"Figure 1\" /></td>"
                + "</tr></table>";
        assertEquals(expected, result);
    }

    @Test
    void joinsStackedBlocksInsideOneCell() throws Exception {
        String raw = "<|ref|>text<|/ref|><|det|>[[0,100,450,180]]<|/det|>First paragraph text"
                + "<|ref|>text<|/ref|><|det|>[[0,200,450,300]]<|/det|>Second paragraph text"
                + "<|ref|>image<|/ref|><|det|>[[550,100,1000,300]]<|/det|>";
        OcrResult ocr = new OcrResult(raw,
                Collections.singletonList(new OcrBox("image", new double[]{550, 100, 1000, 300})),
                new ImageDims(1000, 1000));

        String result = assembler.assemble(ocr, Collections.singletonMap(0, "img-right"));

        assertTrue(result.contains("First paragraph text<br/><br/>Second paragraph text"));
        assertTrue(result.contains("scan2doc-img:img-right"));
        assertEquals(2, result.split("<td ").length - 1);
    }

    @Test
    void sequentialBlocksStayPlainParagraphs() throws Exception {
        String raw = "<|ref|>text<|/ref|><|det|>[[0,0,1000,50]]<|/det|>Top Line"
                + "<|ref|>text<|/ref|><|det|>[[0,100,1000,150]]<|/det|>Bottom Line";

        String result = assembler.assemble(new OcrResult(raw, null, null), null);

        assertEquals("Top Line\n\nBottom Line", result);
    }

    @Test
    void tagNamesDoNotLeakIntoContent() throws Exception {
        String raw = "<|ref|>title<|/ref|><|det|>[[0,0,100,100]]<|/det|>My Title";

        String result = assembler.assemble(new OcrResult(raw, null, null), null);

        assertEquals("My Title", result);
    }

    @Test
    void matchesNormalizedCoordinatesToPixelBoxes() throws Exception {
        String raw = "<|ref|>image<|/ref|><|det|>[[100,100,200,200]]<|/det|>";
        OcrResult ocr = new OcrResult(raw,
                Collections.singletonList(new OcrBox("image", new double[]{200, 200, 400, 400})),
                new ImageDims(2000, 2000));

        String result = assembler.assemble(ocr, Collections.singletonMap(0, "img-real"));

        assertEquals("![Figure 1](scan2doc-img:img-real)", result);
    }

    @Test
    void appendsImagesMissingFromBody() throws Exception {
        String raw = "<|ref|>text<|/ref|><|det|>[[0,0,100,50]]<|/det|>Body";
        OcrResult ocr = new OcrResult(raw,
                Collections.singletonList(new OcrBox("image", new double[]{500, 500, 600, 600})),
                new ImageDims(1000, 1000));

        String result = assembler.assemble(ocr, Collections.singletonMap(0, "orphan"));

        assertEquals("Body\n\n## Figures\n![Figure 1](scan2doc-img:orphan)", result);
    }

    @Test
    void numbersFiguresInParseOrder() throws Exception {
        String raw = "<|ref|>image<|/ref|><|det|>[[0,500,400,900]]<|/det|>"
                + "<|ref|>image<|/ref|><|det|>[[0,0,400,400]]<|/det|>";
        OcrResult ocr = new OcrResult(raw, Arrays.asList(
                new OcrBox("image", new double[]{0, 500, 400, 900}),
                new OcrBox("image", new double[]{0, 0, 400, 400})), new ImageDims(1000, 1000));
        Map<Integer, String> images = new HashMap<>();
        images.put(0, "lower");
        images.put(1, "upper");

        String result = assembler.assemble(ocr, images);

        assertEquals("![Figure 2](scan2doc-img:upper)\n\n![Figure 1](scan2doc-img:lower)", result);
    }

    @Test
    void normalizesLatexDelimiters() throws Exception {
        String raw = "<|ref|>text<|/ref|><|det|>[[0,0,100,100]]<|/det|>"
                + "Inline: \\(E=mc^2\\) and Block: \\[x^2 + y^2 = z^2\\]";

        String result = assembler.assemble(new OcrResult(raw, null, null), null);

        assertTrue(result.contains("$E=mc^2$"));
        assertTrue(result.contains("$$x^2 + y^2 = z^2$$"));
        assertFalse(result.contains("\\(E=mc^2\\)"));
    }

    @Test
    void rejectsMissingRawText() {
        MissingRawTextException e = assertThrows(MissingRawTextException.class,
                () -> assembler.assemble(new OcrResult(null, null, null), null));
        assertEquals("OCR result missing raw_text", e.getMessage());
    }
}
