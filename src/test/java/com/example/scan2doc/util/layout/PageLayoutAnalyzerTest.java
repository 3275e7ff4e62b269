package com.example.scan2doc.util.layout;

import com.example.scan2doc.util.layout.dto.Column;
import com.example.scan2doc.util.layout.dto.VisualRow;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageLayoutAnalyzerTest {

    private final PageLayoutAnalyzer analyzer = new PageLayoutAnalyzer(LayoutConfig.loadDefault());

    private static ParsedBlock block(int index, String type, String content, double x1, double y1, double x2, double y2) {
        return new ParsedBlock(index, type, content, new double[]{x1, y1, x2, y2});
    }

    @Test
    void mergesBlocksWithEnoughHorizontalOverlap() {
        ParsedBlock a = block(0, "text", "A", 0, 0, 100, 50);
        ParsedBlock b = block(1, "text", "B", 50, 60, 150, 100);

        List<Column> columns = analyzer.clusterIntoColumns(Arrays.asList(a, b));

        assertEquals(1, columns.size());
        assertEquals(2, columns.get(0).getBlocks().size());
        assertEquals("A", columns.get(0).getBlocks().get(0).getContent());
    }

    @Test
    void separatesBlocksWithSmallOverlap() {
        ParsedBlock a = block(0, "text", "A", 0, 0, 100, 50);
        ParsedBlock c = block(1, "text", "C", 80, 0, 180, 50);

        List<Column> columns = analyzer.clusterIntoColumns(Arrays.asList(c, a));

        assertEquals(2, columns.size());
        assertEquals("A", columns.get(0).getBlocks().get(0).getContent());
        assertEquals("C", columns.get(1).getBlocks().get(0).getContent());
    }

    @Test
    void bindsCaptionBelowImage() {
        ParsedBlock image = block(0, "image", "", 100, 100, 500, 400);
        ParsedBlock caption = block(1, "image_caption", "Figure 1", 120, 420, 480, 450);

        List<ParsedBlock> bound = analyzer.bindCaptions(Arrays.asList(image, caption));

        assertEquals(1, bound.size());
        assertEquals("<br/>Figure 1", bound.get(0).getContent());
        assertEquals(450, bound.get(0).bottom());
    }

    @Test
    void keepsDistantCaptionSeparate() {
        ParsedBlock image = block(0, "image", "", 100, 100, 500, 400);
        ParsedBlock caption = block(1, "caption", "Far away", 120, 700, 480, 730);

        assertEquals(2, analyzer.bindCaptions(Arrays.asList(image, caption)).size());
    }

    @Test
    void groupsSideBySideBlocksIntoOneRow() {
        List<ParsedBlock> blocks = new ArrayList<>();
        blocks.add(block(0, "text", "Left", 0, 100, 450, 300));
        blocks.add(block(1, "text", "Right", 550, 120, 1000, 280));
        blocks.add(block(2, "text", "Below", 0, 400, 1000, 500));

        List<VisualRow> rows = analyzer.analyze(blocks);

        assertEquals(2, rows.size());
        assertEquals(2, rows.get(0).getColumns().size());
        assertTrue(rows.get(1).isSingleBlock());
        assertEquals(100, rows.get(0).getTop());
        assertEquals(300, rows.get(0).getBottom());
    }

    @Test
    void headingStandsAloneEvenWhenOverlapping() {
        List<ParsedBlock> blocks = new ArrayList<>();
        blocks.add(block(0, "title", "# Title", 0, 0, 400, 50));
        blocks.add(block(1, "text", "Side note", 600, 10, 1000, 60));

        List<VisualRow> rows = analyzer.analyze(blocks);

        assertEquals(2, rows.size());
        assertTrue(rows.get(0).isSingleBlock());
        assertTrue(rows.get(1).isSingleBlock());
    }

    @Test
    void dropsEmptyAndZeroAreaBlocks() {
        List<ParsedBlock> blocks = new ArrayList<>();
        blocks.add(block(0, "text", "", 0, 0, 100, 100));
        blocks.add(block(1, "text", "flat", 0, 200, 100, 200));

        assertTrue(analyzer.analyze(blocks).isEmpty());
    }

    @Test
    void columnPercentagesAreRenormalized() {
        VisualRow two = new VisualRow(Arrays.asList(
                Column.of(block(0, "text", "a", 0, 0, 400, 10)),
                Column.of(block(1, "text", "b", 600, 0, 1000, 10))), 0, 10);
        assertEquals(Arrays.asList(50, 50), PageLayoutAnalyzer.columnWidthPercents(two, 1000));

        VisualRow three = new VisualRow(Arrays.asList(
                Column.of(block(0, "text", "a", 0, 0, 300, 10)),
                Column.of(block(1, "text", "b", 350, 0, 650, 10)),
                Column.of(block(2, "text", "c", 700, 0, 1000, 10))), 0, 10);
        assertEquals(Arrays.asList(33, 33, 33), PageLayoutAnalyzer.columnWidthPercents(three, 1000));
    }
}
