package com.example.scan2doc.util.pdf;

import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfBlockRepairTest {

    private static ParsedBlock block(int index, String type, String content) {
        return new ParsedBlock(index, type, content, new double[]{0, index * 100, 100, index * 100 + 50});
    }

    @Test
    void movesTableHtmlBackIntoEmptyTableBlock() {
        List<ParsedBlock> blocks = Arrays.asList(
                block(0, "table", ""),
                block(1, "table_caption", "Table 1 <table><tr><td>1</td></tr></table>"));

        List<ParsedBlock> repaired = PdfBlockRepair.reassignTables(blocks);

        assertEquals("<table><tr><td>1</td></tr></table>", repaired.get(0).getContent());
        assertEquals("Table 1", repaired.get(1).getContent());
        assertEquals("", blocks.get(0).getContent());
    }

    @Test
    void joinsSeveralTables() {
        List<ParsedBlock> repaired = PdfBlockRepair.reassignTables(Arrays.asList(
                block(0, "table", " "),
                block(1, "text", "<table><tr><td>a</td></tr></table><table><tr><td>b</td></tr></table>")));

        assertEquals("<table><tr><td>a</td></tr></table>\n\n<table><tr><td>b</td></tr></table>",
                repaired.get(0).getContent());
        assertEquals("", repaired.get(1).getContent());
    }

    @Test
    void leavesFilledTablesAlone() {
        List<ParsedBlock> blocks = Arrays.asList(
                block(0, "table", "<table><tr><td>x</td></tr></table>"),
                block(1, "text", "<table><tr><td>y</td></tr></table>"));

        List<ParsedBlock> repaired = PdfBlockRepair.reassignTables(blocks);

        assertSame(blocks.get(0), repaired.get(0));
        assertSame(blocks.get(1), repaired.get(1));
    }
}
