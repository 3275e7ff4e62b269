package com.example.scan2doc.util.pdf;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PdfFontMeasurerTest {

    private final PdfFontMeasurer measurer =
            new PdfFontMeasurer(new PDType1Font(Standard14Fonts.FontName.HELVETICA));

    @Test
    void scalesGlyphWidthsByFontSize() {
        float small = measurer.widthOf("Hello", 10);
        float large = measurer.widthOf("Hello", 20);

        assertTrue(small > 0);
        assertEquals(small * 2, large, 0.001f);
    }

    @Test
    void estimatesUnencodableCharactersAsOneEm() {
        float latin = measurer.widthOf("A", 10);

        assertEquals(latin + 20f, measurer.widthOf("A中文", 10), 0.001f);
    }
}
