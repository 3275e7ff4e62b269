package com.example.scan2doc.util.latex;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatexToUnicodeConverterTest {

    @Test
    void convertsUnitsAndSpecialSymbols() {
        assertEquals("100°C", LatexToUnicodeConverter.convert("100^{\\circ}\\mathrm{C}"));
        assertEquals("30%", LatexToUnicodeConverter.convert("30\\%"));
        assertEquals("∞", LatexToUnicodeConverter.convert("\\infty"));
    }

    @Test
    void convertsGreekLetters() {
        assertEquals("α + β = π", LatexToUnicodeConverter.convert("\\alpha + \\beta = \\pi"));
        assertEquals("Δ", LatexToUnicodeConverter.convert("\\Delta"));
    }

    @Test
    void convertsOperatorsAndRelations() {
        assertEquals("a × b ≤ c", LatexToUnicodeConverter.convert("a \\times b \\le c"));
        assertEquals("x → y", LatexToUnicodeConverter.convert("x \\rightarrow y"));
        assertEquals("∀ x ∈ S", LatexToUnicodeConverter.convert("\\forall x \\in S"));
        assertEquals("∃ x ∈ R, x > 0", LatexToUnicodeConverter.convert("\\exists x \\in \\mathbb{R}, x > 0"));
        assertEquals("A ∪ B ⊂ C", LatexToUnicodeConverter.convert("A \\cup B \\subset C"));
    }

    @Test
    void convertsSuperscripts() {
        assertEquals("x² + y³", LatexToUnicodeConverter.convert("x^2 + y^3"));
        assertEquals("10⁻¹", LatexToUnicodeConverter.convert("10^{-1}"));
        assertEquals("x²ⁿ", LatexToUnicodeConverter.convert("x^{2n}"));
        assertEquals("x¹²", LatexToUnicodeConverter.convert("x^{12}"));
    }

    @Test
    void linearizesSuperscriptsWithoutUnicodeForm() {
        assertEquals("xa", LatexToUnicodeConverter.convert("x^{a}"));
        assertEquals("x1a", LatexToUnicodeConverter.convert("x^{1a}"));
        assertEquals("x°", LatexToUnicodeConverter.convert("x^{°}"));
    }

    @Test
    void stripsFormattingCommands() {
        assertEquals("kg", LatexToUnicodeConverter.convert("\\mathrm{kg}"));
        assertEquals("Hello", LatexToUnicodeConverter.convert("\\text{Hello}"));
        assertEquals("v", LatexToUnicodeConverter.convert("\\mathbf{v}"));
        assertEquals("100°C is hot", LatexToUnicodeConverter.convert("100^{\\circ}\\mathrm{C} \\text{ is hot}"));
    }

    @Test
    void linearizesFractionsAndRoots() {
        assertEquals("(1)/(2)", LatexToUnicodeConverter.convert("\\frac{1}{2}"));
        assertEquals("√(x+1)", LatexToUnicodeConverter.convert("\\sqrt{x+1}"));
    }

    @Test
    void flattensSubscripts() {
        assertEquals("x1 + x2", LatexToUnicodeConverter.convert("x_{1} + x_{2}"));
        assertEquals("xi²", LatexToUnicodeConverter.convert("x_{i}^{2}"));
    }

    @Test
    void removesInlineDelimiters() {
        assertEquals("x=1", LatexToUnicodeConverter.convert("\\(x=1\\)"));
    }

    @Test
    void leavesUnknownInputUntouched() {
        assertEquals("Hello World", LatexToUnicodeConverter.convert("Hello World"));
        assertEquals("\\unknownsymbol", LatexToUnicodeConverter.convert("\\unknownsymbol"));
    }

    @Test
    void doesNotMatchSymbolsInsideLongerCommands() {
        assertEquals("\\circle", LatexToUnicodeConverter.convert("\\circle"));
        assertEquals("\\inn", LatexToUnicodeConverter.convert("\\inn"));
        assertEquals("a \\pmod b", LatexToUnicodeConverter.convert("a \\pmod b"));
        assertEquals("90° \\circle", LatexToUnicodeConverter.convert("90^{\\circ} \\circle"));
    }

    @Test
    void convertingTwiceGivesSameResult() {
        List<String> inputs = Arrays.asList(
                "100^{\\circ}\\mathrm{C}", "30\\%", "\\infty",
                "\\alpha + \\beta = \\pi", "a \\times b \\le c", "\\exists x \\in \\mathbb{R}, x > 0",
                "x^2 + y^3", "10^{-1}", "x^{2n}", "x^{a}", "x^{1a}",
                "\\frac{1}{2}", "\\sqrt{x+1}", "x_{i}^{2}", "\\(x=1\\)",
                "\\circle", "Hello World",
                "snake_case_name and a^b", "price_1 ^ total");
        for (String input : inputs) {
            String once = LatexToUnicodeConverter.convert(input);
            assertEquals(once, LatexToUnicodeConverter.convert(once), input);
        }
    }
}
