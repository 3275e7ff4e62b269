package com.example.scan2doc.util.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathMlToOmmlConverterTest {

    private static String omml(String latex) {
        return MathMlToOmmlConverter.convert(LatexToMathMlConverter.convert(latex, false));
    }

    @Test
    void producesOmmlRoot() {
        String result = omml("x+1");

        assertTrue(result.startsWith("<m:oMath xmlns:m=\"" + MathMlToOmmlConverter.OMML_NS + "\">"));
        assertTrue(result.endsWith("</m:oMath>"));
        assertFalse(result.contains("x+1"), "annotation must not leak into the formula");
    }

    @Test
    void convertsFractionAndSuperscript() {
        String fraction = omml("\\frac{1}{2}");
        assertTrue(fraction.contains("<m:f>"));
        assertTrue(fraction.contains("<m:num>"));
        assertTrue(fraction.contains("<m:den>"));

        assertTrue(omml("x^2").contains("<m:sSup>"));
        assertTrue(omml("x_1").contains("<m:sSub>"));
        assertTrue(omml("\\sqrt{2}").contains("<m:rad>"));
    }

    @Test
    void convertsLargeOperatorsToNary() {
        String result = omml("\\sum_{i=1}^{n} i");

        assertTrue(result.contains("<m:nary>"));
        assertTrue(result.contains("<m:chr m:val=\"∑\"/>"));
    }

    @Test
    void rejectsInputWithoutMathElement() {
        assertThrows(IllegalArgumentException.class, () -> MathMlToOmmlConverter.convert("<div>x</div>"));
    }
}
