package com.example.scan2doc.util.docx;

import org.commonmark.node.CustomBlock;

/**
 * 独立公式块（单独成段的 $$...$$）
 */
public class MathBlock extends CustomBlock {

    private final String latex;

    public MathBlock(String latex) {
        this.latex = latex;
    }

    public String getLatex() {
        return latex;
    }
}
