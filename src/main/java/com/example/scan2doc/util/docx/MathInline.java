package com.example.scan2doc.util.docx;

import org.commonmark.node.CustomNode;

/**
 * 行内公式节点（$...$），display 为 true 时来自 $$...$$
 */
public class MathInline extends CustomNode {

    private final String latex;
    private final boolean display;

    public MathInline(String latex, boolean display) {
        this.latex = latex;
        this.display = display;
    }

    public String getLatex() {
        return latex;
    }

    public boolean isDisplay() {
        return display;
    }
}
