package com.example.scan2doc.util.docx;

/**
 * 段落中的一个输出单元（文本 / 换行 / 图片 / 公式）
 *
 * 按 {@link Kind} 区分，写入文档时对 kind 做穷举 switch。
 */
public final class DocRun {

    public enum Kind {
        TEXT,
        BREAK,
        IMAGE,
        MATH
    }

    private final Kind kind;
    private final String value;
    private final boolean bold;
    private final boolean italic;
    private final int width;
    private final int height;

    private DocRun(Kind kind, String value, boolean bold, boolean italic, int width, int height) {
        this.kind = kind;
        this.value = value;
        this.bold = bold;
        this.italic = italic;
        this.width = width;
        this.height = height;
    }

    public static DocRun text(String text, boolean bold, boolean italic) {
        return new DocRun(Kind.TEXT, text, bold, italic, 0, 0);
    }

    public static DocRun lineBreak() {
        return new DocRun(Kind.BREAK, "", false, false, 0, 0);
    }

    /**
     * @param imageId 切图ID
     * @param width 外框宽度（像素），图片按比例缩放到框内
     * @param height 外框高度（像素）
     */
    public static DocRun image(String imageId, int width, int height) {
        return new DocRun(Kind.IMAGE, imageId, false, false, width, height);
    }

    public static DocRun math(String latex) {
        return new DocRun(Kind.MATH, latex, false, false, 0, 0);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * TEXT 为文本，IMAGE 为图片ID，MATH 为 LaTeX 源码
     */
    public String getValue() {
        return value;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
