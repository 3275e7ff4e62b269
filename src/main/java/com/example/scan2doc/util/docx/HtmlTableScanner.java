package com.example.scan2doc.util.docx;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTML 表格的行/单元格扫描器
 *
 * 不是完整的 HTML 解析器，只识别 &lt;tr&gt;、&lt;td&gt; / &lt;th&gt; 以及可选的 width="N%"。
 * class="layout-table" 表示版式表格（无边框），否则为数据表格（单线边框）。
 */
public final class HtmlTableScanner {

    private static final Pattern ROW = Pattern.compile("<tr[^>]*>([\\s\\S]*?)</tr>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL = Pattern.compile("<(td|th)([^>]*)>([\\s\\S]*?)</\\1>", Pattern.CASE_INSENSITIVE);
    private static final Pattern WIDTH = Pattern.compile("width=\"(\\d+)%?\"");

    private static final Pattern IMG_WITH_ALT =
            Pattern.compile("<img\\s+src=\"scan2doc-img:([a-zA-Z0-9_-]+)\"[^>]*alt=\"([^\"]*)\"[^>]*>");
    private static final Pattern IMG =
            Pattern.compile("<img\\s+src=\"scan2doc-img:([a-zA-Z0-9_-]+)\"[^>]*>");
    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CENTER = Pattern.compile("</?center>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private HtmlTableScanner() {
    }

    public static class Cell {
        private final boolean header;
        private final Integer widthPercent;
        private final String content;

        Cell(boolean header, Integer widthPercent, String content) {
            this.header = header;
            this.widthPercent = widthPercent;
            this.content = content;
        }

        public boolean isHeader() {
            return header;
        }

        /**
         * 未指定宽度时为 null
         */
        public Integer getWidthPercent() {
            return widthPercent;
        }

        public String getContent() {
            return content;
        }
    }

    public static class Table {
        private final boolean layout;
        private final List<List<Cell>> rows;

        Table(boolean layout, List<List<Cell>> rows) {
            this.layout = layout;
            this.rows = rows;
        }

        public boolean isLayout() {
            return layout;
        }

        public List<List<Cell>> getRows() {
            return rows;
        }
    }

    /**
     * 扫描 HTML 块
     *
     * @param html HTML 块文本
     * @return 表格；不含 &lt;table 或没有任何行时返回 null
     */
    public static Table scan(String html) {
        if (html == null || !html.toLowerCase().contains("<table")) {
            return null;
        }
        boolean layout = html.contains("class=\"layout-table\"");

        List<List<Cell>> rows = new ArrayList<>();
        Matcher rowMatcher = ROW.matcher(html);
        while (rowMatcher.find()) {
            List<Cell> cells = new ArrayList<>();
            Matcher cellMatcher = CELL.matcher(rowMatcher.group(1));
            while (cellMatcher.find()) {
                boolean header = "th".equalsIgnoreCase(cellMatcher.group(1));
                Matcher widthMatcher = WIDTH.matcher(cellMatcher.group(2));
                Integer width = widthMatcher.find() ? Integer.valueOf(widthMatcher.group(1)) : null;
                cells.add(new Cell(header, width, cellMatcher.group(3).trim()));
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows.isEmpty() ? null : new Table(layout, rows);
    }

    /**
     * 单元格 HTML → Markdown：&lt;img&gt; 还原为图片语法，&lt;br/&gt; 变为分段，去掉 &lt;center&gt;
     *
     * 示例：
     * 输入：&lt;img src="scan2doc-img:p1_0_ab" alt="Figure 1" /&gt;&lt;br/&gt;图 1 示意图
     * 输出：![Figure 1](scan2doc-img:p1_0_ab)\n\n图 1 示意图
     */
    public static String cellToMarkdown(String cellHtml) {
        String markdown = IMG_WITH_ALT.matcher(cellHtml).replaceAll("![$2](scan2doc-img:$1)");
        markdown = IMG.matcher(markdown).replaceAll("![Figure](scan2doc-img:$1)");
        markdown = BR.matcher(markdown).replaceAll("\n\n");
        return CENTER.matcher(markdown).replaceAll("");
    }

    /**
     * 去掉所有标签（单元格解析不出段落时的兜底文本）
     */
    public static String stripTags(String html) {
        return TAG.matcher(html).replaceAll("").trim();
    }
}
