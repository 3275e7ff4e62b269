package com.example.scan2doc.util.markdown;

import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.layout.PageLayoutAnalyzer;
import com.example.scan2doc.util.layout.dto.Column;
import com.example.scan2doc.util.layout.dto.VisualRow;
import com.example.scan2doc.util.ocr.BoxResolver;
import com.example.scan2doc.util.ocr.OcrTagParser;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * OCR 结果 → Markdown
 *
 * 并排的块用 HTML 版式表格（class="layout-table"）还原，与 OCR 识别出的数据表格区分开。
 *
 * 输出约定：
 * <ul>
 *   <li>已切图的块输出 ![Figure N](scan2doc-img:ID)，N 按解析顺序从 1 编号</li>
 *   <li>单列单块的行输出为段落，段落之间空一行</li>
 *   <li>其余行输出为一行表格，每列一个 &lt;td width="N%"&gt;，列内多个块用 &lt;br/&gt;&lt;br/&gt; 连接</li>
 *   <li>单元格内的 Markdown 图片改写为 &lt;img&gt; 标签</li>
 *   <li>切图结果中没有出现在正文里的图片追加到末尾的 "## Figures" 小节</li>
 * </ul>
 */
@Slf4j
public class MarkdownAssembler {

    public static final String IMAGE_SCHEME = "scan2doc-img:";

    static final String LAYOUT_TABLE_OPEN = "<table class=\"layout-table\" border=\"0\" cellspacing=\"0\" cellpadding=\"0\""
            + " style=\"border-collapse: collapse; border: none;\"><tr>";

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(scan2doc-img:([^)]+)\\)");

    private final LayoutConfig config;
    private final PageLayoutAnalyzer layoutAnalyzer;

    public MarkdownAssembler() {
        this(LayoutConfig.loadDefault());
    }

    public MarkdownAssembler(LayoutConfig config) {
        this.config = config != null ? config : LayoutConfig.loadDefault();
        this.layoutAnalyzer = new PageLayoutAnalyzer(this.config);
    }

    /**
     * 生成 Markdown
     *
     * @param ocrResult OCR 结果
     * @param imageMap 权威框下标 → 切图ID，可为 null
     * @return Markdown 文本（首尾已去空白）
     * @throws MissingRawTextException raw_text 缺失
     */
    public String assemble(OcrResult ocrResult, Map<Integer, String> imageMap) throws MissingRawTextException {
        if (ocrResult == null || ocrResult.getRawText() == null || ocrResult.getRawText().isEmpty()) {
            throw new MissingRawTextException();
        }
        String rawText = ocrResult.getRawText();
        Map<Integer, String> images = imageMap != null ? imageMap : Collections.<Integer, String>emptyMap();

        if (!OcrTagParser.hasMarkers(rawText)) {
            log.debug("raw_text 中没有标记，原样输出");
            return rawText;
        }

        BoxResolver resolver = new BoxResolver(ocrResult.getBoxes(), ocrResult.getImageDims(), config);
        List<ParsedBlock> parsed = new OcrTagParser(OcrTagParser.Mode.MARKDOWN, config.DEFAULT_PAGE_WIDTH)
                .parse(ocrResult, resolver, images);

        // 图片编号按解析顺序，与最终版面顺序无关
        int figureCount = 1;
        List<ParsedBlock> blocks = new ArrayList<>();
        for (ParsedBlock block : parsed) {
            if (block.getImageId() != null) {
                String link = "![Figure " + figureCount++ + "](" + IMAGE_SCHEME + block.getImageId() + ")";
                blocks.add(block.withContent(link));
            } else {
                blocks.add(block);
            }
        }

        if (blocks.isEmpty()) {
            return rawText;
        }

        List<VisualRow> rows = layoutAnalyzer.analyze(blocks);

        double pageW = ocrResult.getImageDims() != null && ocrResult.getImageDims().getW() > 0
                ? ocrResult.getImageDims().getW() : config.DEFAULT_PAGE_WIDTH;

        StringBuilder markdown = new StringBuilder(renderRows(rows, pageW));

        // 没有落到正文中的切图
        Set<String> usedImageIds = new HashSet<>();
        for (VisualRow row : rows) {
            for (Column column : row.getColumns()) {
                for (ParsedBlock block : column.getBlocks()) {
                    if (block.getImageId() != null) {
                        usedImageIds.add(block.getImageId());
                    }
                }
            }
        }

        List<String> remaining = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : new TreeMap<>(images).entrySet()) {
            String id = entry.getValue();
            if (id != null && !usedImageIds.contains(id)) {
                remaining.add("![Figure " + figureCount++ + "](" + IMAGE_SCHEME + id + ")");
            }
        }
        if (!remaining.isEmpty()) {
            log.debug("{} 张切图未出现在正文中，追加到 Figures 小节", remaining.size());
            markdown.append("\n\n## Figures\n");
            markdown.append(String.join("\n", remaining));
        }

        return markdown.toString().trim();
    }

    private String renderRows(List<VisualRow> rows, double pageW) {
        StringBuilder output = new StringBuilder();

        for (VisualRow row : rows) {
            if (row.getColumns().isEmpty()) {
                continue;
            }

            if (row.isSingleBlock()) {
                output.append(row.getColumns().get(0).getBlocks().get(0).getContent()).append("\n\n");
                continue;
            }

            List<Integer> widths = PageLayoutAnalyzer.columnWidthPercents(row, pageW);
            output.append(LAYOUT_TABLE_OPEN);
            for (int i = 0; i < row.getColumns().size(); i++) {
                Column column = row.getColumns().get(i);
                List<String> parts = new ArrayList<>();
                for (ParsedBlock block : column.getBlocks()) {
                    parts.add(block.getContent());
                }
                String content = MARKDOWN_IMAGE.matcher(String.join("<br/><br/>", parts))
                        .replaceAll("<img src=\"scan2doc-img:$2\" alt=\"$1\" />");

                output.append("<td width=\"").append(widths.get(i))
                        .append("%\" style=\"border: none; vertical-align: top;\">")
                        .append(content)
                        .append("</td>");
            }
            output.append("</tr></table>\n\n");
        }
        return output.toString();
    }
}
