package com.example.scan2doc.util.ocr;

import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.util.ocr.dto.ImageDims;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCR 标记文本解析器
 *
 * 输入格式（重复出现，之间没有分隔符保证）：
 * <pre>
 * &lt;|ref|&gt;TYPE&lt;|/ref|&gt;&lt;|det|&gt;[[x1,y1,x2,y2]]&lt;|/det|&gt;CONTENT
 * </pre>
 *
 * 实现方式：正则只负责定位标记头，块内容从标记头结束位置截取到下一个 &lt;|ref|&gt; 出现的位置。
 * 标记之前、残缺标记之后、最后一个块之后的非空白游离文本（gap text）在 Markdown 模式下
 * 保留为独立的 text 块（untagged = true）。
 */
@Slf4j
public class OcrTagParser {

    /**
     * 标记头：&lt;|ref|&gt;TYPE&lt;|/ref|&gt;&lt;|det|&gt;[[COORDS]]&lt;|/det|&gt;
     */
    private static final Pattern HEADER = Pattern.compile(
            "<\\|ref\\|>(.*?)<\\|/ref\\|><\\|det\\|>\\[\\[(.*?)\\]\\]<\\|/det\\|>");

    private static final String REF_OPEN = "<|ref|>";

    /**
     * 解析模式
     */
    public enum Mode {
        /** 保留游离文本，LaTeX 定界符统一为 $ / $$ */
        MARKDOWN,
        /** 只保留标记块，内容原样（PDF 文本层自行清洗） */
        PDF
    }

    private final Mode mode;
    private final double defaultPageWidth;

    public OcrTagParser(Mode mode) {
        this(mode, 1000.0);
    }

    public OcrTagParser(Mode mode, double defaultPageWidth) {
        this.mode = mode;
        this.defaultPageWidth = defaultPageWidth;
    }

    /**
     * 解析 OCR 结果
     *
     * @param ocrResult OCR 结果
     * @param resolver 检测框解析器（每次调用新建）
     * @param imageMap 权威框下标 → 切图ID，可为 null
     * @return 按文档顺序排列的块
     * @throws MissingRawTextException raw_text 缺失
     */
    public List<ParsedBlock> parse(OcrResult ocrResult, BoxResolver resolver, Map<Integer, String> imageMap)
            throws MissingRawTextException {
        if (ocrResult == null || ocrResult.getRawText() == null || ocrResult.getRawText().isEmpty()) {
            throw new MissingRawTextException();
        }
        Map<Integer, String> images = imageMap != null ? imageMap : Collections.<Integer, String>emptyMap();

        String rawText = ocrResult.getRawText();
        ImageDims dims = ocrResult.getImageDims();
        double pageW = dims != null && dims.getW() > 0 ? dims.getW() : defaultPageWidth;
        double pageH = dims != null && dims.getH() > 0 ? dims.getH() : 0;

        List<ParsedBlock> blocks = new ArrayList<>();
        Matcher matcher = HEADER.matcher(rawText);
        int cursor = 0;
        double lastBottom = 0;
        double maxBottom = 0;

        while (matcher.find()) {
            // 上一个块结束位置 → 本标记头开始位置之间的游离文本
            addGap(blocks, rawText.substring(cursor, matcher.start()), lastBottom, pageW);

            int headerEnd = matcher.end();
            String type = matcher.group(1).trim().toLowerCase();
            String coordsStr = matcher.group(2);

            // 块内容截止到下一个 <|ref|>（即使该标记残缺），残缺标记之后的文本作为游离文本保留
            int nextRef = rawText.indexOf(REF_OPEN, headerEnd);
            int contentEnd = nextRef == -1 ? rawText.length() : nextRef;
            String rawContent = rawText.substring(headerEnd, contentEnd);
            cursor = contentEnd;

            double[] coords = parseCoords(coordsStr);
            if (coords == null) {
                log.debug("跳过坐标无效的块: type={}, coords={}", type, coordsStr);
                continue;
            }

            double[] box = resolver.resolve(coords);
            String imageId = null;
            int matchIndex = resolver.getLastMatchIndex();
            if (matchIndex != -1) {
                imageId = images.get(matchIndex);
            }

            String content = rawContent.trim();
            if (mode == Mode.MARKDOWN) {
                content = normalizeLatexDelimiters(content);
            }

            blocks.add(new ParsedBlock(blocks.size(), type, content, box, false, imageId));
            lastBottom = box[3];
            maxBottom = Math.max(maxBottom, box[3]);
        }

        // 最后一个块之后的游离文本放到页面底部；没有任何标记时整段文本落在页首
        double tailY = cursor == 0 ? 0 : Math.max(pageH, maxBottom);
        addGap(blocks, rawText.substring(cursor), tailY, pageW);

        return blocks;
    }

    /**
     * raw_text 中是否存在至少一个标记头
     */
    public static boolean hasMarkers(String rawText) {
        return rawText != null && HEADER.matcher(rawText).find();
    }

    /**
     * 游离文本生成一个满宽、1 像素高的 text 块，纵向位置 y 决定它在版面中的行序
     */
    private void addGap(List<ParsedBlock> blocks, String text, double y, double pageW) {
        if (mode != Mode.MARKDOWN || text.trim().isEmpty()) {
            return;
        }
        double[] box = new double[]{0, y, pageW, y + 1};
        blocks.add(new ParsedBlock(blocks.size(), "text", normalizeLatexDelimiters(text.trim()), box, true, null));
    }

    /**
     * 解析 "x1,y1,x2,y2"，必须恰好 4 个数字，否则返回 null
     */
    static double[] parseCoords(String coordsStr) {
        if (coordsStr == null) {
            return null;
        }
        String[] parts = coordsStr.split(",");
        if (parts.length != 4) {
            return null;
        }
        double[] coords = new double[4];
        try {
            for (int i = 0; i < 4; i++) {
                coords[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return coords;
    }

    /**
     * LaTeX 定界符统一：\( \) → $，\[ \] → $$
     *
     * 示例：
     * 输入："温度 \(100^{\circ}\mathrm{C}\)"
     * 输出："温度 $100^{\circ}\mathrm{C}$"
     */
    public static String normalizeLatexDelimiters(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("\\(", "$")
                .replace("\\)", "$")
                .replace("\\[", "$$")
                .replace("\\]", "$$");
    }
}
