package com.example.scan2doc.util.docx;

import com.example.scan2doc.util.image.ExtractedImageStore;
import com.example.scan2doc.util.latex.LatexToMathMlConverter;
import com.example.scan2doc.util.latex.MathMlToOmmlConverter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.openxmlformats.schemas.officeDocument.x2006.math.CTOMath;
import org.openxmlformats.schemas.officeDocument.x2006.math.CTOMathPara;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTString;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Markdown → DOCX（Apache POI）
 *
 * 支持的块：标题（1~4 级，≥4 级统一为 4 级）、段落、独立公式、HTML 表格、列表、引用、代码块。
 * 支持的行内元素：文本、粗体、斜体、换行、图片（scan2doc-img:ID）、行内公式。
 *
 * 排版规则：
 * <ul>
 *   <li>中文字符（U+4E00~U+9FA5）占比 &gt; 20% 视为中文文档：微软雅黑、字间距 20、首行缩进 480、段后 0</li>
 *   <li>否则 Arial、段后 240</li>
 *   <li>标题 / 公式：段前 240、1.5 倍行距；紧跟表格的段落段前 360</li>
 *   <li>只有一张图片的段落：图片缩放到 600x600 像素框内；行内图片：100x100 像素框内</li>
 * </ul>
 *
 * 公式：LaTeX → MathML → OMML，任何一步失败都退化为 LaTeX 纯文本，不向上抛出。
 */
@Slf4j
public class DocxGenerator {

    static final String CJK_FONT = "Microsoft YaHei";
    static final String LATIN_FONT = "Arial";
    static final String MISSING_IMAGE = "[Missing Image]";

    private static final int IMAGE_BOX = 600;
    private static final int INLINE_IMAGE_BOX = 100;
    private static final int HEADING_LEVELS = 4;
    private static final int[] HEADING_SIZES = {32, 28, 26, 24};

    private static final Pattern CJK_CHAR = Pattern.compile("[\\u4e00-\\u9fa5]");
    private static final Pattern MD_IMAGE = Pattern.compile("!\\[[^\\]]*\\]\\([^)]*\\)");
    private static final Pattern MD_LINK = Pattern.compile("\\[[^\\]]*\\]\\([^)]*\\)");
    private static final Pattern MD_SYNTAX = Pattern.compile("[#*`~> +\\-=_]");
    private static final Pattern ANNOTATION = Pattern.compile("<annotation[\\s\\S]*?</annotation>");
    private static final Pattern BR_TAG = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);

    private final ExtractedImageStore imageStore;

    public DocxGenerator(ExtractedImageStore imageStore) {
        this.imageStore = imageStore;
    }

    /**
     * 生成 DOCX
     *
     * @param markdown Markdown 文本
     * @return DOCX 字节
     * @throws IOException 文档打包失败
     */
    public byte[] generate(String markdown) throws IOException {
        String source = markdown == null ? "" : markdown;
        boolean cjk = isCjkDominant(source);
        log.debug("生成 DOCX: 长度={}, 中文文档={}", source.length(), cjk);

        try (XWPFDocument doc = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            new DocumentWriter(doc, cjk).write(source);
            doc.write(out);
            return out.toByteArray();
        }
    }

    /**
     * 中文字符占比是否超过 20%（先去掉 Markdown 语法字符）
     */
    static boolean isCjkDominant(String text) {
        String clean = MD_IMAGE.matcher(text).replaceAll("");
        clean = MD_LINK.matcher(clean).replaceAll("");
        clean = MD_SYNTAX.matcher(clean).replaceAll("");
        if (clean.isEmpty()) {
            return false;
        }
        int cjkCount = 0;
        java.util.regex.Matcher matcher = CJK_CHAR.matcher(clean);
        while (matcher.find()) {
            cjkCount++;
        }
        return (double) cjkCount / clean.length() > 0.2;
    }

    /**
     * 单次生成的写入状态
     */
    private class DocumentWriter {

        private final XWPFDocument doc;
        private final boolean cjk;
        private final String font;
        private MarkdownMath math;
        private boolean prevWasTable;

        DocumentWriter(XWPFDocument doc, boolean cjk) {
            this.doc = doc;
            this.cjk = cjk;
            this.font = cjk ? CJK_FONT : LATIN_FONT;
        }

        void write(String markdown) {
            initStyles();
            math = MarkdownMath.extract(markdown);
            Node root = math.parse();

            Node node = root.getFirstChild();
            while (node != null) {
                writeBlock(node);
                node = node.getNext();
            }
        }

        private void initStyles() {
            XWPFStyles styles = doc.createStyles();
            CTFonts fonts = CTFonts.Factory.newInstance();
            fonts.setAscii(font);
            fonts.setHAnsi(font);
            fonts.setEastAsia(font);
            fonts.setCs(font);
            styles.setDefaultFonts(fonts);

            for (int level = 1; level <= HEADING_LEVELS; level++) {
                CTStyle ctStyle = CTStyle.Factory.newInstance();
                ctStyle.setStyleId("Heading" + level);
                ctStyle.setType(STStyleType.PARAGRAPH);
                CTString name = ctStyle.addNewName();
                name.setVal("heading " + level);
                ctStyle.addNewBasedOn().setVal("Normal");
                ctStyle.addNewQFormat();

                // outlineLvl 让 Word 导航窗格识别为标题
                CTPPrGeneral pPr = ctStyle.addNewPPr();
                pPr.addNewKeepNext();
                pPr.addNewOutlineLvl().setVal(BigInteger.valueOf(level - 1));

                CTRPr rPr = ctStyle.addNewRPr();
                rPr.addNewB();
                rPr.addNewSz().setVal(BigInteger.valueOf(HEADING_SIZES[level - 1]));

                styles.addStyle(new XWPFStyle(ctStyle, styles));
            }
        }

        private void writeBlock(Node node) {
            if (node instanceof Heading) {
                writeHeading((Heading) node);
                prevWasTable = false;
            } else if (node instanceof Paragraph) {
                writeParagraph((Paragraph) node);
                prevWasTable = false;
            } else if (node instanceof MathBlock) {
                writeMathBlock((MathBlock) node);
                prevWasTable = false;
            } else if (node instanceof HtmlBlock) {
                writeHtmlBlock((HtmlBlock) node);
            } else if (node instanceof BulletList || node instanceof OrderedList) {
                writeList(node);
                prevWasTable = false;
            } else if (node instanceof BlockQuote) {
                Node child = node.getFirstChild();
                while (child != null) {
                    writeBlock(child);
                    child = child.getNext();
                }
            } else if (node instanceof FencedCodeBlock) {
                writeCode(((FencedCodeBlock) node).getLiteral());
                prevWasTable = false;
            } else if (node instanceof IndentedCodeBlock) {
                writeCode(((IndentedCodeBlock) node).getLiteral());
                prevWasTable = false;
            }
        }

        private void writeHeading(Heading heading) {
            int level = Math.min(Math.max(heading.getLevel(), 1), HEADING_LEVELS);
            XWPFParagraph paragraph = doc.createParagraph();
            paragraph.setStyle("Heading" + level);
            applyBlockSpacing(paragraph);
            writeRuns(paragraph, collectRuns(heading, true));
        }

        private void writeParagraph(Paragraph node) {
            Image only = soleImage(node);
            if (only != null) {
                XWPFParagraph paragraph = doc.createParagraph();
                writeRuns(paragraph, List.of(DocRun.image(imageIdOf(only), IMAGE_BOX, IMAGE_BOX)));
                return;
            }

            XWPFParagraph paragraph = doc.createParagraph();
            if (cjk) {
                paragraph.setIndentationFirstLine(480);
            }
            if (prevWasTable) {
                paragraph.setSpacingBefore(360);
            }
            paragraph.setSpacingAfter(cjk ? 0 : 240);
            paragraph.setSpacingBetween(1.5, LineSpacingRule.AUTO);
            writeRuns(paragraph, collectRuns(node, false));
        }

        private void writeMathBlock(MathBlock block) {
            XWPFParagraph paragraph = doc.createParagraph();
            applyBlockSpacing(paragraph);
            appendMath(paragraph, block.getLatex(), true);
        }

        private void writeHtmlBlock(HtmlBlock block) {
            String html = math.restore(block.getLiteral());
            HtmlTableScanner.Table table = HtmlTableScanner.scan(html);
            if (table != null) {
                writeTable(table);
                prevWasTable = true;
                return;
            }
            if (html.toLowerCase().contains("<table")) {
                log.warn("HTML 表格中没有识别到行，已跳过");
                return;
            }

            // 其他 HTML 块只保留文字
            String text = HtmlTableScanner.stripTags(BR_TAG.matcher(html).replaceAll("\n"));
            if (!text.isEmpty()) {
                XWPFParagraph paragraph = doc.createParagraph();
                writeRuns(paragraph, textRuns(text, false, false));
                prevWasTable = false;
            }
        }

        private void writeList(Node list) {
            int number = list instanceof OrderedList ? ((OrderedList) list).getStartNumber() : 0;
            Node item = list.getFirstChild();
            while (item != null) {
                if (item instanceof ListItem) {
                    String marker = list instanceof OrderedList ? (number++) + ". " : "• ";
                    boolean first = true;
                    Node child = item.getFirstChild();
                    while (child != null) {
                        if (child instanceof Paragraph) {
                            XWPFParagraph paragraph = doc.createParagraph();
                            paragraph.setIndentationLeft(cjk ? 480 : 360);
                            paragraph.setSpacingAfter(cjk ? 0 : 120);
                            List<DocRun> runs = new ArrayList<>();
                            if (first) {
                                runs.add(DocRun.text(marker, false, false));
                            }
                            runs.addAll(collectRuns(child, false));
                            writeRuns(paragraph, runs);
                            first = false;
                        } else {
                            writeBlock(child);
                        }
                        child = child.getNext();
                    }
                }
                item = item.getNext();
            }
        }

        private void writeCode(String literal) {
            XWPFParagraph paragraph = doc.createParagraph();
            String[] lines = math.restore(literal).split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i == lines.length - 1 && lines[i].isEmpty()) {
                    break;
                }
                if (i > 0) {
                    paragraph.createRun().addBreak();
                }
                XWPFRun run = paragraph.createRun();
                run.setText(lines[i]);
                run.setFontFamily("Courier New");
            }
        }

        private void writeTable(HtmlTableScanner.Table source) {
            XWPFTable table = doc.createTable();
            table.setWidth("100%");

            XWPFTable.XWPFBorderType border = source.isLayout() ? XWPFTable.XWPFBorderType.NONE : XWPFTable.XWPFBorderType.SINGLE;
            int size = source.isLayout() ? 0 : 4;
            table.setTopBorder(border, size, 0, "auto");
            table.setBottomBorder(border, size, 0, "auto");
            table.setLeftBorder(border, size, 0, "auto");
            table.setRightBorder(border, size, 0, "auto");
            table.setInsideHBorder(border, size, 0, "auto");
            table.setInsideVBorder(border, size, 0, "auto");

            for (List<HtmlTableScanner.Cell> cells : source.getRows()) {
                XWPFTableRow row = table.insertNewTableRow(table.getNumberOfRows());
                for (HtmlTableScanner.Cell cell : cells) {
                    XWPFTableCell tableCell = row.createCell();
                    if (cell.getWidthPercent() != null) {
                        tableCell.setWidth(cell.getWidthPercent() + "%");
                    }
                    writeCell(tableCell, cell);
                }
            }
            // createTable 自带的空行
            table.removeRow(0);
        }

        private void writeCell(XWPFTableCell tableCell, HtmlTableScanner.Cell cell) {
            String cellMarkdown = HtmlTableScanner.cellToMarkdown(cell.getContent());
            MarkdownMath cellMath = MarkdownMath.extract(cellMarkdown);
            Node root = cellMath.parse();

            int imageBox = cell.getWidthPercent() != null
                    ? Math.max(INLINE_IMAGE_BOX, IMAGE_BOX * cell.getWidthPercent() / 100)
                    : INLINE_IMAGE_BOX;

            List<List<DocRun>> paragraphs = new ArrayList<>();
            List<Boolean> mathBlocks = new ArrayList<>();
            collectCellParagraphs(root, cell.isHeader(), imageBox, paragraphs, mathBlocks);

            if (paragraphs.isEmpty()) {
                paragraphs.add(textRuns(HtmlTableScanner.stripTags(cell.getContent()), cell.isHeader(), false));
                mathBlocks.add(false);
            }

            for (int i = 0; i < paragraphs.size(); i++) {
                XWPFParagraph paragraph = i == 0 ? tableCell.getParagraphs().get(0) : tableCell.addParagraph();
                List<DocRun> runs = paragraphs.get(i);
                if (mathBlocks.get(i)) {
                    appendMath(paragraph, runs.get(0).getValue(), true);
                } else {
                    writeRuns(paragraph, runs);
                }
            }
        }

        private void collectCellParagraphs(Node parent, boolean header, int imageBox,
                                           List<List<DocRun>> paragraphs, List<Boolean> mathBlocks) {
            Node node = parent.getFirstChild();
            while (node != null) {
                if (node instanceof Paragraph) {
                    Image only = soleImage((Paragraph) node);
                    if (only != null) {
                        paragraphs.add(List.of(DocRun.image(imageIdOf(only), imageBox, imageBox)));
                    } else {
                        paragraphs.add(collectRuns(node, header));
                    }
                    mathBlocks.add(false);
                } else if (node instanceof MathBlock) {
                    paragraphs.add(List.of(DocRun.math(((MathBlock) node).getLatex())));
                    mathBlocks.add(true);
                } else if (node instanceof Heading) {
                    paragraphs.add(collectRuns(node, true));
                    mathBlocks.add(false);
                } else {
                    collectCellParagraphs(node, header, imageBox, paragraphs, mathBlocks);
                }
                node = node.getNext();
            }
        }

        private void applyBlockSpacing(XWPFParagraph paragraph) {
            paragraph.setSpacingBefore(240);
            paragraph.setSpacingAfter(cjk ? 0 : 240);
            paragraph.setSpacingBetween(1.5, LineSpacingRule.AUTO);
        }

        // ========== 行内元素 ==========

        /**
         * 收集行内元素为 DocRun 序列（粗体/斜体状态沿嵌套传递）
         */
        private List<DocRun> collectRuns(Node parent, boolean bold) {
            List<DocRun> runs = new ArrayList<>();
            collectInline(parent, bold, false, runs);
            return runs;
        }

        private void collectInline(Node parent, boolean bold, boolean italic, List<DocRun> runs) {
            Node node = parent.getFirstChild();
            while (node != null) {
                if (node instanceof Text) {
                    runs.add(DocRun.text(((Text) node).getLiteral(), bold, italic));
                } else if (node instanceof StrongEmphasis) {
                    collectInline(node, true, italic, runs);
                } else if (node instanceof Emphasis) {
                    collectInline(node, bold, true, runs);
                } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
                    runs.add(DocRun.lineBreak());
                } else if (node instanceof Image) {
                    runs.add(DocRun.image(imageIdOf((Image) node), INLINE_IMAGE_BOX, INLINE_IMAGE_BOX));
                } else if (node instanceof MathInline) {
                    runs.add(DocRun.math(((MathInline) node).getLatex()));
                } else if (node instanceof Code) {
                    runs.add(DocRun.text(math.restore(((Code) node).getLiteral()), bold, italic));
                } else if (node instanceof HtmlInline) {
                    if (BR_TAG.matcher(((HtmlInline) node).getLiteral()).matches()) {
                        runs.add(DocRun.lineBreak());
                    }
                } else {
                    // 链接等容器只保留文字
                    collectInline(node, bold, italic, runs);
                }
                node = node.getNext();
            }
        }

        private List<DocRun> textRuns(String text, boolean bold, boolean italic) {
            List<DocRun> runs = new ArrayList<>();
            String[] lines = text.split("\n");
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    runs.add(DocRun.lineBreak());
                }
                runs.add(DocRun.text(lines[i], bold, italic));
            }
            return runs;
        }

        private Image soleImage(Paragraph paragraph) {
            Node first = paragraph.getFirstChild();
            if (first instanceof Image && first.getNext() == null) {
                return (Image) first;
            }
            return null;
        }

        /**
         * scan2doc-img:ID → ID，其他地址返回 null
         */
        private String imageIdOf(Image image) {
            String destination = image.getDestination();
            if (destination == null) {
                return null;
            }
            int colon = destination.indexOf(':');
            return colon >= 0 ? destination.substring(colon + 1) : null;
        }

        // ========== 写入 ==========

        private void writeRuns(XWPFParagraph paragraph, List<DocRun> runs) {
            for (DocRun docRun : runs) {
                switch (docRun.getKind()) {
                    case TEXT:
                        writeText(paragraph, docRun.getValue(), docRun.isBold(), docRun.isItalic());
                        break;
                    case BREAK:
                        paragraph.createRun().addBreak();
                        break;
                    case IMAGE:
                        writeImage(paragraph, docRun);
                        break;
                    case MATH:
                        appendMath(paragraph, docRun.getValue(), false);
                        break;
                    default:
                        throw new IllegalStateException("Unknown run kind: " + docRun.getKind());
                }
            }
        }

        private void writeText(XWPFParagraph paragraph, String text, boolean bold, boolean italic) {
            XWPFRun run = paragraph.createRun();
            run.setText(text);
            // 未加粗时不写 w:b，避免覆盖样式里的粗体
            if (bold) {
                run.setBold(true);
            }
            if (italic) {
                run.setItalic(true);
            }
            run.setFontFamily(font);
            if (cjk) {
                run.setCharacterSpacing(20);
            }
        }

        private void writeImage(XWPFParagraph paragraph, DocRun docRun) {
            String imageId = docRun.getValue();
            byte[] data = imageId != null ? imageStore.find(imageId) : null;
            if (data == null) {
                log.warn("图片不存在: {}", imageId);
                writeText(paragraph, MISSING_IMAGE, false, false);
                return;
            }

            try {
                int[] size = fitInto(data, docRun.getWidth(), docRun.getHeight());
                int pictureType = isJpeg(data) ? XWPFDocument.PICTURE_TYPE_JPEG : XWPFDocument.PICTURE_TYPE_PNG;
                XWPFRun run = paragraph.createRun();
                run.addPicture(new ByteArrayInputStream(data), pictureType, imageId + (isJpeg(data) ? ".jpg" : ".png"),
                        Units.pixelToEMU(size[0]), Units.pixelToEMU(size[1]));
            } catch (Exception e) {
                log.warn("插入图片失败: {}", imageId, e);
                writeText(paragraph, MISSING_IMAGE, false, false);
            }
        }

        /**
         * 公式：LaTeX → MathML（去掉 annotation）→ OMML；失败时输出 LaTeX 原文
         */
        private void appendMath(XWPFParagraph paragraph, String latex, boolean display) {
            try {
                String mathml = LatexToMathMlConverter.convert(latex, display);
                mathml = ANNOTATION.matcher(mathml).replaceAll("");
                String omml = MathMlToOmmlConverter.convert(mathml);
                CTOMath parsed = CTOMath.Factory.parse(omml);
                if (display) {
                    CTOMathPara mathPara = paragraph.getCTP().addNewOMathPara();
                    mathPara.addNewOMath().set(parsed);
                } else {
                    paragraph.getCTP().addNewOMath().set(parsed);
                }
            } catch (Exception e) {
                log.warn("公式转换失败，按纯文本输出: {} ({})", latex, e.getMessage());
                writeText(paragraph, latex, false, false);
            }
        }
    }

    /**
     * 按原图宽高比缩放到 boxW x boxH 框内；读不出尺寸时直接用框的大小
     */
    static int[] fitInto(byte[] data, int boxW, int boxH) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image != null && image.getWidth() > 0 && image.getHeight() > 0) {
                double scale = Math.min((double) boxW / image.getWidth(), (double) boxH / image.getHeight());
                return new int[]{
                        Math.max(1, (int) Math.round(image.getWidth() * scale)),
                        Math.max(1, (int) Math.round(image.getHeight() * scale))
                };
            }
        } catch (IOException e) {
            log.debug("读取图片尺寸失败，使用默认尺寸: {}", e.getMessage());
        }
        return new int[]{boxW, boxH};
    }

    static boolean isJpeg(byte[] data) {
        return data.length > 2 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8;
    }
}
