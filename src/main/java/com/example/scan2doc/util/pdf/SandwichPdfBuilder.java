package com.example.scan2doc.util.pdf;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.UnsupportedImageFormatException;
import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.ocr.BoxResolver;
import com.example.scan2doc.util.ocr.OcrTagParser;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import com.example.scan2doc.util.pdf.dto.FitResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 双层 PDF（图像 + 透明文字层）
 *
 * 生成流程：
 * 1. 整页图像铺满页面，页面尺寸按 150 DPI 由像素换算为 PDF 点
 * 2. 加载中文字体（失败时降级到 Helvetica，不影响生成）
 * 3. 解析 raw_text 得到文本块，修复表格错位，坐标按比例换算到 PDF 点
 * 4. 每个文本块二分查找字号后逐行写入，文字透明度为 0
 *
 * 坐标系：检测框原点在左上角，PDF 原点在左下角，y 需要翻转。
 */
@Slf4j
public class SandwichPdfBuilder {

    public static final float DEFAULT_DPI = 150f;
    public static final float POINTS_PER_INCH = 72f;

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    private final FontLoader fontLoader;
    private final String fontUrl;
    private final LayoutConfig config;

    public SandwichPdfBuilder(FontLoader fontLoader, String fontUrl, LayoutConfig config) {
        this.fontLoader = fontLoader;
        this.fontUrl = fontUrl;
        this.config = config != null ? config : LayoutConfig.loadDefault();
    }

    /**
     * 生成双层 PDF
     *
     * @param image 整页图像（JPEG / PNG）
     * @param ocrResult OCR 结果
     * @return PDF 字节
     * @throws UnsupportedImageFormatException 图像既不是 JPEG 也不是 PNG
     * @throws com.example.scan2doc.exception.MissingRawTextException raw_text 缺失
     * @throws DocGenException 写 PDF 失败
     */
    public byte[] build(byte[] image, OcrResult ocrResult) throws DocGenException {
        try (PDDocument doc = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            PDImageXObject pageImage = embedImage(doc, image);
            PDFont font = loadFont(doc);

            float pdfWidth = pageImage.getWidth() / DEFAULT_DPI * POINTS_PER_INCH;
            float pdfHeight = pageImage.getHeight() / DEFAULT_DPI * POINTS_PER_INCH;
            PDPage page = new PDPage(new PDRectangle(pdfWidth, pdfHeight));
            doc.addPage(page);

            List<ParsedBlock> blocks = parseBlocks(ocrResult);
            float scale = pdfWidth / pageImage.getWidth();

            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.drawImage(pageImage, 0, 0, pdfWidth, pdfHeight);
                overlayText(cs, blocks, pdfHeight, scale, font);
            }

            doc.save(out);
            log.info("PDF 生成完成: {}x{}pt, 文本块 {} 个, 字体 {}",
                    Math.round(pdfWidth), Math.round(pdfHeight), blocks.size(), font.getName());
            return out.toByteArray();
        } catch (IOException e) {
            throw new DocGenException(DocGenException.ErrorKind.IO_FAILURE, "Failed to write PDF", e);
        }
    }

    private List<ParsedBlock> parseBlocks(OcrResult ocrResult) throws DocGenException {
        BoxResolver resolver = new BoxResolver(ocrResult.getBoxes(), ocrResult.getImageDims(), config);
        OcrTagParser parser = new OcrTagParser(OcrTagParser.Mode.PDF, config.DEFAULT_PAGE_WIDTH);
        return PdfBlockRepair.reassignTables(parser.parse(ocrResult, resolver, null));
    }

    /**
     * 先按 JPEG 嵌入（保持原始压缩），再按 PNG 解码后无损嵌入
     */
    PDImageXObject embedImage(PDDocument doc, byte[] image) throws UnsupportedImageFormatException {
        if (image == null || image.length < 4) {
            throw new UnsupportedImageFormatException(null);
        }
        IOException jpegError = null;
        if (isJpeg(image)) {
            try {
                return JPEGFactory.createFromByteArray(doc, image);
            } catch (IOException e) {
                jpegError = e;
                log.debug("JPEG 嵌入失败，尝试 PNG: {}", e.getMessage());
            }
        }
        if (isPng(image)) {
            try {
                BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image));
                if (decoded != null) {
                    return LosslessFactory.createFromImage(doc, decoded);
                }
            } catch (IOException e) {
                throw new UnsupportedImageFormatException(e);
            }
        }
        throw new UnsupportedImageFormatException(jpegError);
    }

    /**
     * 中文字体加载失败时降级为 Helvetica（中文行绘制时会被跳过）
     */
    private PDFont loadFont(PDDocument doc) {
        byte[] fontBytes = fontLoader != null ? fontLoader.fetchFontBytes(fontUrl) : null;
        if (fontBytes != null) {
            try {
                return PDType0Font.load(doc, new ByteArrayInputStream(fontBytes));
            } catch (IOException | RuntimeException e) {
                log.warn("自定义字体嵌入失败，使用标准字体: {}", e.getMessage());
            }
        }
        return new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    }

    private void overlayText(PDPageContentStream cs, List<ParsedBlock> blocks, float pdfHeight, float scale,
                             PDFont font) throws IOException {
        PDExtendedGraphicsState invisible = new PDExtendedGraphicsState();
        invisible.setNonStrokingAlphaConstant(0f);
        invisible.setStrokingAlphaConstant(0f);

        cs.saveGraphicsState();
        cs.setGraphicsStateParameters(invisible);
        cs.setNonStrokingColor(1f, 0f, 0f);

        TextMeasurer measurer = new PdfFontMeasurer(font);
        for (ParsedBlock block : blocks) {
            if (ParsedBlock.isImageType(block.getType()) || block.getContent().isEmpty()) {
                continue;
            }
            String text = PdfTextCleaner.textFor(block);
            if (text.isEmpty()) {
                continue;
            }

            float x = (float) block.left() * scale;
            float y1 = (float) block.top() * scale;
            float boxWidth = (float) block.width() * scale;
            float boxHeight = (float) block.height() * scale;

            FitResult fit = PdfTextFitter.fit(text, boxWidth, boxHeight, measurer);
            drawLines(cs, fit, x, y1, boxHeight, pdfHeight, font);
        }

        cs.restoreGraphicsState();
    }

    private void drawLines(PDPageContentStream cs, FitResult fit, float x, float y1, float boxHeight,
                           float pdfHeight, PDFont font) throws IOException {
        float fontSize = fit.getFontSize();
        float lineHeight = fontSize * PdfTextFitter.LINE_HEIGHT_FACTOR;
        float currentY = pdfHeight - y1 - fontSize + fontSize * 0.1f;
        float bottomLimit = pdfHeight - y1 - boxHeight;

        for (String rawLine : fit.getLines()) {
            if (currentY < bottomLimit) {
                break;
            }
            String line = CONTROL_CHARS.matcher(rawLine).replaceAll(" ");
            try {
                // 先编码一次，字体不支持的字符在 beginText 之前失败
                font.encode(line);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("文字行绘制失败，已跳过: {} ({})", abbreviate(line), e.getMessage());
                currentY -= lineHeight;
                continue;
            }

            cs.beginText();
            cs.setFont(font, fontSize);
            cs.newLineAtOffset(x, currentY);
            cs.showText(line);
            cs.endText();
            currentY -= lineHeight;
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 20 ? line.substring(0, 20) : line;
    }

    public static boolean isJpeg(byte[] data) {
        return (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8;
    }

    public static boolean isPng(byte[] data) {
        return (data[0] & 0xFF) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G';
    }
}
