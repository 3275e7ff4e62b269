package com.example.scan2doc.util.image;

import com.example.scan2doc.util.ocr.dto.OcrBox;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 按 OCR 检测框从整页图像中切出插图
 *
 * 只处理 label 为 image / figure 的框，坐标为页面像素坐标，超出图像的部分截掉。
 * 图片ID格式：{pageId}_{框下标}_{随机串}
 */
@Slf4j
public class PageImageSlicer {

    private final ExtractedImageStore store;

    public PageImageSlicer(ExtractedImageStore store) {
        this.store = store;
    }

    /**
     * 切图并保存
     *
     * @param pageId 页面ID（任务ID）
     * @param pageImage 整页图像（JPEG / PNG）
     * @param boxes OCR 权威检测框
     * 页面无法解码时返回空结果；单个框切图或保存失败时跳过该框。
     *
     * @return 框下标 → 图片ID（按下标升序），只包含保存成功的框
     */
    public Map<Integer, String> sliceImages(String pageId, byte[] pageImage, List<OcrBox> boxes) {
        Map<Integer, String> result = new LinkedHashMap<>();
        if (boxes == null || boxes.isEmpty()) {
            return result;
        }

        boolean hasTarget = false;
        for (OcrBox box : boxes) {
            if (box != null && ParsedBlock.isImageType(box.getLabel())) {
                hasTarget = true;
                break;
            }
        }
        if (!hasTarget) {
            return result;
        }

        BufferedImage page;
        try {
            page = ImageIO.read(new ByteArrayInputStream(pageImage));
        } catch (IOException | RuntimeException e) {
            log.warn("[pageId: {}] 页面图像解码失败，跳过切图: {}", pageId, e.getMessage());
            return result;
        }
        if (page == null) {
            log.warn("[pageId: {}] 页面图像无法解码，跳过切图", pageId);
            return result;
        }

        for (int index = 0; index < boxes.size(); index++) {
            OcrBox box = boxes.get(index);
            if (box == null || !ParsedBlock.isImageType(box.getLabel())
                    || box.getBox() == null || box.getBox().length != 4) {
                continue;
            }
            double[] b = box.getBox();
            int x1 = clamp((int) Math.floor(b[0]), page.getWidth());
            int y1 = clamp((int) Math.floor(b[1]), page.getHeight());
            int x2 = clamp((int) Math.ceil(b[2]), page.getWidth());
            int y2 = clamp((int) Math.ceil(b[3]), page.getHeight());
            int width = x2 - x1;
            int height = y2 - y1;
            if (width <= 0 || height <= 0) {
                log.debug("[pageId: {}] 跳过零面积检测框 #{}", pageId, index);
                continue;
            }

            String imageId = pageId + "_" + index + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            try {
                BufferedImage slice = page.getSubimage(x1, y1, width, height);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                if (!ImageIO.write(slice, "png", out)) {
                    throw new IOException("没有可用的 PNG 编码器");
                }
                store.save(imageId, out.toByteArray());
            } catch (IOException | RuntimeException e) {
                // 单张失败不影响其它框，文档中该图显示为缺失
                log.warn("[pageId: {}] 检测框 #{} 切图失败: {}", pageId, index, e.getMessage());
                continue;
            }
            result.put(index, imageId);
        }

        log.info("[pageId: {}] 切图完成: {} 张", pageId, result.size());
        return result;
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
