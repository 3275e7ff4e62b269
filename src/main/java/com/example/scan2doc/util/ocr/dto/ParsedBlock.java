package com.example.scan2doc.util.ocr.dto;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 解析后的 OCR 块（不可变）
 *
 * 坐标系：图像坐标系（左上角为原点，y向下增），单位像素。
 * 修改内容或坐标时通过 withXxx 返回新对象，Markdown 与 PDF 两条流水线互不影响。
 */
public final class ParsedBlock {

    private static final Set<String> IMAGE_TYPES = new HashSet<>(Arrays.asList("image", "figure"));
    private static final Set<String> HEADING_TYPES = new HashSet<>(Arrays.asList("title", "sub_title"));
    private static final Set<String> CAPTION_TYPES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("image_caption", "caption", "figure_caption")));

    /**
     * 在解析结果中的序号（arena 下标）
     */
    private final int index;

    private final String type;

    private final String content;

    /**
     * [x1, y1, x2, y2]
     */
    private final double[] box;

    /**
     * 标记之外的游离文本（gap text）
     */
    private final boolean untagged;

    /**
     * 已切图的图片ID，未切图为 null
     */
    private final String imageId;

    public ParsedBlock(int index, String type, String content, double[] box) {
        this(index, type, content, box, false, null);
    }

    public ParsedBlock(int index, String type, String content, double[] box, boolean untagged, String imageId) {
        this.index = index;
        this.type = type == null ? "text" : type;
        this.content = content == null ? "" : content;
        this.box = box == null ? new double[4] : box.clone();
        this.untagged = untagged;
        this.imageId = imageId;
    }

    public ParsedBlock withContent(String newContent) {
        return new ParsedBlock(index, type, newContent, box, untagged, imageId);
    }

    public ParsedBlock withBox(double[] newBox) {
        return new ParsedBlock(index, type, content, newBox, untagged, imageId);
    }

    public ParsedBlock withImageId(String newImageId) {
        return new ParsedBlock(index, type, content, box, untagged, newImageId);
    }

    public int getIndex() {
        return index;
    }

    public String getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public double[] getBox() {
        return box.clone();
    }

    public boolean isUntagged() {
        return untagged;
    }

    public String getImageId() {
        return imageId;
    }

    public double left() {
        return box[0];
    }

    public double top() {
        return box[1];
    }

    public double right() {
        return box[2];
    }

    public double bottom() {
        return box[3];
    }

    public double width() {
        return box[2] - box[0];
    }

    public double height() {
        return box[3] - box[1];
    }

    public double centerX() {
        return (box[0] + box[2]) / 2;
    }

    public boolean hasArea() {
        return box[2] > box[0] && box[3] > box[1];
    }

    public boolean isImage() {
        return imageId != null || IMAGE_TYPES.contains(type);
    }

    public boolean isHeading() {
        return HEADING_TYPES.contains(type);
    }

    public boolean isCaption() {
        return CAPTION_TYPES.contains(type);
    }

    public static boolean isImageType(String type) {
        return type != null && IMAGE_TYPES.contains(type.toLowerCase());
    }

    @Override
    public String toString() {
        return "#" + index + " " + type + Arrays.toString(box) + " " +
                (content.length() > 30 ? content.substring(0, 30) + "..." : content);
    }
}
