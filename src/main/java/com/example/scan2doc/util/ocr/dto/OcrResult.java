package com.example.scan2doc.util.ocr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * OCR 服务返回结果（外部输入，只读）
 *
 * JSON 字段使用下划线命名，与 OCR 服务保持一致：
 * <pre>
 * {
 *   "success": true,
 *   "text": "...",
 *   "raw_text": "&lt;|ref|&gt;text&lt;|/ref|&gt;&lt;|det|&gt;[[x1,y1,x2,y2]]&lt;|/det|&gt;内容...",
 *   "boxes": [{"label": "text", "box": [x1, y1, x2, y2]}],
 *   "image_dims": {"w": 1654, "h": 2339},
 *   "prompt_type": "document"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OcrResult {

    public static final String PROMPT_TYPE_DOCUMENT = "document";

    private boolean success;

    private String text;

    @JsonProperty("raw_text")
    private String rawText;

    private List<OcrBox> boxes = new ArrayList<>();

    @JsonProperty("image_dims")
    private ImageDims imageDims;

    @JsonProperty("prompt_type")
    private String promptType;

    public OcrResult() {
    }

    public OcrResult(String rawText, List<OcrBox> boxes, ImageDims imageDims) {
        this.success = true;
        this.rawText = rawText;
        this.boxes = boxes != null ? boxes : new ArrayList<>();
        this.imageDims = imageDims;
        this.promptType = PROMPT_TYPE_DOCUMENT;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getRawText() {
        return rawText;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    public List<OcrBox> getBoxes() {
        return boxes;
    }

    public void setBoxes(List<OcrBox> boxes) {
        this.boxes = boxes != null ? boxes : new ArrayList<>();
    }

    public ImageDims getImageDims() {
        return imageDims;
    }

    public void setImageDims(ImageDims imageDims) {
        this.imageDims = imageDims;
    }

    public String getPromptType() {
        return promptType;
    }

    public void setPromptType(String promptType) {
        this.promptType = promptType;
    }
}
