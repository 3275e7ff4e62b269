package com.example.scan2doc.util.ocr.dto;

/**
 * OCR 检测框（权威坐标）
 *
 * 坐标系：图像坐标系（左上角为原点，y向下增），单位像素
 */
public class OcrBox {

    /**
     * 区域标签：title / text / image / table ...
     */
    private String label;

    /**
     * 边界框 [x1, y1, x2, y2]
     */
    private double[] box;

    public OcrBox() {
    }

    public OcrBox(String label, double[] box) {
        this.label = label;
        this.box = box;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public double[] getBox() {
        return box;
    }

    public void setBox(double[] box) {
        this.box = box;
    }
}
