package com.example.scan2doc.util.ocr.dto;

/**
 * 页面图像尺寸（像素）
 */
public class ImageDims {

    private double w;
    private double h;

    public ImageDims() {
    }

    public ImageDims(double w, double h) {
        this.w = w;
        this.h = h;
    }

    public double getW() {
        return w;
    }

    public void setW(double w) {
        this.w = w;
    }

    public double getH() {
        return h;
    }

    public void setH(double h) {
        this.h = h;
    }

    @Override
    public String toString() {
        return w + "x" + h;
    }
}
