package com.example.scan2doc.exception;

/**
 * 文档生成失败（整页中止）
 *
 * 调用方根据 {@link ErrorKind} 映射用户可见的提示，不直接展示异常文本。
 */
public class DocGenException extends Exception {

    public enum ErrorKind {
        /** OCR 结果缺少 raw_text */
        MISSING_RAW_TEXT,
        /** 页面图像既不是 JPEG 也不是 PNG */
        UNSUPPORTED_IMAGE_FORMAT,
        /** 任务已取消 */
        CANCELLED,
        /** 读写存储失败 */
        IO_FAILURE
    }

    private final ErrorKind kind;

    public DocGenException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DocGenException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
