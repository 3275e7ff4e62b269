package com.example.scan2doc.exception;

public class UnsupportedImageFormatException extends DocGenException {

    public UnsupportedImageFormatException(Throwable cause) {
        super(ErrorKind.UNSUPPORTED_IMAGE_FORMAT, "Unsupported image format. Only JPG and PNG are supported.", cause);
    }
}
