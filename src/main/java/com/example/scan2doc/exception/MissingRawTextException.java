package com.example.scan2doc.exception;

public class MissingRawTextException extends DocGenException {

    public MissingRawTextException() {
        super(ErrorKind.MISSING_RAW_TEXT, "OCR result missing raw_text");
    }
}
