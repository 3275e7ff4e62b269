package com.example.scan2doc.exception;

public class GenerationCancelledException extends DocGenException {

    public GenerationCancelledException(String stage) {
        super(ErrorKind.CANCELLED, "Generation cancelled before stage: " + stage);
    }
}
