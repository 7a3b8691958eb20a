package com.purchasingpower.lahk.exception;

import lombok.Getter;

@Getter
public class DocumentTooLargeException extends RuntimeException {

    private final int length;
    private final int limit;

    public DocumentTooLargeException(int length, int limit) {
        super(String.format("Document has %d characters (max is %d)", length, limit));
        this.length = length;
        this.limit = limit;
    }
}
