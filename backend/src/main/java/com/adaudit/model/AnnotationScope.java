package com.adaudit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 注释文本的查找范围，SEGMENT 优先于 FULL_TEXT
 */
public enum AnnotationScope {
    SEGMENT("segment"),
    FULL_TEXT("fullText");

    private final String code;

    AnnotationScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
