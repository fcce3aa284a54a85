package com.adaudit.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 片段类型
 */
public enum SegmentType {
    CLAIM, EXPLANATION, EVIDENCE, CTA, DISCLAIMER, UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
