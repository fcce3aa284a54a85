package com.adaudit.model;

import java.util.List;

/**
 * 片段注释结构分析结果
 */
public record AnnotationAnalysis(
        List<AnnotationMarkerOccurrence> markerOccurrences,
        List<AnnotationFootnote> footnotes,
        List<AnnotationBinding> bindings,
        boolean hasAnnotatedKeywords) {

    public static AnnotationAnalysis empty() {
        return new AnnotationAnalysis(List.of(), List.of(), List.of(), false);
    }
}
