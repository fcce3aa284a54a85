package com.adaudit.model;

/**
 * 文档检查中单个片段的检查结果
 */
public record SegmentCheck(Segment segment, AnnotationAnalysis annotations, ValidationResult result) {
}
