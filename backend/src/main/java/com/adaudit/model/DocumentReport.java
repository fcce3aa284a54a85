package com.adaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 整篇广告文的检查报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentReport {

    /** 商品 ID，未指定时为 null */
    private String productId;

    private LocalDateTime checkedAt;

    private int textLength;

    private int totalSegments;

    private List<SegmentCheck> segments;

    /** 所有片段合计 */
    private ViolationSummary summary;

    private List<String> uniqueFlaggedKeywords;

    private boolean hasViolations;

    /** 解码等处理过程中的提示 */
    @Builder.Default
    private List<String> notices = new ArrayList<>();
}
