package com.adaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单个片段的最终判定结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private boolean hasViolations;

    /** 排除已正确注释的条件 NG 之后剩余的命中 */
    private List<KeywordMatch> matches;

    private ViolationSummary summary;

    /** 去重后的违规关键词，按首次出现顺序 */
    private List<String> uniqueFlaggedKeywords;
}
