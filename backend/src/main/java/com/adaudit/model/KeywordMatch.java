package com.adaudit.model;

import com.adaudit.model.KeywordRule.RegulatoryClass;
import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.model.KeywordRule.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次关键词命中记录（每个出现位置一条，不跨层级去重）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordMatch {

    /** 命中的规则 ID */
    private String ruleId;

    /** 实际命中的关键词文本 */
    private String keyword;

    private Tier tier;

    private String category;

    private Severity severity;

    private RegulatoryClass regulatoryClass;

    /** 规则的判定理由 */
    private String rationale;

    /** 本次命中的具体说明 */
    private String reason;

    private String referenceHint;

    /** 条件 NG 应附加的注释模板 */
    private String requiredAnnotation;

    private String acceptableRewrite;

    /** 在被扫描文本中的起始位置（含） */
    private int start;

    /** 在被扫描文本中的结束位置（不含） */
    private int end;
}
