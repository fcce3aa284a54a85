package com.adaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * NG 关键词规则
 * <p>
 * 启动时由 JSON 规则表编译而成，进程生命周期内只读。
 */
@Value
@Builder
public class KeywordRule {

    /** 规则唯一标识（如 "ABS-001"） */
    String id;

    /** 关键词及其同义词，按字面匹配 */
    @Singular
    List<String> keywords;

    /** 判定层级 */
    Tier tier;

    /** 规则分类（如 "rejuvenation"、"penetration"） */
    String category;

    /** 默认严重等级；文脉依存规则以命中的限定模式为准 */
    Severity severity;

    /** 所依据的法规类别 */
    RegulatoryClass regulatoryClass;

    /** 判定理由 */
    String rationale;

    /** 参考知识库文件 */
    String referenceHint;

    /** 可接受的改写示例 */
    String acceptableRewrite;

    /** 条件 NG：应附加的注释模板（如 "※角質層まで"） */
    String requiredAnnotation;

    /** 条件 NG：仅对这些商品生效；为空表示全部商品 */
    @Singular
    Set<String> productCategories;

    /** 完全 NG：出现在这些词的近旁时视为其他表达 */
    @Singular
    List<String> excludedContexts;

    /** 文脉依存 NG：与关键词同时出现才构成违规的限定模式 */
    @JsonIgnore
    @Singular
    List<QualifyingPattern> qualifyingPatterns;

    /** 出现时不再判定为违规的放行模式 */
    @JsonIgnore
    @Singular
    List<Pattern> allowPatterns;

    /**
     * productId 为 null 时所有规则均适用
     */
    public boolean appliesTo(String productId) {
        return productId == null || productCategories.isEmpty() || productCategories.contains(productId);
    }

    /**
     * 接口中以小写代码表示（absolute / conditional / context-dependent），汇总中的 Map 键也一样
     */
    public enum Tier {
        @JsonProperty("absolute") ABSOLUTE,
        @JsonProperty("conditional") CONDITIONAL,
        @JsonProperty("context-dependent") CONTEXT_DEPENDENT;

        public String code() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    public enum Severity {
        @JsonProperty("low") LOW,
        @JsonProperty("medium") MEDIUM,
        @JsonProperty("high") HIGH,
        @JsonProperty("critical") CRITICAL
    }

    public enum RegulatoryClass {
        @JsonProperty("pharmaceutical-affairs") PHARMACEUTICAL_AFFAIRS("薬機法違反"),
        @JsonProperty("fair-display") FAIR_DISPLAY("景表法違反"),
        @JsonProperty("specified-commercial-transactions") SPECIFIED_COMMERCIAL_TRANSACTIONS("特商法違反"),
        @JsonProperty("internal-policy") INTERNAL_POLICY("社内基準違反");

        private final String label;

        RegulatoryClass(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record QualifyingPattern(Pattern pattern, String reason, Severity severity) {
    }
}
