package com.adaudit.model;

import com.adaudit.model.KeywordRule.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 商品配置：商品固有的注释要求会并入条件 NG 规则
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductProfile {

    /** 商品 ID（如 "HA"） */
    private String id;

    private String name;

    /** 商品类别（化粧品 / 新指定医薬部外品 等） */
    private String category;

    /** 关键词 → 注释要求 */
    @Builder.Default
    private Map<String, AnnotationRequirement> annotationRules = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnnotationRequirement {

        private boolean required;

        /** 注释模板（如 "※角質層まで"） */
        private String template;

        private Severity severity;

        private String referenceHint;
    }
}
