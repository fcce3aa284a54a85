package com.adaudit.service;

import com.adaudit.model.AnnotationBinding;
import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ValidationResult;
import com.adaudit.model.ViolationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 违规聚合：排除已正确注释的条件 NG，统计并整理最终结果
 * <p>
 * 完全 NG 与文脉依存 NG 不受注释影响。
 */
@Component
public class ViolationAggregator {

    private static final Logger log = LoggerFactory.getLogger(ViolationAggregator.class);

    public ValidationResult aggregate(List<KeywordMatch> rawMatches, List<AnnotationBinding> bindings) {
        AnnotatedKeywords annotated = AnnotatedKeywords.of(bindings);

        List<KeywordMatch> matches = new ArrayList<>();
        ViolationSummary summary = ViolationSummary.empty();
        Set<String> flaggedKeywords = new LinkedHashSet<>();

        for (KeywordMatch match : rawMatches == null ? List.<KeywordMatch>of() : rawMatches) {
            if (match.getTier() == Tier.CONDITIONAL && annotated.covers(match)) {
                log.debug("条件 NG「{}」已附注释，排除", match.getKeyword());
                continue;
            }
            matches.add(match);
            summary.count(match);
            flaggedKeywords.add(match.getKeyword());
        }

        return ValidationResult.builder()
                .hasViolations(!matches.isEmpty())
                .matches(matches)
                .summary(summary)
                .uniqueFlaggedKeywords(new ArrayList<>(flaggedKeywords))
                .build();
    }

    /**
     * 有效绑定的关键词与注释标记位置。命中文本与绑定关键词相同，或绑定的注释标记正好紧接在命中之后
     * （「直注入※2」绑定的是「直注入」，规则关键词是「注入」）时，视为已附注释
     */
    record AnnotatedKeywords(Set<String> keywords, Set<Integer> markerPositions) {

        static AnnotatedKeywords of(List<AnnotationBinding> bindings) {
            Set<String> keywords = new HashSet<>();
            Set<Integer> markerPositions = new HashSet<>();
            if (bindings != null) {
                for (AnnotationBinding binding : bindings) {
                    if (binding.valid()) {
                        keywords.add(binding.keyword());
                        markerPositions.add(binding.markerPosition());
                    }
                }
            }
            return new AnnotatedKeywords(keywords, markerPositions);
        }

        boolean covers(KeywordMatch match) {
            return keywords.contains(match.getKeyword()) || markerPositions.contains(match.getEnd());
        }
    }
}
