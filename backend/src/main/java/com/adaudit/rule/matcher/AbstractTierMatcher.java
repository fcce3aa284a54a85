package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.rule.matcher.LiteralOccurrences.Occurrence;

import java.util.regex.Pattern;

/**
 * 各层级匹配器的公共部分：把规则与出现位置组装成命中记录
 */
abstract class AbstractTierMatcher implements KeywordTierMatcher {

    protected KeywordMatch toMatch(KeywordRule rule, Occurrence occurrence, Severity severity, String reason) {
        return KeywordMatch.builder()
                .ruleId(rule.getId())
                .keyword(occurrence.keyword())
                .tier(rule.getTier())
                .category(rule.getCategory())
                .severity(severity)
                .regulatoryClass(rule.getRegulatoryClass())
                .rationale(rule.getRationale())
                .reason(reason)
                .referenceHint(rule.getReferenceHint())
                .requiredAnnotation(rule.getRequiredAnnotation())
                .acceptableRewrite(rule.getAcceptableRewrite())
                .start(occurrence.start())
                .end(occurrence.end())
                .build();
    }

    protected static boolean anyFound(Iterable<Pattern> patterns, ScanContext context) {
        for (Pattern pattern : patterns) {
            if (context.foundInContext(pattern)) {
                return true;
            }
        }
        return false;
    }
}
