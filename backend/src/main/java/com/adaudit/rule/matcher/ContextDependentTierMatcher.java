package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.QualifyingPattern;
import com.adaudit.model.KeywordRule.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 文脉依存 NG：片段中的关键词只有在广告文中出现限定模式时才构成违规
 * <p>
 * 限定模式与放行模式都在全文中判定（未提供全文时为片段本身）。
 * 命中的第一个限定模式决定严重等级与理由；放行模式出现时取消命中。
 */
@Component
public class ContextDependentTierMatcher extends AbstractTierMatcher {

    private static final Logger log = LoggerFactory.getLogger(ContextDependentTierMatcher.class);

    @Override
    public Tier tier() {
        return Tier.CONTEXT_DEPENDENT;
    }

    @Override
    public List<KeywordMatch> match(KeywordRule rule, ScanContext context) {
        var occurrences = LiteralOccurrences.find(rule, context.text());
        if (occurrences.isEmpty()) {
            return List.of();
        }

        Optional<QualifyingPattern> qualifying = rule.getQualifyingPatterns().stream()
                .filter(q -> context.foundInContext(q.pattern()))
                .findFirst();
        if (qualifying.isEmpty()) {
            return List.of();
        }
        if (anyFound(rule.getAllowPatterns(), context)) {
            log.debug("规则 {} 命中放行模式，取消文脉依存判定", rule.getId());
            return List.of();
        }

        QualifyingPattern q = qualifying.get();
        return occurrences.stream()
                .map(o -> toMatch(rule, o, q.severity(),
                        "文脈依存NGキーワード「" + o.keyword() + "」を検出（" + q.reason() + "）"))
                .toList();
    }
}
