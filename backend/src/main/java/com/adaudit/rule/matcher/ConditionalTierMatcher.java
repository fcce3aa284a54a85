package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.rule.matcher.LiteralOccurrences.Occurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 条件 NG：出现即先记为命中，是否附有正确注释由聚合器判断
 * <p>
 * 放行模式（如一般知识的「ヒアルロン酸は」）在全文中出现时，该规则不产生命中。
 */
@Component
public class ConditionalTierMatcher extends AbstractTierMatcher {

    private static final Logger log = LoggerFactory.getLogger(ConditionalTierMatcher.class);

    @Override
    public Tier tier() {
        return Tier.CONDITIONAL;
    }

    @Override
    public List<KeywordMatch> match(KeywordRule rule, ScanContext context) {
        List<Occurrence> occurrences = LiteralOccurrences.find(rule, context.text());
        if (occurrences.isEmpty()) {
            return List.of();
        }
        if (anyFound(rule.getAllowPatterns(), context)) {
            log.debug("规则 {} 命中放行模式，跳过 {} 处出现", rule.getId(), occurrences.size());
            return List.of();
        }
        return occurrences.stream()
                .map(o -> toMatch(rule, o, rule.getSeverity(), reason(rule, o)))
                .toList();
    }

    private static String reason(KeywordRule rule, Occurrence occurrence) {
        String reason = "条件付きNGキーワード「" + occurrence.keyword() + "」を検出";
        if (rule.getRequiredAnnotation() != null) {
            reason += "（注釈「" + rule.getRequiredAnnotation() + "」が必要）";
        }
        return reason;
    }
}
