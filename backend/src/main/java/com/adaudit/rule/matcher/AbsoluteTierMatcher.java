package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.rule.matcher.LiteralOccurrences.Occurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 完全 NG：出现即违规，注释无法豁免
 * <p>
 * 唯一的例外是 excludedContexts：例如「保証」前 10 字或后 5 字内出现「返金」时，
 * 它属于「返金保証」这一别的表达，不算作本规则的出现。
 */
@Component
public class AbsoluteTierMatcher extends AbstractTierMatcher {

    private static final Logger log = LoggerFactory.getLogger(AbsoluteTierMatcher.class);

    static final int EXCLUDED_CONTEXT_BEFORE = 10;
    static final int EXCLUDED_CONTEXT_AFTER = 5;

    @Override
    public Tier tier() {
        return Tier.ABSOLUTE;
    }

    @Override
    public List<KeywordMatch> match(KeywordRule rule, ScanContext context) {
        String text = context.text();
        List<KeywordMatch> matches = new ArrayList<>();
        for (Occurrence occurrence : LiteralOccurrences.find(rule, text)) {
            if (inExcludedContext(rule, occurrence, text)) {
                log.debug("跳过「{}」(位置 {})：属于其他表达", occurrence.keyword(), occurrence.start());
                continue;
            }
            matches.add(toMatch(rule, occurrence, rule.getSeverity(),
                    "完全NGキーワード「" + occurrence.keyword() + "」を検出"));
        }
        return matches;
    }

    private static boolean inExcludedContext(KeywordRule rule, Occurrence occurrence, String text) {
        if (rule.getExcludedContexts().isEmpty()) {
            return false;
        }
        int from = Math.max(0, occurrence.start() - EXCLUDED_CONTEXT_BEFORE);
        int to = Math.min(text.length(), occurrence.end() + EXCLUDED_CONTEXT_AFTER);
        String window = text.substring(from, to);
        return rule.getExcludedContexts().stream().anyMatch(window::contains);
    }
}
