package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.rule.RuleTables;
import com.adaudit.rule.matcher.KeywordTierMatcher.ScanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * NG 关键词匹配入口
 * <p>
 * 依次用完全 NG、条件 NG、文脉依存 NG 三个层级扫描文本，不做跨层级去重。
 * 单条规则出错时记录警告并跳过，不影响其他规则。
 */
@Component
public class KeywordMatcher {

    private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);

    /** 注释正文片段（如「※1角質層まで」），条件 NG 与文脉依存 NG 不扫描 */
    private static final Pattern FOOTNOTE_BODY = Pattern.compile("^(?:[※＊*]|注)[0-9０-９]");

    private final Map<Tier, KeywordTierMatcher> tierMatchers;
    private final RuleTables ruleTables;

    public KeywordMatcher(List<KeywordTierMatcher> matchers, RuleTables ruleTables) {
        this.tierMatchers = matchers.stream()
                .collect(Collectors.toMap(KeywordTierMatcher::tier, Function.identity(),
                        (a, b) -> a, () -> new EnumMap<>(Tier.class)));
        this.ruleTables = ruleTables;
        log.info("加载了 {} 个层级匹配器", tierMatchers.size());
    }

    public List<KeywordMatch> match(String text, String fullContext, String productId) {
        return match(ScanContext.of(text, fullContext), ruleTables, productId);
    }

    /**
     * 扫描同一篇广告文中的一个片段；context 由 {@link ScanContext#forSegment} 得到，各片段共用全文的正则判定结果
     */
    public List<KeywordMatch> match(ScanContext context, String productId) {
        return match(context, ruleTables, productId);
    }

    public List<KeywordMatch> match(String text, RuleTables tables, String fullContext, String productId) {
        return match(ScanContext.of(text, fullContext), tables, productId);
    }

    /**
     * 用指定规则表扫描文本
     *
     * @param context   片段文本与广告文全文（全文可为 null）
     * @param tables    规则表
     * @param productId 商品 ID，可为 null（此时所有规则均适用）
     * @return 原始命中列表，按层级、位置排序
     */
    private List<KeywordMatch> match(ScanContext context, RuleTables tables, String productId) {
        String text = context.text();
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        boolean footnoteBody = FOOTNOTE_BODY.matcher(text.strip()).find();
        if (footnoteBody) {
            log.debug("注释正文片段，仅检查完全 NG: {}", abbreviate(text));
        }

        List<KeywordMatch> matches = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            if (footnoteBody && tier != Tier.ABSOLUTE) {
                continue;
            }
            KeywordTierMatcher matcher = tierMatchers.get(tier);
            if (matcher == null) {
                log.warn("没有 {} 层级的匹配器，跳过", tier);
                continue;
            }

            List<KeywordMatch> tierMatches = new ArrayList<>();
            for (KeywordRule rule : tables.rulesFor(tier, productId)) {
                tierMatches.addAll(applyRule(matcher, rule, context));
            }
            if (tier == Tier.CONDITIONAL) {
                tierMatches = dropNested(tierMatches);
            }
            tierMatches.sort(Comparator.comparingInt(KeywordMatch::getStart));
            matches.addAll(tierMatches);
        }
        return matches;
    }

    private List<KeywordMatch> applyRule(KeywordTierMatcher matcher, KeywordRule rule, ScanContext context) {
        try {
            return matcher.match(rule, context);
        } catch (Exception e) {
            log.warn("应用规则 {} 时出错: {}", rule.getId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * 条件 NG 内，被更长关键词覆盖的出现位置不单独计（「ヒアルロン酸」中的「ヒアルロン」）；
     * 未指定商品时各商品的同名规则会命中同一位置，只保留第一条
     */
    private static List<KeywordMatch> dropNested(List<KeywordMatch> matches) {
        List<KeywordMatch> kept = LiteralOccurrences.dropNested(matches, KeywordMatch::getStart, KeywordMatch::getEnd);
        if (kept.size() < matches.size()) {
            log.debug("条件 NG 去掉 {} 处被覆盖或重复的出现位置", matches.size() - kept.size());
        }
        return kept;
    }

    private static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
