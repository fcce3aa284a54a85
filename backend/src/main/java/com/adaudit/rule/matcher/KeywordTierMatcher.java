package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Tier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 单个层级的关键词匹配器
 */
public interface KeywordTierMatcher {

    /**
     * 负责的规则层级
     */
    Tier tier();

    /**
     * 用一条规则扫描文本，返回该规则的全部命中；没有命中时返回空列表
     */
    List<KeywordMatch> match(KeywordRule rule, ScanContext context);

    /**
     * 扫描对象
     * <p>
     * 同一篇广告文的各片段共用 contextHits，全文上的正则只判定一次。
     *
     * @param text        被扫描的片段文本
     * @param fullContext 广告文全文，未提供时为 null
     * @param contextHits 正则在全文中是否出现的缓存
     */
    record ScanContext(String text, String fullContext, Map<Pattern, Boolean> contextHits) {

        public static ScanContext of(String text, String fullContext) {
            return new ScanContext(text, fullContext, new HashMap<>());
        }

        /**
         * 同一全文下的另一个片段
         */
        public ScanContext forSegment(String segmentText) {
            return new ScanContext(segmentText, fullContext, contextHits);
        }

        public boolean hasFullContext() {
            return fullContext != null && !fullContext.isEmpty();
        }

        /**
         * 正则是否出现在全文中；没有全文时判定片段文本
         */
        public boolean foundInContext(Pattern pattern) {
            if (!hasFullContext()) {
                return pattern.matcher(text).find();
            }
            return contextHits.computeIfAbsent(pattern, p -> p.matcher(fullContext).find());
        }
    }
}
