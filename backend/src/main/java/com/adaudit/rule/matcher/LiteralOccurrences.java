package com.adaudit.rule.matcher;

import com.adaudit.model.KeywordRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * 关键词字面出现位置的查找（不使用正则，"NO.1" 中的 "." 就是点号）
 */
final class LiteralOccurrences {

    private LiteralOccurrences() {
    }

    record Occurrence(String keyword, int start, int end) {
    }

    /**
     * 找出规则所有同义词的出现位置；被同一规则中更长同义词包含的出现位置会被去掉
     */
    static List<Occurrence> find(KeywordRule rule, String text) {
        List<Occurrence> found = new ArrayList<>();
        for (String keyword : rule.getKeywords()) {
            int from = 0;
            int index;
            while ((index = text.indexOf(keyword, from)) >= 0) {
                found.add(new Occurrence(keyword, index, index + keyword.length()));
                from = index + 1;
            }
        }
        return dropNested(found, Occurrence::start, Occurrence::end);
    }

    /**
     * 去掉严格包含在更长区间之内的区间，以及与已保留区间完全相同的区间
     * <p>
     * 按起点升序、长度降序排序后一次扫描：之前的区间起点都不晚于当前区间，
     * 因此只需记录其中最远的终点（以及最早达到该终点的起点）。
     * 排序是稳定的，相同区间保留输入中靠前的一条。
     *
     * @return 按起点排序的结果
     */
    static <T> List<T> dropNested(List<T> spans, ToIntFunction<T> start, ToIntFunction<T> end) {
        List<T> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(start)
                .thenComparing(Comparator.comparingInt((T s) -> end.applyAsInt(s) - start.applyAsInt(s)).reversed()));

        List<T> kept = new ArrayList<>(sorted.size());
        Set<Long> seen = new HashSet<>();
        int maxEnd = -1;
        int maxEndStart = -1;
        for (T span : sorted) {
            int s = start.applyAsInt(span);
            int e = end.applyAsInt(span);
            boolean nested = maxEnd > e || (maxEnd == e && maxEndStart < s);
            if (e > maxEnd) {
                maxEnd = e;
                maxEndStart = s;
            }
            if (!nested && seen.add(((long) s << 32) | e)) {
                kept.add(span);
            }
        }
        return kept;
    }
}
