package com.adaudit.parser;

import com.adaudit.config.AdAuditProperties;
import com.adaudit.exception.InvalidInputException;
import com.adaudit.model.Segment;
import com.adaudit.model.SegmentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 广告文分段器
 * <p>
 * 按优先级切分：【】结构性引导语 → 换行 → 句末标点（括号内不切），找不到边界时整段作为一个片段。
 * 切分结果是原文的连续、无重叠子串，按顺序拼接即还原原文；之后根据提示词推断片段类型。
 */
@Component
public class AdTextSegmenter {

    private static final Logger log = LoggerFactory.getLogger(AdTextSegmenter.class);

    private static final String SENTENCE_END = "。．！？!?";
    private static final String OPEN_BRACKETS = "（(「『";
    private static final String CLOSE_BRACKETS = "）)」』";
    private static final String TRAILING_CLOSERS = "）)」』\"'”’";

    /** 句末标点或【】之后的注释标记 */
    private static final Pattern MARKER_AFTER_PUNCTUATION = Pattern.compile("(?:[※＊*]|注)[0-9０-９]+");

    private static final Pattern FOOTNOTE_BODY = Pattern.compile("^\\s*(?:[※＊*]|注)[0-9０-９]");
    private static final Pattern DISCLAIMER_CUE = Pattern.compile(
            "個人の感想|個人差|効果を保証するものではありません|効果・効能を示すものではありません|使用感には個人差");
    private static final Pattern CTA_CUE = Pattern.compile(
            "今なら|いまなら|今だけ|いまだけ|期間限定|数量限定|先着|実質無料|実質0円|全額返金保証|送料無料"
                    + "|\\d[\\d,，]*円|税込|OFF|オフ|割引|半額|定期コース|お申し込み|お申込み|ご購入|ご注文|購入はこちら|今すぐ");
    private static final Pattern EVIDENCE_CUE = Pattern.compile(
            "\\d+(?:\\.\\d+)?[%％]|[0-9０-９]+万(?:個|本|人|件|枚)|第?[0-9０-９一]+位|[Nn][Oo]\\.?\\s?1|ナンバーワン"
                    + "|調べ|調査|臨床|試験済|実証|モニター|満足度");
    private static final Pattern EXPLANATION_CUE = Pattern.compile(
            "なぜなら|だから|そのため|そこで|つまり|ので|ため、|ことで|によって|により|理由は|というのも");
    private static final Pattern CLAIM_CUE = Pattern.compile(
            "^\\s*【|(?:ます|です|ました|ません|ない|る|う|に|へ|！|!)[。．！？!?」』）)\\s]*$");

    private final AdAuditProperties properties;

    public AdTextSegmenter(AdAuditProperties properties) {
        this.properties = properties;
    }

    /**
     * 将广告文切分为有序片段
     *
     * @param text 广告文全文
     * @return 按原文顺序排列的片段
     * @throws InvalidInputException 文本为空或超出长度上限
     */
    public List<Segment> segment(String text) {
        validate(text);

        List<SplitUnit> units = split(text);
        List<Segment> segments = new ArrayList<>(units.size());
        int index = 0;
        for (SplitUnit unit : units) {
            index++;
            segments.add(Segment.builder()
                    .id(properties.getSegmentIdPrefix() + String.format("%03d", index))
                    .text(unit.text())
                    .type(classify(unit.text()))
                    .position(new Segment.Position(unit.start(), unit.end()))
                    .build());
        }

        log.debug("文本 {} 字切分为 {} 个片段", text.length(), segments.size());
        return segments;
    }

    /**
     * 推断片段类型；推断失败时返回 UNKNOWN
     */
    public SegmentType classify(String segmentText) {
        try {
            String trimmed = segmentText.strip();
            if (trimmed.isEmpty()) {
                return SegmentType.UNKNOWN;
            }
            if (FOOTNOTE_BODY.matcher(trimmed).find() || DISCLAIMER_CUE.matcher(trimmed).find()) {
                return SegmentType.DISCLAIMER;
            }
            if (CTA_CUE.matcher(trimmed).find()) {
                return SegmentType.CTA;
            }
            if (EVIDENCE_CUE.matcher(trimmed).find()) {
                return SegmentType.EVIDENCE;
            }
            if (EXPLANATION_CUE.matcher(trimmed).find()) {
                return SegmentType.EXPLANATION;
            }
            if (CLAIM_CUE.matcher(trimmed).find()) {
                return SegmentType.CLAIM;
            }
            return SegmentType.UNKNOWN;
        } catch (RuntimeException e) {
            log.warn("片段类型推断失败，按 unknown 处理: {}", e.getMessage());
            return SegmentType.UNKNOWN;
        }
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("广告文不能为空");
        }
        if (text.length() > properties.getMaxTextLength()) {
            throw new InvalidInputException(
                    "广告文长度 " + text.length() + " 超出上限 " + properties.getMaxTextLength());
        }
    }

    /**
     * 计算切分点；只有包含非空白字符的区间才会成为独立片段
     */
    private List<SplitUnit> split(String text) {
        List<SplitUnit> units = new ArrayList<>();
        int length = text.length();
        int[] content = contentPrefix(text);
        int unitStart = 0;
        int depth = 0;
        // 下一个 】 与换行的位置，length 表示其后没有；只在越过之后才重新查找
        int nextClose = -1;
        int nextBreak = -1;

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);

            // 1. 结构性引导语【...】，】必须在同一行
            if (c == '【' && depth == 0) {
                if (nextClose <= i) {
                    nextClose = indexOrLength(text, '】', i + 1);
                }
                if (nextBreak <= i) {
                    nextBreak = indexOrLength(text, '\n', i + 1);
                }
                if (nextClose < nextBreak) {
                    int close = nextClose;
                    if (hasContent(content, unitStart, i)) {
                        units.add(unit(text, unitStart, i));
                        unitStart = i;
                    }
                    int end = absorbLineBreaks(text, absorbMarker(text, close + 1));
                    units.add(unit(text, unitStart, end));
                    unitStart = end;
                    i = end - 1;
                    continue;
                }
            }

            if (OPEN_BRACKETS.indexOf(c) >= 0) {
                depth++;
                continue;
            }
            if (CLOSE_BRACKETS.indexOf(c) >= 0) {
                depth = Math.max(0, depth - 1);
                continue;
            }

            // 2. 换行；连续的空行留在前一个片段
            if (c == '\n') {
                depth = 0;
                int end = absorbLineBreaks(text, i + 1);
                if (hasContent(content, unitStart, end)) {
                    units.add(unit(text, unitStart, end));
                    unitStart = end;
                }
                i = end - 1;
                continue;
            }

            // 3. 句末标点（括号内不切）
            if (depth == 0 && SENTENCE_END.indexOf(c) >= 0) {
                int end = i + 1;
                while (end < length
                        && (SENTENCE_END.indexOf(text.charAt(end)) >= 0
                        || TRAILING_CLOSERS.indexOf(text.charAt(end)) >= 0)) {
                    end++;
                }
                end = absorbLineBreaks(text, absorbMarker(text, end));
                if (hasContent(content, unitStart, end)) {
                    units.add(unit(text, unitStart, end));
                    unitStart = end;
                }
                i = end - 1;
            }
        }

        // 4. 剩余部分；纯空白的尾部并入前一个片段
        if (unitStart < length) {
            if (units.isEmpty() || hasContent(content, unitStart, length)) {
                units.add(unit(text, unitStart, length));
            } else {
                SplitUnit last = units.remove(units.size() - 1);
                units.add(unit(text, last.start(), length));
            }
        }
        return units;
    }

    /**
     * 标点后紧跟的注释标记（后面是空白、标点或文末）归入前一个片段；
     * 标记后直接接正文时它是注释正文的开头，不吸收
     */
    private static int absorbMarker(String text, int from) {
        if (from >= text.length()) {
            return from;
        }
        Matcher matcher = MARKER_AFTER_PUNCTUATION.matcher(text);
        matcher.region(from, text.length());
        if (!matcher.lookingAt()) {
            return from;
        }
        int end = matcher.end();
        if (end == text.length()) {
            return end;
        }
        char next = text.charAt(end);
        boolean standalone = Character.isWhitespace(next)
                || SENTENCE_END.indexOf(next) >= 0
                || TRAILING_CLOSERS.indexOf(next) >= 0;
        return standalone ? end : from;
    }

    private static int absorbLineBreaks(String text, int from) {
        int end = from;
        while (end < text.length() && (text.charAt(end) == '\n' || text.charAt(end) == '\r')) {
            end++;
        }
        return end;
    }

    /**
     * content[i] 为 text[0, i) 中非空白字符的个数
     */
    private static int[] contentPrefix(String text) {
        int[] content = new int[text.length() + 1];
        for (int i = 0; i < text.length(); i++) {
            content[i + 1] = content[i] + (Character.isWhitespace(text.charAt(i)) ? 0 : 1);
        }
        return content;
    }

    private static boolean hasContent(int[] content, int start, int end) {
        return content[end] > content[start];
    }

    private static int indexOrLength(String text, char c, int from) {
        int index = text.indexOf(c, from);
        return index < 0 ? text.length() : index;
    }

    private static SplitUnit unit(String text, int start, int end) {
        return new SplitUnit(text.substring(start, end), start, end);
    }

    private record SplitUnit(String text, int start, int end) {
    }
}
