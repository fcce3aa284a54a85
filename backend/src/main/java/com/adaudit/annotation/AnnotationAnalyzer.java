package com.adaudit.annotation;

import com.adaudit.model.AnnotationAnalysis;
import com.adaudit.model.AnnotationBinding;
import com.adaudit.model.AnnotationFootnote;
import com.adaudit.model.AnnotationMarkerOccurrence;
import com.adaudit.model.AnnotationScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 注释结构分析器
 * <p>
 * 找出「关键词 + 注释标记」（如「クマ※1」）与「注释标记 + 注释正文」（如「※1乾燥による…」），
 * 再按标记把两者绑定：片段内的注释正文优先，其次是全文。
 */
@Component
public class AnnotationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AnnotationAnalyzer.class);

    /**
     * 注释标记族，按顺序逐一匹配
     */
    enum MarkerFamily {
        REFERENCE_MARK("※", Pattern.compile("※([0-9０-９]+)")),
        ASTERISK("*", Pattern.compile("[*＊]([0-9０-９]+)")),
        NOTE("注", Pattern.compile("注([0-9０-９]+)"));

        final String symbol;
        final Pattern pattern;

        MarkerFamily(String symbol, Pattern pattern) {
            this.symbol = symbol;
            this.pattern = pattern;
        }

        static String canonicalSymbol(String raw) {
            if (raw.startsWith("注")) return NOTE.symbol;
            if (raw.startsWith("※")) return REFERENCE_MARK.symbol;
            return ASTERISK.symbol;
        }
    }

    /**
     * 注释正文的几种写法；第 1 组为标记，第 2 组为数字，第 3 组为正文
     */
    enum FootnoteShape {
        /** （※1…） */
        FULL_WIDTH_BRACKET(Pattern.compile("（((?:[※＊*]|注)([0-9０-９]+))([^）]+)）")),
        /** (※1…) */
        ASCII_BRACKET(Pattern.compile("\\(((?:[※＊*]|注)([0-9０-９]+))([^)]+)\\)")),
        /** 空白之后、无括号的 ※1… */
        AFTER_WHITESPACE(Pattern.compile("[\\s\\u3000]([※＊*]([0-9０-９]+))([^※＊*\\s\\u3000][^\\s\\u3000]*)")),
        /** 行首 ※1：… / 注1 … */
        LINE_START_SEPARATOR(Pattern.compile(
                "^((?:[※＊*]|注)([0-9０-９]+))[ \\t\\u3000:：](.+)$", Pattern.MULTILINE)),
        /** 行首 ※1… 正文紧跟标记 */
        LINE_START_DIRECT(Pattern.compile(
                "^([※＊*]([0-9０-９]+))([^\\s\\u3000:：※＊*][^\\n\\r※]*)", Pattern.MULTILINE));

        final Pattern pattern;

        FootnoteShape(Pattern pattern) {
            this.pattern = pattern;
        }
    }

    /**
     * 分析片段的注释结构
     *
     * @param segmentText 片段文本
     * @param fullText    广告文全文，可为 null
     * @return 分析结果；片段内没有注释标记时返回空结果
     */
    public AnnotationAnalysis analyze(String segmentText, String fullText) {
        if (segmentText == null || segmentText.isEmpty() || findMarkerOccurrences(segmentText).isEmpty()) {
            return AnnotationAnalysis.empty();
        }
        List<AnnotationFootnote> documentFootnotes = fullText == null || fullText.isEmpty()
                ? List.of()
                : findFootnotes(fullText, AnnotationScope.FULL_TEXT);
        return analyzeAgainst(segmentText, documentFootnotes);
    }

    /**
     * 用预先从全文中提取的注释正文分析片段；整篇检查时全文只解析一次
     *
     * @param segmentText       片段文本
     * @param documentFootnotes {@link #findFootnotes} 以 FULL_TEXT 范围得到的注释正文
     */
    public AnnotationAnalysis analyzeAgainst(String segmentText, List<AnnotationFootnote> documentFootnotes) {
        if (segmentText == null || segmentText.isEmpty()) {
            return AnnotationAnalysis.empty();
        }

        List<AnnotationMarkerOccurrence> occurrences = findMarkerOccurrences(segmentText);
        if (occurrences.isEmpty()) {
            return AnnotationAnalysis.empty();
        }

        List<AnnotationFootnote> footnotes = new ArrayList<>(findFootnotes(segmentText, AnnotationScope.SEGMENT));
        footnotes.addAll(documentFootnotes);

        List<AnnotationBinding> bindings = bind(occurrences, footnotes);
        if (log.isDebugEnabled()) {
            long valid = bindings.stream().filter(AnnotationBinding::valid).count();
            log.debug("注释标记 {} 个，注释正文 {} 条，有效绑定 {} 个", occurrences.size(), footnotes.size(), valid);
        }
        return new AnnotationAnalysis(
                List.copyOf(occurrences), List.copyOf(footnotes), List.copyOf(bindings), true);
    }

    public AnnotationAnalysis analyze(String segmentText) {
        return analyze(segmentText, null);
    }

    /**
     * 提取紧接在注释标记前的关键词（同一字符种类的连续字符）
     */
    public List<AnnotationMarkerOccurrence> findMarkerOccurrences(String text) {
        List<AnnotationMarkerOccurrence> results = new ArrayList<>();
        for (MarkerFamily family : MarkerFamily.values()) {
            Matcher matcher = family.pattern.matcher(text);
            while (matcher.find()) {
                int markerStart = matcher.start();
                int keywordStart = keywordRunStart(text, markerStart);
                if (keywordStart < markerStart) {
                    results.add(new AnnotationMarkerOccurrence(
                            text.substring(keywordStart, markerStart),
                            family.symbol + normalizeDigits(matcher.group(1)),
                            keywordStart));
                }
            }
        }
        results.sort(Comparator.comparingInt(AnnotationMarkerOccurrence::position));
        return results;
    }

    /**
     * 按所有写法提取注释正文；同一位置同一标记只保留先找到的一条
     */
    public List<AnnotationFootnote> findFootnotes(String text, AnnotationScope scope) {
        Map<String, AnnotationFootnote> found = new LinkedHashMap<>();
        for (FootnoteShape shape : FootnoteShape.values()) {
            Matcher matcher = shape.pattern.matcher(text);
            while (matcher.find()) {
                String marker = MarkerFamily.canonicalSymbol(matcher.group(1)) + normalizeDigits(matcher.group(2));
                String body = matcher.group(3).strip();
                if (body.isEmpty()) {
                    continue;
                }
                int position = matcher.start(1);
                found.putIfAbsent(marker + "@" + position,
                        new AnnotationFootnote(marker, body, position, scope));
            }
        }
        List<AnnotationFootnote> footnotes = new ArrayList<>(found.values());
        footnotes.sort(Comparator.comparingInt(AnnotationFootnote::position));
        return footnotes;
    }

    /**
     * 绑定：同一标记的注释正文，片段内优先，其次全文
     */
    public List<AnnotationBinding> bind(List<AnnotationMarkerOccurrence> occurrences,
                                        List<AnnotationFootnote> footnotes) {
        Map<String, AnnotationFootnote> inSegment = firstByMarker(footnotes, AnnotationScope.SEGMENT);
        Map<String, AnnotationFootnote> inFullText = firstByMarker(footnotes, AnnotationScope.FULL_TEXT);

        List<AnnotationBinding> bindings = new ArrayList<>(occurrences.size());
        for (AnnotationMarkerOccurrence occurrence : occurrences) {
            AnnotationFootnote footnote = inSegment.getOrDefault(occurrence.marker(),
                    inFullText.get(occurrence.marker()));
            bindings.add(footnote != null
                    ? AnnotationBinding.resolved(occurrence, footnote)
                    : AnnotationBinding.unresolved(occurrence));
        }
        return bindings;
    }

    private static Map<String, AnnotationFootnote> firstByMarker(List<AnnotationFootnote> footnotes,
                                                                 AnnotationScope scope) {
        Map<String, AnnotationFootnote> byMarker = new HashMap<>();
        for (AnnotationFootnote footnote : footnotes) {
            if (footnote.scope() == scope) {
                byMarker.putIfAbsent(footnote.marker(), footnote);
            }
        }
        return byMarker;
    }

    private static int keywordRunStart(String text, int markerStart) {
        if (markerStart == 0) {
            return 0;
        }
        CharClass charClass = CharClass.of(text.charAt(markerStart - 1));
        if (charClass == null) {
            return markerStart;
        }
        int start = markerStart - 1;
        while (start > 0 && CharClass.of(text.charAt(start - 1)) == charClass) {
            start--;
        }
        return start;
    }

    static String normalizeDigits(String digits) {
        StringBuilder sb = new StringBuilder(digits.length());
        for (char c : digits.toCharArray()) {
            sb.append(c >= '０' && c <= '９' ? (char) ('0' + (c - '０')) : c);
        }
        return sb.toString();
    }

    /**
     * 关键词字符种类：片假名、汉字、平假名、半角英数
     */
    private enum CharClass {
        KATAKANA, KANJI, HIRAGANA, ALPHANUMERIC;

        static CharClass of(char c) {
            if ((c >= 'ァ' && c <= 'ヶ') || c == 'ー') return KATAKANA;
            if ((c >= '一' && c <= '龠') || c == '々') return KANJI;
            if (c >= 'ぁ' && c <= 'ん') return HIRAGANA;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) return ALPHANUMERIC;
            return null;
        }
    }
}
