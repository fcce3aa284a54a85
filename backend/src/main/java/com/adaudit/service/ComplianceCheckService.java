package com.adaudit.service;

import com.adaudit.annotation.AnnotationAnalyzer;
import com.adaudit.config.AdAuditProperties;
import com.adaudit.exception.InvalidInputException;
import com.adaudit.model.*;
import com.adaudit.parser.AdTextSegmenter;
import com.adaudit.rule.RuleTables;
import com.adaudit.rule.matcher.KeywordMatcher;
import com.adaudit.rule.matcher.KeywordTierMatcher.ScanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 广告文合规预检服务
 * <p>
 * 分段 → 注释分析 → 关键词匹配 → 违规聚合。无状态，同样的输入总是得到同样的结果。
 */
@Service
public class ComplianceCheckService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceCheckService.class);

    private final AdTextSegmenter segmenter;
    private final AnnotationAnalyzer annotationAnalyzer;
    private final KeywordMatcher keywordMatcher;
    private final ViolationAggregator violationAggregator;
    private final RuleTables ruleTables;
    private final AdAuditProperties properties;

    public ComplianceCheckService(AdTextSegmenter segmenter,
                                  AnnotationAnalyzer annotationAnalyzer,
                                  KeywordMatcher keywordMatcher,
                                  ViolationAggregator violationAggregator,
                                  RuleTables ruleTables,
                                  AdAuditProperties properties) {
        this.segmenter = segmenter;
        this.annotationAnalyzer = annotationAnalyzer;
        this.keywordMatcher = keywordMatcher;
        this.violationAggregator = violationAggregator;
        this.ruleTables = ruleTables;
        this.properties = properties;
    }

    /**
     * 校验商品 ID 后分段
     */
    public List<Segment> segment(String text, String productId) {
        resolveProduct(productId);
        return segmenter.segment(text);
    }

    /**
     * 检查单个片段
     *
     * @param segmentText 片段文本
     * @param fullText    广告文全文，用于跨片段查找注释正文，可为 null
     * @param productId   商品 ID，可为 null
     */
    public ValidationResult checkSegment(String segmentText, String fullText, String productId) {
        if (segmentText == null || segmentText.isBlank()) {
            throw new InvalidInputException("片段文本不能为空");
        }
        checkLength(segmentText);
        if (fullText != null) {
            checkLength(fullText);
        }
        String product = resolveProduct(productId);
        AnnotationAnalysis annotations = annotationAnalyzer.analyze(segmentText, fullText);
        List<KeywordMatch> rawMatches = keywordMatcher.match(segmentText, fullText, product);
        return violationAggregator.aggregate(rawMatches, annotations.bindings());
    }

    /**
     * 检查整篇广告文：每个片段都以全文作为注释查找范围与文脉判定范围
     * <p>
     * 全文中的注释正文与全文上的正则判定只计算一次，由所有片段共用。
     */
    public DocumentReport checkDocument(String text, String productId) {
        String product = resolveProduct(productId);
        List<Segment> segments = segmenter.segment(text);
        List<AnnotationFootnote> documentFootnotes = annotationAnalyzer.findFootnotes(text, AnnotationScope.FULL_TEXT);
        ScanContext documentScan = ScanContext.of(text, text);

        List<SegmentCheck> checks = new ArrayList<>(segments.size());
        ViolationSummary summary = ViolationSummary.empty();
        Set<String> flaggedKeywords = new LinkedHashSet<>();
        for (Segment segment : segments) {
            SegmentCheck check = inspect(segment, documentFootnotes, documentScan, product);
            checks.add(check);
            summary.add(check.result().getSummary());
            flaggedKeywords.addAll(check.result().getUniqueFlaggedKeywords());
        }

        log.info("广告文检查完成: {} 字, {} 个片段, {} 条违规 (完全 NG {}, 条件 NG {}, 文脉依存 NG {})",
                text.length(), segments.size(), summary.getTotal(),
                summary.countOf(KeywordRule.Tier.ABSOLUTE),
                summary.countOf(KeywordRule.Tier.CONDITIONAL),
                summary.countOf(KeywordRule.Tier.CONTEXT_DEPENDENT));

        return DocumentReport.builder()
                .productId(product)
                .checkedAt(LocalDateTime.now())
                .textLength(text.length())
                .totalSegments(segments.size())
                .segments(checks)
                .summary(summary)
                .uniqueFlaggedKeywords(new ArrayList<>(flaggedKeywords))
                .hasViolations(summary.getTotal() > 0)
                .build();
    }

    private SegmentCheck inspect(Segment segment, List<AnnotationFootnote> documentFootnotes,
                                 ScanContext documentScan, String productId) {
        AnnotationAnalysis annotations = annotationAnalyzer.analyzeAgainst(segment.getText(), documentFootnotes);
        List<KeywordMatch> rawMatches = keywordMatcher.match(documentScan.forSegment(segment.getText()), productId);
        ValidationResult result = violationAggregator.aggregate(rawMatches, annotations.bindings());
        return new SegmentCheck(segment, annotations, result);
    }

    /**
     * 空白的商品 ID 视为未指定；未知商品 ID 抛出 {@link InvalidInputException}
     */
    private String resolveProduct(String productId) {
        if (productId == null || productId.isBlank()) {
            return null;
        }
        String id = productId.trim();
        if (!ruleTables.hasProduct(id)) {
            throw new InvalidInputException("未知的商品 ID: " + id + "，可用商品: " + ruleTables.productIds());
        }
        return id;
    }

    private void checkLength(String text) {
        if (text.length() > properties.getMaxTextLength()) {
            throw new InvalidInputException(
                    "文本长度 " + text.length() + " 超出上限 " + properties.getMaxTextLength());
        }
    }
}
