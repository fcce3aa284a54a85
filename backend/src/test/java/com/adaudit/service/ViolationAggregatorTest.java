package com.adaudit.service;

import com.adaudit.model.AnnotationBinding;
import com.adaudit.model.AnnotationScope;
import com.adaudit.model.KeywordMatch;
import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViolationAggregatorTest {

    private final ViolationAggregator aggregator = new ViolationAggregator();

    private static KeywordMatch match(String keyword, Tier tier, Severity severity, int start) {
        return KeywordMatch.builder()
                .ruleId("R-" + keyword)
                .keyword(keyword)
                .tier(tier)
                .severity(severity)
                .start(start)
                .end(start + keyword.length())
                .build();
    }

    private static AnnotationBinding binding(String keyword, int position, boolean valid) {
        return new AnnotationBinding(keyword, "※1", position, valid ? "保湿成分" : null,
                valid ? AnnotationScope.SEGMENT : null, valid);
    }

    @Test
    void shouldDropConditionalMatchWithValidBinding() {
        ValidationResult result = aggregator.aggregate(
                List.of(match("クマ", Tier.CONDITIONAL, Severity.HIGH, 0)),
                List.of(binding("クマ", 0, true)));

        assertFalse(result.isHasViolations());
        assertTrue(result.getMatches().isEmpty());
        assertEquals(0, result.getSummary().getTotal());
        assertTrue(result.getUniqueFlaggedKeywords().isEmpty());
    }

    @Test
    void shouldKeepConditionalMatchWhenBindingInvalid() {
        ValidationResult result = aggregator.aggregate(
                List.of(match("クマ", Tier.CONDITIONAL, Severity.HIGH, 0)),
                List.of(binding("クマ", 0, false)));

        assertTrue(result.isHasViolations());
        assertEquals(1, result.getSummary().countOf(Tier.CONDITIONAL));
    }

    @Test
    void shouldResolveBindingByMarkerPosition() {
        // 「ヒアルロン酸※1」绑定的是「酸」，「直注入※2」绑定的是「直注入」
        List<KeywordMatch> raw = List.of(
                match("ヒアルロン酸", Tier.CONDITIONAL, Severity.HIGH, 0),
                match("注入", Tier.CONDITIONAL, Severity.HIGH, 9));
        List<AnnotationBinding> bindings = List.of(binding("酸", 5, true), binding("直注入", 8, true));

        ValidationResult result = aggregator.aggregate(raw, bindings);

        assertFalse(result.isHasViolations());
    }

    @Test
    void shouldNeverSuppressAbsoluteOrContextDependentMatches() {
        List<KeywordMatch> raw = List.of(
                match("若返り", Tier.ABSOLUTE, Severity.CRITICAL, 0),
                match("若々しい", Tier.CONTEXT_DEPENDENT, Severity.HIGH, 10));
        List<AnnotationBinding> bindings = List.of(binding("若返り", 0, true), binding("若々しい", 10, true));

        ValidationResult result = aggregator.aggregate(raw, bindings);

        assertEquals(2, result.getMatches().size());
        assertEquals(1, result.getSummary().countOf(Tier.ABSOLUTE));
        assertEquals(1, result.getSummary().countOf(Tier.CONTEXT_DEPENDENT));
    }

    @Test
    void shouldSummarizeAndDeduplicateKeywords() {
        List<KeywordMatch> raw = new ArrayList<>(List.of(
                match("治療", Tier.ABSOLUTE, Severity.CRITICAL, 0),
                match("治療", Tier.ABSOLUTE, Severity.CRITICAL, 8),
                match("浸透", Tier.CONDITIONAL, Severity.HIGH, 4),
                match("今なら", Tier.CONTEXT_DEPENDENT, Severity.MEDIUM, 12)));

        ValidationResult result = aggregator.aggregate(raw, List.of());

        assertEquals(4, result.getSummary().getTotal());
        assertEquals(2, result.getSummary().countOf(Severity.CRITICAL));
        assertEquals(1, result.getSummary().countOf(Severity.HIGH));
        assertEquals(1, result.getSummary().countOf(Severity.MEDIUM));
        assertEquals(0, result.getSummary().countOf(Severity.LOW));
        assertEquals(List.of("治療", "浸透", "今なら"), result.getUniqueFlaggedKeywords());
        assertEquals(4, raw.size());
    }

    @Test
    void shouldHandleMissingInputs() {
        ValidationResult result = aggregator.aggregate(null, null);

        assertFalse(result.isHasViolations());
        assertEquals(0, result.getSummary().getTotal());
    }
}
