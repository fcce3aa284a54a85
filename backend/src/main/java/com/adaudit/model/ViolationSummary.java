package com.adaudit.model;

import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.model.KeywordRule.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 违规统计：按层级、按严重等级、总数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViolationSummary {

    private Map<Tier, Integer> byTier;

    private Map<Severity, Integer> bySeverity;

    private int total;

    public static ViolationSummary empty() {
        Map<Tier, Integer> byTier = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            byTier.put(tier, 0);
        }
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        return new ViolationSummary(byTier, bySeverity, 0);
    }

    public void count(KeywordMatch match) {
        byTier.merge(match.getTier(), 1, Integer::sum);
        bySeverity.merge(match.getSeverity(), 1, Integer::sum);
        total++;
    }

    public void add(ViolationSummary other) {
        other.getByTier().forEach((tier, n) -> byTier.merge(tier, n, Integer::sum));
        other.getBySeverity().forEach((severity, n) -> bySeverity.merge(severity, n, Integer::sum));
        total += other.getTotal();
    }

    public int countOf(Tier tier) {
        return byTier.getOrDefault(tier, 0);
    }

    public int countOf(Severity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }
}
