package com.adaudit.rule;

import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.RegulatoryClass;
import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ProductProfile;
import com.adaudit.model.ProductProfile.AnnotationRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 不可变的 NG 关键词规则表
 * <p>
 * 启动时构建一次并注入各组件；商品维度的条件 NG 视图在构建时预先计算。
 */
public final class RuleTables {

    private static final Logger log = LoggerFactory.getLogger(RuleTables.class);

    private final Map<Tier, List<KeywordRule>> rulesByTier;
    private final Map<String, ProductProfile> products;
    private final Map<String, List<KeywordRule>> conditionalByProduct;

    private RuleTables(Map<Tier, List<KeywordRule>> rulesByTier,
                       Map<String, ProductProfile> products,
                       Map<String, List<KeywordRule>> conditionalByProduct) {
        this.rulesByTier = rulesByTier;
        this.products = products;
        this.conditionalByProduct = conditionalByProduct;
    }

    public static RuleTables of(List<KeywordRule> rules) {
        return of(rules, List.of());
    }

    public static RuleTables of(List<KeywordRule> rules, Collection<ProductProfile> productProfiles) {
        Map<Tier, List<KeywordRule>> byTier = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            byTier.put(tier, rules.stream().filter(r -> r.getTier() == tier).toList());
        }

        Map<String, ProductProfile> products = new LinkedHashMap<>();
        Map<String, List<KeywordRule>> conditionalByProduct = new LinkedHashMap<>();
        for (ProductProfile profile : productProfiles) {
            products.put(profile.getId(), profile);
            conditionalByProduct.put(profile.getId(),
                    buildConditionalView(byTier.get(Tier.CONDITIONAL), profile));
        }

        return new RuleTables(
                Collections.unmodifiableMap(byTier),
                Collections.unmodifiableMap(products),
                Collections.unmodifiableMap(conditionalByProduct));
    }

    /**
     * 取得某层级对指定商品生效的规则；productId 为 null 时返回该层级全部通用规则
     */
    public List<KeywordRule> rulesFor(Tier tier, String productId) {
        if (productId == null) {
            return rulesByTier.get(tier);
        }
        if (tier == Tier.CONDITIONAL) {
            List<KeywordRule> view = conditionalByProduct.get(productId);
            if (view != null) {
                return view;
            }
            log.warn("未知商品 {}，仅使用不限商品的条件 NG 规则", productId);
        }
        return rulesByTier.get(tier).stream().filter(r -> r.appliesTo(productId)).toList();
    }

    public int count(Tier tier) {
        return rulesByTier.get(tier).size();
    }

    public boolean hasProduct(String productId) {
        return products.containsKey(productId);
    }

    public Set<String> productIds() {
        return products.keySet();
    }

    public Optional<ProductProfile> product(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    private static List<KeywordRule> buildConditionalView(List<KeywordRule> conditional, ProductProfile profile) {
        List<KeywordRule> view = new ArrayList<>();
        Set<String> existingKeywords = new HashSet<>();
        for (KeywordRule rule : conditional) {
            if (rule.appliesTo(profile.getId())) {
                view.add(rule);
                existingKeywords.addAll(rule.getKeywords());
            }
        }

        Map<String, AnnotationRequirement> annotationRules = profile.getAnnotationRules();
        if (annotationRules != null) {
            annotationRules.forEach((keyword, requirement) -> {
                if (requirement.isRequired() && existingKeywords.add(keyword)) {
                    view.add(fromAnnotationRequirement(profile.getId(), keyword, requirement));
                }
            });
        }
        return List.copyOf(view);
    }

    private static KeywordRule fromAnnotationRequirement(String productId, String keyword,
                                                         AnnotationRequirement requirement) {
        String referenceHint = requirement.getReferenceHint() != null
                ? requirement.getReferenceHint()
                : "商品固有ルール（" + productId + "）";
        return KeywordRule.builder()
                .id("PRD-" + productId + "-" + keyword)
                .keyword(keyword)
                .tier(Tier.CONDITIONAL)
                .category("ingredient")
                .severity(requirement.getSeverity() != null ? requirement.getSeverity() : Severity.HIGH)
                .regulatoryClass(RegulatoryClass.PHARMACEUTICAL_AFFAIRS)
                .rationale("「" + keyword + "」には注釈が必要です。")
                .referenceHint(referenceHint)
                .acceptableRewrite(keyword + "※1")
                .requiredAnnotation(requirement.getTemplate())
                .productCategory(productId)
                .build();
    }
}
