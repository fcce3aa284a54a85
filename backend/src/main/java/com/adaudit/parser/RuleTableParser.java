package com.adaudit.parser;

import com.adaudit.exception.RuleTableLoadException;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.QualifyingPattern;
import com.adaudit.model.KeywordRule.RegulatoryClass;
import com.adaudit.model.KeywordRule.Severity;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ProductProfile;
import com.adaudit.model.ProductProfile.AnnotationRequirement;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * JSON 规则表解析器
 * 将 rules/*.json 与 products/*.json 编译为不可变的 {@link KeywordRule} / {@link ProductProfile}
 *
 * 规则表格式:
 * <pre>
 * { "tier": "conditional",
 *   "rules": [ { "id": "CND-001", "keywords": ["浸透"], "category": "penetration",
 *                "severity": "high", "regulatoryClass": "薬機法違反", "rationale": "...",
 *                "requiredAnnotation": "※角質層まで", "allowPatterns": ["真皮|表皮"] } ] }
 * </pre>
 * 任何结构错误都抛出 {@link RuleTableLoadException}，不做部分加载。
 */
@Component
public class RuleTableParser {

    private static final Logger log = LoggerFactory.getLogger(RuleTableParser.class);

    private final ObjectMapper objectMapper;

    public RuleTableParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析一个层级的规则表
     *
     * @param inputStream JSON 内容
     * @param sourceName  来源名称（用于错误信息）
     * @return 规则列表
     */
    public List<KeywordRule> parseRules(InputStream inputStream, String sourceName) {
        JsonNode root = readTree(inputStream, sourceName);
        Tier tier = parseTier(text(root, "tier"), sourceName);

        JsonNode rulesNode = root.get("rules");
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new RuleTableLoadException(sourceName + ": 缺少 rules 数组");
        }

        List<KeywordRule> rules = new ArrayList<>();
        int index = 0;
        for (JsonNode node : rulesNode) {
            index++;
            String location = sourceName + " 第 " + index + " 条规则";
            rules.add(parseRule(node, tier, location));
        }

        log.info("从 {} 中解析出 {} 条 {} 规则", sourceName, rules.size(), tier);
        return rules;
    }

    /**
     * 解析商品配置
     */
    public ProductProfile parseProduct(InputStream inputStream, String sourceName) {
        JsonNode root = readTree(inputStream, sourceName);
        String id = text(root, "id");
        if (id == null || id.isBlank()) {
            throw new RuleTableLoadException(sourceName + ": 商品配置缺少 id");
        }

        Map<String, AnnotationRequirement> annotationRules = new LinkedHashMap<>();
        JsonNode rulesNode = root.get("annotationRules");
        if (rulesNode != null) {
            if (!rulesNode.isObject()) {
                throw new RuleTableLoadException(sourceName + ": annotationRules 必须是对象");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = rulesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode node = entry.getValue();
                String template = text(node, "template");
                if (template == null || template.isBlank()) {
                    throw new RuleTableLoadException(
                            sourceName + ": 关键词「" + entry.getKey() + "」的注释模板为空");
                }
                if (!template.startsWith("※")) {
                    log.warn("{}: 关键词「{}」的注释模板不以 ※ 开头: {}", sourceName, entry.getKey(), template);
                }
                annotationRules.put(entry.getKey(), new AnnotationRequirement(
                        node.path("required").asBoolean(false),
                        template,
                        parseSeverity(text(node, "severity"), Severity.HIGH, sourceName),
                        text(node, "referenceHint")));
            }
        }

        return ProductProfile.builder()
                .id(id)
                .name(text(root, "name"))
                .category(text(root, "category"))
                .annotationRules(annotationRules)
                .build();
    }

    private KeywordRule parseRule(JsonNode node, Tier tier, String location) {
        String id = text(node, "id");
        if (id == null || id.isBlank()) {
            throw new RuleTableLoadException(location + ": 缺少 id");
        }

        List<String> keywords = stringList(node.get("keywords"));
        if (keywords.isEmpty() || keywords.stream().anyMatch(String::isBlank)) {
            throw new RuleTableLoadException(location + " (" + id + "): 关键词不能为空");
        }

        KeywordRule.KeywordRuleBuilder builder = KeywordRule.builder()
                .id(id)
                .keywords(keywords)
                .tier(tier)
                .category(Objects.requireNonNullElse(text(node, "category"), "general"))
                .severity(parseSeverity(text(node, "severity"), Severity.HIGH, location))
                .regulatoryClass(parseRegulatoryClass(text(node, "regulatoryClass"), location))
                .rationale(text(node, "rationale"))
                .referenceHint(text(node, "referenceHint"))
                .acceptableRewrite(text(node, "acceptableRewrite"))
                .requiredAnnotation(text(node, "requiredAnnotation"))
                .productCategories(stringList(node.get("productCategories")))
                .excludedContexts(stringList(node.get("excludedContexts")));

        for (String regex : stringList(node.get("allowPatterns"))) {
            builder.allowPattern(compile(regex, location + " (" + id + ")"));
        }

        JsonNode qualifying = node.get("qualifyingPatterns");
        if (qualifying != null) {
            for (JsonNode q : qualifying) {
                builder.qualifyingPattern(new QualifyingPattern(
                        compile(text(q, "pattern"), location + " (" + id + ")"),
                        text(q, "reason"),
                        parseSeverity(text(q, "severity"), Severity.HIGH, location)));
            }
        }

        KeywordRule rule = builder.build();
        if (tier == Tier.CONTEXT_DEPENDENT && rule.getQualifyingPatterns().isEmpty()) {
            throw new RuleTableLoadException(location + " (" + id + "): 文脉依存规则至少需要一个限定模式");
        }
        return rule;
    }

    private JsonNode readTree(InputStream inputStream, String sourceName) {
        try {
            JsonNode root = objectMapper.readTree(inputStream);
            if (root == null || !root.isObject()) {
                throw new RuleTableLoadException(sourceName + ": 内容不是 JSON 对象");
            }
            return root;
        } catch (IOException e) {
            throw new RuleTableLoadException("无法解析 " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private Pattern compile(String regex, String location) {
        if (regex == null || regex.isEmpty()) {
            throw new RuleTableLoadException(location + ": 正则表达式为空");
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new RuleTableLoadException(location + ": 无效的正则表达式 " + regex, e);
        }
    }

    private Tier parseTier(String text, String sourceName) {
        if (text == null) {
            throw new RuleTableLoadException(sourceName + ": 缺少 tier");
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "absolute" -> Tier.ABSOLUTE;
            case "conditional" -> Tier.CONDITIONAL;
            case "context-dependent", "context_dependent" -> Tier.CONTEXT_DEPENDENT;
            default -> throw new RuleTableLoadException(sourceName + ": 未知的 tier " + text);
        };
    }

    private Severity parseSeverity(String text, Severity defaultValue, String location) {
        if (text == null) return defaultValue;
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "LOW" -> Severity.LOW;
            case "MEDIUM" -> Severity.MEDIUM;
            case "HIGH" -> Severity.HIGH;
            case "CRITICAL" -> Severity.CRITICAL;
            default -> throw new RuleTableLoadException(location + ": 未知的严重等级 " + text);
        };
    }

    private RegulatoryClass parseRegulatoryClass(String text, String location) {
        if (text == null) {
            throw new RuleTableLoadException(location + ": 缺少 regulatoryClass");
        }
        for (RegulatoryClass rc : RegulatoryClass.values()) {
            if (rc.name().equalsIgnoreCase(text.trim()) || rc.label().equals(text.trim())) {
                return rc;
            }
        }
        throw new RuleTableLoadException(location + ": 未知的法规类别 " + text);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }
}
