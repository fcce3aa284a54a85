package com.adaudit.config;

import com.adaudit.exception.RuleTableLoadException;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ProductProfile;
import com.adaudit.parser.RuleTableParser;
import com.adaudit.rule.RuleTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 启动时加载规则表；任何一个文件加载失败都会使应用启动失败
 */
@Configuration
public class RuleTablesConfig {

    private static final Logger log = LoggerFactory.getLogger(RuleTablesConfig.class);

    static final List<String> RULE_FILES = List.of(
            "absolute-ng.json", "conditional-ng.json", "context-dependent-ng.json");

    @Bean
    public RuleTables ruleTables(AdAuditProperties properties, RuleTableParser parser, ResourceLoader resourceLoader) {
        List<KeywordRule> rules = new ArrayList<>();
        for (String fileName : RULE_FILES) {
            String location = join(properties.getRulesLocation(), fileName);
            rules.addAll(load(resourceLoader, location, in -> parser.parseRules(in, location)));
        }
        checkDuplicateIds(rules);

        List<ProductProfile> products = new ArrayList<>();
        for (String productId : properties.getProducts()) {
            String location = join(properties.getProductsLocation(), productId + ".json");
            ProductProfile profile = load(resourceLoader, location, in -> parser.parseProduct(in, location));
            if (!productId.equals(profile.getId())) {
                throw new RuleTableLoadException(location + ": 商品 ID 不一致，期望 " + productId + "，实际 " + profile.getId());
            }
            products.add(profile);
        }

        RuleTables tables = RuleTables.of(rules, products);
        log.info("规则表加载完成: 完全 NG {} 条, 条件 NG {} 条, 文脉依存 NG {} 条, 商品 {}",
                tables.count(Tier.ABSOLUTE), tables.count(Tier.CONDITIONAL),
                tables.count(Tier.CONTEXT_DEPENDENT), tables.productIds());
        return tables;
    }

    static void checkDuplicateIds(List<KeywordRule> rules) {
        Set<String> seen = new HashSet<>();
        for (KeywordRule rule : rules) {
            if (!seen.add(rule.getId())) {
                throw new RuleTableLoadException("规则 ID 重复: " + rule.getId());
            }
        }
    }

    private static <T> T load(ResourceLoader resourceLoader, String location, ResourceReader<T> reader) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleTableLoadException("找不到规则文件: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return reader.read(in);
        } catch (IOException e) {
            throw new RuleTableLoadException("读取规则文件失败: " + location, e);
        }
    }

    private static String join(String directory, String fileName) {
        return directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
    }

    @FunctionalInterface
    private interface ResourceReader<T> {
        T read(InputStream in);
    }
}
