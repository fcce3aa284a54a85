package com.adaudit;

import com.adaudit.config.AdAuditProperties;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.ProductProfile;
import com.adaudit.parser.RuleTableParser;
import com.adaudit.rule.RuleTables;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用：按应用相同的方式从 classpath 加载规则表
 */
public final class RuleTablesFixture {

    private static RuleTables cached;

    private RuleTablesFixture() {
    }

    public static synchronized RuleTables classpathTables() {
        if (cached == null) {
            RuleTableParser parser = new RuleTableParser(new ObjectMapper());
            List<KeywordRule> rules = new ArrayList<>();
            for (String name : List.of("absolute-ng.json", "conditional-ng.json", "context-dependent-ng.json")) {
                rules.addAll(read("rules/" + name, in -> parser.parseRules(in, name)));
            }
            List<ProductProfile> products = new ArrayList<>();
            for (String id : new AdAuditProperties().getProducts()) {
                products.add(read("products/" + id + ".json", in -> parser.parseProduct(in, id)));
            }
            cached = RuleTables.of(rules, products);
        }
        return cached;
    }

    private static <T> T read(String resource, java.util.function.Function<InputStream, T> reader) {
        try (InputStream in = RuleTablesFixture.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("classpath 中找不到 " + resource);
            }
            return reader.apply(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
