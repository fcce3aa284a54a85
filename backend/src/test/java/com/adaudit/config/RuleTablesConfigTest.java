package com.adaudit.config;

import com.adaudit.exception.RuleTableLoadException;
import com.adaudit.model.KeywordRule;
import com.adaudit.model.KeywordRule.RegulatoryClass;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.parser.RuleTableParser;
import com.adaudit.rule.RuleTables;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTablesConfigTest {

    private final RuleTablesConfig config = new RuleTablesConfig();
    private final RuleTableParser parser = new RuleTableParser(new ObjectMapper());

    @Test
    void shouldLoadClasspathRuleTables() {
        RuleTables tables = config.ruleTables(new AdAuditProperties(), parser, new DefaultResourceLoader());

        assertEquals(28, tables.count(Tier.ABSOLUTE));
        assertEquals(List.of("HA", "SH"), List.copyOf(tables.productIds()));
    }

    @Test
    void shouldFailWhenRuleFileMissing(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("absolute-ng.json"),
                "{\"tier\":\"absolute\",\"rules\":[]}", StandardCharsets.UTF_8);
        AdAuditProperties properties = new AdAuditProperties();
        properties.setRulesLocation(dir.toUri().toString());

        RuleTableLoadException e = assertThrows(RuleTableLoadException.class,
                () -> config.ruleTables(properties, parser, new DefaultResourceLoader()));
        assertTrue(e.getMessage().contains("conditional-ng.json"));
    }

    @Test
    void shouldFailWhenProductIdDiffers(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("HA.json"), "{\"id\":\"SH\"}", StandardCharsets.UTF_8);
        AdAuditProperties properties = new AdAuditProperties();
        properties.setProductsLocation(dir.toUri().toString());
        properties.setProducts(List.of("HA"));

        assertThrows(RuleTableLoadException.class,
                () -> config.ruleTables(properties, parser, new DefaultResourceLoader()));
    }

    @Test
    void shouldRejectDuplicateRuleIds() {
        KeywordRule first = KeywordRule.builder().id("ABS-001").keyword("若返り").tier(Tier.ABSOLUTE)
                .regulatoryClass(RegulatoryClass.PHARMACEUTICAL_AFFAIRS).build();
        KeywordRule second = KeywordRule.builder().id("ABS-001").keyword("完治").tier(Tier.ABSOLUTE)
                .regulatoryClass(RegulatoryClass.PHARMACEUTICAL_AFFAIRS).build();

        RuleTableLoadException e = assertThrows(RuleTableLoadException.class,
                () -> RuleTablesConfig.checkDuplicateIds(List.of(first, second)));
        assertTrue(e.getMessage().contains("ABS-001"));
    }
}
