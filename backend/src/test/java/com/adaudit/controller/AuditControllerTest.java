package com.adaudit.controller;

import com.adaudit.RuleTablesFixture;
import com.adaudit.annotation.AnnotationAnalyzer;
import com.adaudit.config.AdAuditProperties;
import com.adaudit.parser.AdTextSegmenter;
import com.adaudit.rule.RuleTables;
import com.adaudit.rule.matcher.AbsoluteTierMatcher;
import com.adaudit.rule.matcher.ConditionalTierMatcher;
import com.adaudit.rule.matcher.ContextDependentTierMatcher;
import com.adaudit.rule.matcher.KeywordMatcher;
import com.adaudit.service.ComplianceCheckService;
import com.adaudit.service.ViolationAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuditControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AdAuditProperties properties = new AdAuditProperties();
        RuleTables tables = RuleTablesFixture.classpathTables();
        KeywordMatcher matcher = new KeywordMatcher(
                List.of(new AbsoluteTierMatcher(), new ConditionalTierMatcher(), new ContextDependentTierMatcher()),
                tables);
        ComplianceCheckService service = new ComplianceCheckService(new AdTextSegmenter(properties),
                new AnnotationAnalyzer(), matcher, new ViolationAggregator(), tables, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditController(service, tables)).build();
    }

    @Test
    void shouldSegmentText() throws Exception {
        mockMvc.perform(post("/api/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"【新発売】目元ケア。ヒアルロン酸配合！\\n今なら半額\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSegments").value(4))
                .andExpect(jsonPath("$.segments[0].id").value("seg_001"))
                .andExpect(jsonPath("$.segments[3].type").value("cta"));
    }

    @Test
    void shouldCheckDocument() throws Exception {
        mockMvc.perform(post("/api/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"若返りを実感。ヒアルロン酸直注入でクマ対策\",\"productId\":\"HA\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productId").value("HA"))
                .andExpect(jsonPath("$.hasViolations").value(true))
                .andExpect(jsonPath("$.uniqueFlaggedKeywords", hasItems("若返り", "注入", "クマ")))
                .andExpect(jsonPath("$.summary.byTier.absolute").value(1))
                .andExpect(jsonPath("$.summary.bySeverity.critical").value(1))
                .andExpect(jsonPath("$.segments[0].result.matches[0].tier").value("absolute"))
                .andExpect(jsonPath("$.segments[0].result.matches[0].severity").value("critical"))
                .andExpect(jsonPath("$.segments[0].result.matches[0].regulatoryClass").value("pharmaceutical-affairs"));
    }

    @Test
    void shouldCheckSingleSegment() throws Exception {
        mockMvc.perform(post("/api/check/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"segmentText\":\"ヒアルロン酸※1配合\",\"fullText\":\"ヒアルロン酸※1配合\\n※1保湿成分\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasViolations").value(false))
                .andExpect(jsonPath("$.matches", hasSize(0)));
    }

    @Test
    void shouldRejectBlankTextAndUnknownProduct() throws Exception {
        mockMvc.perform(post("/api/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("text")));

        mockMvc.perform(post("/api/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"クマ対策\",\"productId\":\"XX\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("XX")));
    }

    @Test
    void shouldCheckUploadedShiftJisFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ad.txt", "text/plain",
                "老け見え対策\n今なら半額".getBytes(Charset.forName("windows-31j")));

        mockMvc.perform(multipart("/api/check/file").file(file).param("productId", "HA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uniqueFlaggedKeywords", hasItem("老け見え")))
                .andExpect(jsonPath("$.notices", hasSize(1)));
    }

    @Test
    void shouldRejectUndecodableUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "bad.txt", "text/plain",
                new byte[]{(byte) 0x81, 0x20, (byte) 0xA1, 0x20});

        mockMvc.perform(multipart("/api/check/file").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("bad.txt")))
                .andExpect(jsonPath("$.error", containsString("UTF-8")));
    }

    @Test
    void shouldRejectNonTextUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ad.docx", "application/octet-stream",
                "クマ".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/check/file").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString(".txt")));
    }

    @Test
    void shouldListRules() throws Exception {
        mockMvc.perform(get("/api/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.absolute").value(28))
                .andExpect(jsonPath("$.counts.conditional").value(21))
                .andExpect(jsonPath("$.counts['context-dependent']").value(6))
                .andExpect(jsonPath("$.products[*].id", hasItems("HA", "SH")))
                .andExpect(jsonPath("$.products[0].annotationRules['マイクロニードル'].template").value("※ヒアルロン酸を結晶化したもの"));

        mockMvc.perform(get("/api/rules/context-dependent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)))
                .andExpect(jsonPath("$[0].id").value("CTX-001"));

        mockMvc.perform(get("/api/rules/unknown"))
                .andExpect(status().isBadRequest());
    }
}
