package com.adaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 广告文审查配置（application.yml 中的 ad-audit.*）
 */
@Data
@ConfigurationProperties(prefix = "ad-audit")
public class AdAuditProperties {

    /** 整篇广告文的最大字符数 */
    private int maxTextLength = 50000;

    /** 规则表目录，包含 absolute-ng.json / conditional-ng.json / context-dependent-ng.json */
    private String rulesLocation = "classpath:rules/";

    /** 商品配置目录 */
    private String productsLocation = "classpath:products/";

    /** 需要加载的商品 ID */
    private List<String> products = new ArrayList<>(List.of("HA", "SH"));

    /** 片段 ID 前缀 */
    private String segmentIdPrefix = "seg_";
}
