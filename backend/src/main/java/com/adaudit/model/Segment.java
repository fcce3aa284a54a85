package com.adaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 广告文中的一个连续片段
 * <p>
 * text 是原文的逐字子串，按顺序拼接所有片段即还原原文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Segment {

    /** 片段 ID（seg_001, seg_002, ...） */
    private String id;

    /** 原文子串，不做任何裁剪 */
    private String text;

    private SegmentType type;

    private Position position;

    public record Position(int start, int end) {
    }
}
