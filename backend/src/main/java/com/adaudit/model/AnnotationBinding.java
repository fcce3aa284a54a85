package com.adaudit.model;

/**
 * 关键词与注释正文的绑定结果
 * <p>
 * valid 为 true 当且仅当在片段或全文中找到了同一标记的注释正文。
 */
public record AnnotationBinding(
        String keyword,
        String marker,
        int position,
        String footnoteText,
        AnnotationScope scope,
        boolean valid) {

    public int markerPosition() {
        return position + keyword.length();
    }

    public static AnnotationBinding unresolved(AnnotationMarkerOccurrence occurrence) {
        return new AnnotationBinding(occurrence.keyword(), occurrence.marker(), occurrence.position(),
                null, null, false);
    }

    public static AnnotationBinding resolved(AnnotationMarkerOccurrence occurrence, AnnotationFootnote footnote) {
        return new AnnotationBinding(occurrence.keyword(), occurrence.marker(), occurrence.position(),
                footnote.footnoteText(), footnote.scope(), true);
    }
}
