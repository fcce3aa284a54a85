package com.adaudit.model;

/**
 * 紧跟注释标记的关键词（如 "クマ※1"）
 *
 * @param keyword  标记前同一字符种类的连续文字
 * @param marker   规范化后的标记（如 "※1"）
 * @param position 关键词在文本中的起始位置
 */
public record AnnotationMarkerOccurrence(String keyword, String marker, int position) {

    public int markerPosition() {
        return position + keyword.length();
    }
}
