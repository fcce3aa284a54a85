package com.adaudit.model;

/**
 * 注释正文（如 "（※1乾燥や古い角質によるくすみ）"）
 *
 * @param marker       规范化后的标记
 * @param footnoteText 标记后的说明文字
 * @param position     标记符号在文本中的位置
 * @param scope        所在范围
 */
public record AnnotationFootnote(String marker, String footnoteText, int position, AnnotationScope scope) {
}
