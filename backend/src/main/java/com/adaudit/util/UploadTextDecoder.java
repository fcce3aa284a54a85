package com.adaudit.util;

import com.adaudit.exception.InvalidInputException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 上传广告稿（.txt）的解码
 * <p>
 * 顺序：BOM → 无 BOM 的 UTF-16（按 NUL 字节的奇偶位置判断）→ 严格解码 UTF-8、windows-31j、EUC-JP。
 * 全部失败时拒绝上传，不做带替换字符的解码，以免乱码文本被当作广告文检查。
 */
public final class UploadTextDecoder {

    /** 日文广告稿常见的编码，按尝试顺序 */
    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8, Charset.forName("windows-31j"), Charset.forName("EUC-JP"));

    private UploadTextDecoder() {
    }

    public record DecodedUpload(String text, Charset charset, String notice) {
    }

    enum ByteOrderMark {
        UTF_8(StandardCharsets.UTF_8, 0xEF, 0xBB, 0xBF),
        UTF_16LE(StandardCharsets.UTF_16LE, 0xFF, 0xFE),
        UTF_16BE(StandardCharsets.UTF_16BE, 0xFE, 0xFF);

        private final Charset charset;
        private final byte[] mark;

        ByteOrderMark(Charset charset, int... mark) {
            this.charset = charset;
            this.mark = new byte[mark.length];
            for (int i = 0; i < mark.length; i++) {
                this.mark[i] = (byte) mark[i];
            }
        }

        static Optional<ByteOrderMark> detect(byte[] bytes) {
            return Arrays.stream(values())
                    .filter(bom -> bytes.length >= bom.mark.length
                            && Arrays.equals(bytes, 0, bom.mark.length, bom.mark, 0, bom.mark.length))
                    .findFirst();
        }
    }

    /**
     * 解码上传文件
     *
     * @param bytes    文件内容
     * @param fileName 文件名（用于提示信息）
     * @return 解码结果；非 UTF-8 时附带提示
     * @throws InvalidInputException 文件为空或编码无法识别
     */
    public static DecodedUpload decode(byte[] bytes, String fileName) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException(fileName + " 是空文件");
        }

        Optional<ByteOrderMark> bom = ByteOrderMark.detect(bytes);
        if (bom.isPresent()) {
            Charset charset = bom.get().charset;
            String text = strictDecode(bytes, bom.get().mark.length, charset)
                    .orElseThrow(() -> new InvalidInputException(
                            fileName + " 带有 " + charset.name() + " 的 BOM，但内容无法按该编码解码"));
            String notice = charset.equals(StandardCharsets.UTF_8) ? null
                    : fileName + " 使用 " + charset.name() + " 编码，已自动转换。";
            return new DecodedUpload(text, charset, notice);
        }

        // UTF-8 / Shift_JIS / EUC-JP 的文本不含 NUL 字节
        Optional<Charset> utf16 = utf16WithoutBom(bytes);
        if (utf16.isPresent()) {
            String text = strictDecode(bytes, 0, utf16.get())
                    .orElseThrow(() -> new InvalidInputException(fileName + " 含有 NUL 字节，无法识别编码"));
            return new DecodedUpload(text, utf16.get(),
                    fileName + " 是没有 BOM 的 " + utf16.get().name() + " 文本，已自动转换。");
        }

        for (Charset charset : CANDIDATES) {
            Optional<String> text = strictDecode(bytes, 0, charset);
            if (text.isPresent()) {
                String notice = charset.equals(StandardCharsets.UTF_8) ? null
                        : fileName + " 可能不是 UTF-8 编码，已按 " + charset.name() + " 解码，请确认内容无乱码。";
                return new DecodedUpload(text.get(), charset, notice);
            }
        }

        throw new InvalidInputException(fileName + " 的文字编码无法识别（已尝试 UTF-8 / windows-31j / EUC-JP），"
                + "请另存为 UTF-8 后重新上传");
    }

    /**
     * NUL 字节全部位于奇数位置为 UTF-16LE，全部位于偶数位置为 UTF-16BE
     */
    static Optional<Charset> utf16WithoutBom(byte[] bytes) {
        if (bytes.length % 2 != 0) {
            return Optional.empty();
        }
        int evenNul = 0;
        int oddNul = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 0) {
                if (i % 2 == 0) {
                    evenNul++;
                } else {
                    oddNul++;
                }
            }
        }
        if (oddNul > 0 && evenNul == 0) {
            return Optional.of(StandardCharsets.UTF_16LE);
        }
        if (evenNul > 0 && oddNul == 0) {
            return Optional.of(StandardCharsets.UTF_16BE);
        }
        return Optional.empty();
    }

    private static Optional<String> strictDecode(byte[] bytes, int offset, Charset charset) {
        try {
            return Optional.of(charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
