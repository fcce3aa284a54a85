package com.adaudit.util;

import com.adaudit.exception.InvalidInputException;
import com.adaudit.util.UploadTextDecoder.DecodedUpload;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UploadTextDecoderTest {

    private static final String AD_TEXT = "今なら半額\nクマ対策";

    private static byte[] concat(byte[] head, byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(head);
        out.writeBytes(body);
        return out.toByteArray();
    }

    @Test
    void shouldDecodeUtf8WithoutNotice() {
        DecodedUpload decoded = UploadTextDecoder.decode(AD_TEXT.getBytes(StandardCharsets.UTF_8), "ad.txt");

        assertEquals(AD_TEXT, decoded.text());
        assertEquals(StandardCharsets.UTF_8, decoded.charset());
        assertNull(decoded.notice());
    }

    @Test
    void shouldStripUtf8Bom() {
        byte[] bytes = concat(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, AD_TEXT.getBytes(StandardCharsets.UTF_8));

        DecodedUpload decoded = UploadTextDecoder.decode(bytes, "ad.txt");

        assertEquals(AD_TEXT, decoded.text());
        assertNull(decoded.notice());
    }

    @Test
    void shouldFallBackToShiftJisWithNotice() {
        Charset sjis = Charset.forName("windows-31j");

        DecodedUpload decoded = UploadTextDecoder.decode("老け見え対策".getBytes(sjis), "ad.txt");

        assertEquals("老け見え対策", decoded.text());
        assertEquals("windows-31j", decoded.charset().name());
        assertTrue(decoded.notice().contains("ad.txt"));
        assertTrue(decoded.notice().contains("windows-31j"));
    }

    @Test
    void shouldDecodeUtf16WithBom() {
        byte[] bytes = concat(new byte[]{(byte) 0xFF, (byte) 0xFE}, AD_TEXT.getBytes(StandardCharsets.UTF_16LE));

        DecodedUpload decoded = UploadTextDecoder.decode(bytes, "ad.txt");

        assertEquals(AD_TEXT, decoded.text());
        assertEquals(StandardCharsets.UTF_16LE, decoded.charset());
        assertNotNull(decoded.notice());
    }

    @Test
    void shouldDetectUtf16WithoutBom() {
        DecodedUpload little = UploadTextDecoder.decode(AD_TEXT.getBytes(StandardCharsets.UTF_16LE), "le.txt");
        assertEquals(AD_TEXT, little.text());
        assertEquals(StandardCharsets.UTF_16LE, little.charset());
        assertTrue(little.notice().contains("BOM"));

        DecodedUpload big = UploadTextDecoder.decode(AD_TEXT.getBytes(StandardCharsets.UTF_16BE), "be.txt");
        assertEquals(AD_TEXT, big.text());
        assertEquals(StandardCharsets.UTF_16BE, big.charset());
    }

    @Test
    void shouldNotTreatNulFreeBytesAsUtf16() {
        assertEquals(Optional.empty(), UploadTextDecoder.utf16WithoutBom("クマ対策".getBytes(StandardCharsets.UTF_8)));
        assertEquals(Optional.empty(), UploadTextDecoder.utf16WithoutBom(new byte[]{0x41, 0x00, 0x00, 0x42}));
    }

    @Test
    void shouldRejectUndecodableBytes() {
        byte[] bytes = {(byte) 0x81, 0x20, (byte) 0xA1, 0x20};

        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> UploadTextDecoder.decode(bytes, "bad.txt"));
        assertTrue(e.getMessage().contains("bad.txt"));
        assertTrue(e.getMessage().contains("UTF-8"));
    }

    @Test
    void shouldRejectEmptyFile() {
        assertThrows(InvalidInputException.class, () -> UploadTextDecoder.decode(new byte[0], "empty.txt"));
    }
}
