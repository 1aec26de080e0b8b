package com.mobilebackup.importer.codec;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * 厂商纪元换算：秒、带小数的秒、新系统的纳秒。
 */
class VendorTimeCodecTest {

    @Test
    void zeroIsVendorEpoch() {
        assertEquals(Instant.parse("2001-01-01T00:00:00Z"), VendorTimeCodec.toInstant(0));
    }

    @Test
    void oneDayLater() {
        assertEquals(Instant.parse("2001-01-02T00:00:00Z"), VendorTimeCodec.toInstant(86400));
    }

    @Test
    void fractionalSecondsKeepMillis() {
        assertEquals(Instant.parse("2001-01-01T00:00:01.250Z"), VendorTimeCodec.toInstant(1.25));
    }

    @Test
    void largeValuesAreNanoseconds() {
        // 2024-01-01T00:00:00Z 距纪元 725760000 秒（8400 天）
        long nanos = 725_760_000L * 1_000_000_000L;
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), VendorTimeCodec.toInstant((double) nanos));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), VendorTimeCodec.toInstant(725_760_000));
    }

    @Test
    void nullNumberStaysNull() {
        assertNull(VendorTimeCodec.toInstant((Number) null));
    }

    @Test
    void fromInstantInvertsSeconds() {
        assertEquals(86400.0, VendorTimeCodec.fromInstant(Instant.parse("2001-01-02T00:00:00Z")));
    }
}
