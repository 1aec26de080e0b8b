package com.mobilebackup.importer.codec;

import java.time.Instant;

/**
 * 厂商纪元时间换算：源库里的时间是自 2001-01-01T00:00:00Z 起的秒数。
 * 新版本系统的 sms.db 改存纳秒，数值超过 1e11 时按纳秒处理。
 */
public final class VendorTimeCodec {

    /** 2001-01-01T00:00:00Z 对应的 unix 秒 */
    public static final long VENDOR_EPOCH_OFFSET_SECONDS = 978_307_200L;

    /** 秒级时间戳在可预见的将来都不会超过这个值 */
    private static final double NANOSECOND_THRESHOLD = 1e11;

    private VendorTimeCodec() {
    }

    public static Instant toInstant(double raw) {
        if (Math.abs(raw) > NANOSECOND_THRESHOLD) {
            long nanos = (long) raw;
            return Instant.ofEpochSecond(VENDOR_EPOCH_OFFSET_SECONDS)
                    .plusSeconds(nanos / 1_000_000_000L)
                    .plusNanos(nanos % 1_000_000_000L);
        }
        long wholeSeconds = (long) Math.floor(raw);
        long millis = Math.round((raw - wholeSeconds) * 1000);
        return Instant.ofEpochSecond(VENDOR_EPOCH_OFFSET_SECONDS + wholeSeconds).plusMillis(millis);
    }

    public static Instant toInstant(Number raw) {
        return raw == null ? null : toInstant(raw.doubleValue());
    }

    /** 反向换算，返回秒（可带小数） */
    public static double fromInstant(Instant instant) {
        return (instant.toEpochMilli() / 1000.0) - VENDOR_EPOCH_OFFSET_SECONDS;
    }
}
