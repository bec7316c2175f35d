package com.dbkeeper.server.util;

import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class BandwidthPolicyResolverTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Istanbul");

    // 2024-01-06 is a Saturday, 2024-01-09 a Tuesday
    private static final ZonedDateTime SATURDAY_10 = ZonedDateTime.of(2024, 1, 6, 10, 0, 0, 0, ZONE);

    private static final ZonedDateTime TUESDAY_10 = ZonedDateTime.of(2024, 1, 9, 10, 0, 0, 0, ZONE);

    private static final ZonedDateTime TUESDAY_22 = ZonedDateTime.of(2024, 1, 9, 22, 0, 0, 0, ZONE);

    private static BandwidthPolicy.BandwidthPolicyBuilder policy() {
        return BandwidthPolicy.builder()
                .enabled(true)
                .peakLimitKBs(5000L)
                .offpeakLimitKBs(20000L)
                .peakStart(LocalTime.of(8, 0))
                .peakEnd(LocalTime.of(20, 0))
                .weekendUnlimited(true);
    }

    @Test
    void peakOffPeakAndWeekend() {
        BandwidthPolicy bandwidthPolicy = policy().build();
        assertEquals(BandwidthLimit.UNLIMITED, BandwidthPolicyResolver.effectiveLimit(SATURDAY_10, bandwidthPolicy));
        assertEquals(BandwidthLimit.ofKBs(5000L), BandwidthPolicyResolver.effectiveLimit(TUESDAY_10, bandwidthPolicy));
        assertEquals(BandwidthLimit.ofKBs(20000L), BandwidthPolicyResolver.effectiveLimit(TUESDAY_22, bandwidthPolicy));
    }

    @Test
    void weekendFollowsPeakRulesWhenNotUnlimited() {
        BandwidthPolicy bandwidthPolicy = policy().weekendUnlimited(false).build();
        assertEquals(BandwidthLimit.ofKBs(5000L), BandwidthPolicyResolver.effectiveLimit(SATURDAY_10, bandwidthPolicy));
    }

    @Test
    void disabledPolicyIsUnlimited() {
        BandwidthPolicy bandwidthPolicy = policy().enabled(false).build();
        assertTrue(BandwidthPolicyResolver.effectiveLimit(TUESDAY_10, bandwidthPolicy).isUnlimited());
    }

    @Test
    void nullOffPeakIsUnlimitedAndZeroIsPaused() {
        assertTrue(BandwidthPolicyResolver.effectiveLimit(TUESDAY_22, policy().offpeakLimitKBs(null).build())
                .isUnlimited());
        BandwidthLimit paused = BandwidthPolicyResolver.effectiveLimit(TUESDAY_10, policy().peakLimitKBs(0L).build());
        assertTrue(paused.isPaused());
        assertFalse(paused.isUnlimited());
    }

    @Test
    void peakWindowIsHalfOpenAndWrapsPastMidnight() {
        LocalTime start = LocalTime.of(22, 0);
        LocalTime end = LocalTime.of(6, 0);
        assertTrue(BandwidthPolicyResolver.isPeak(LocalTime.of(22, 0), start, end));
        assertTrue(BandwidthPolicyResolver.isPeak(LocalTime.of(3, 0), start, end));
        assertFalse(BandwidthPolicyResolver.isPeak(LocalTime.of(6, 0), start, end));
        assertFalse(BandwidthPolicyResolver.isPeak(LocalTime.of(12, 0), start, end));
        assertFalse(BandwidthPolicyResolver.isPeak(LocalTime.of(20, 0), LocalTime.of(8, 0), LocalTime.of(20, 0)));
        assertFalse(BandwidthPolicyResolver.isPeak(LocalTime.of(8, 0), LocalTime.of(8, 0), LocalTime.of(8, 0)));
    }
}
