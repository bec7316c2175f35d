package com.dbkeeper.server.util;

import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import org.apache.commons.lang3.ObjectUtils;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;

public class BandwidthPolicyResolver {

    public static BandwidthLimit effectiveLimit(ZonedDateTime now, BandwidthPolicy policy) {
        if (ObjectUtils.anyNull(now, policy) || !policy.isEnabled()) {
            return BandwidthLimit.UNLIMITED;
        }
        DayOfWeek dayOfWeek = now.getDayOfWeek();
        if (policy.isWeekendUnlimited() &&
                (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY)) {
            return BandwidthLimit.UNLIMITED;
        }
        if (isPeak(now.toLocalTime(), policy.getPeakStart(), policy.getPeakEnd())) {
            return BandwidthLimit.ofKBs(policy.getPeakLimitKBs());
        }
        return BandwidthLimit.ofKBs(policy.getOffpeakLimitKBs());
    }

    // [start, end), wrapping past midnight when start > end; start == end is an empty window
    static boolean isPeak(LocalTime time, LocalTime peakStart, LocalTime peakEnd) {
        if (ObjectUtils.anyNull(peakStart, peakEnd) || peakStart.equals(peakEnd)) {
            return false;
        }
        if (peakStart.isBefore(peakEnd)) {
            return !time.isBefore(peakStart) && time.isBefore(peakEnd);
        }
        return !time.isBefore(peakStart) || time.isBefore(peakEnd);
    }
}
