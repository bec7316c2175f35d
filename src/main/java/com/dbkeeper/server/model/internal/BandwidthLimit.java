package com.dbkeeper.server.model.internal;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Transfer-rate cap in KB/s. Unlimited is distinct from a zero cap, which
 * pauses transfers.
 */
@Getter
@EqualsAndHashCode
public final class BandwidthLimit {

    public static final BandwidthLimit UNLIMITED = new BandwidthLimit(true, 0);

    private final boolean unlimited;

    private final long kbs;

    private BandwidthLimit(boolean unlimited, long kbs) {
        this.unlimited = unlimited;
        this.kbs = kbs;
    }

    public static BandwidthLimit ofKBs(Long kbs) {
        if (kbs == null || kbs < 0) {
            return UNLIMITED;
        }
        return new BandwidthLimit(false, kbs);
    }

    public boolean isPaused() {
        return !this.unlimited && this.kbs == 0;
    }

    @Override
    public String toString() {
        return this.unlimited ? "unlimited" : "%d KB/s".formatted(this.kbs);
    }
}
