package com.npssenti.crawler.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDate;

/**
 * Per-UTC-day budget for the video API, charged with estimated costs before calls are made.
 * An empty {@code period_start_utc} means the ledger has never been used.
 */
@Data
public class QuotaLedger {

    @JsonProperty("daily_quota")
    private int dailyQuota = 10_000;

    @JsonProperty("reserve_quota")
    private int reserveQuota = 200;

    @JsonProperty("used_today")
    private int usedToday;

    @JsonProperty("period_start_utc")
    private String periodStartUtc = "";

    /** Starts a new period (used_today = 0) when {@code today} differs from the recorded one. */
    public void rollover(LocalDate today) {
        String day = today.toString();
        if (!day.equals(periodStartUtc)) {
            usedToday = 0;
            periodStartUtc = day;
        }
    }

    /** Units still spendable today without touching the reserve */
    public int available() {
        return Math.max(0, dailyQuota - reserveQuota - usedToday);
    }

    public void consume(int units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0");
        }
        if (units > available()) {
            throw new IllegalStateException("Charging " + units + " units exceeds the " + available() + " available");
        }
        usedToday += units;
    }

    /** The API reported the quota as spent: nothing more is spendable until the next period. */
    public void exhaust() {
        usedToday = Math.max(usedToday, dailyQuota - reserveQuota);
    }
}
