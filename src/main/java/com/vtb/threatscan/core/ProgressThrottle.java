package com.vtb.threatscan.core;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Ограничение частоты уведомлений о текущем файле.
 * Первые {@code immediateCount} файлов сообщаются всегда, дальше - не чаще одного раза за интервал.
 */
public class ProgressThrottle {

    private final long intervalNanos;
    private final long immediateCount;
    private final LongSupplier ticker;

    private long lastReportNanos;
    private boolean reportedOnce;

    public ProgressThrottle(long intervalMs, long immediateCount, LongSupplier ticker) {
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(intervalMs);
        this.immediateCount = immediateCount;
        this.ticker = ticker;
    }

    /**
     * @param filesVisited сколько файлов уже пройдено, включая текущий
     */
    public boolean shouldReport(long filesVisited) {
        long now = ticker.getAsLong();
        if (filesVisited <= immediateCount || !reportedOnce || now - lastReportNanos >= intervalNanos) {
            lastReportNanos = now;
            reportedOnce = true;
            return true;
        }
        return false;
    }
}
