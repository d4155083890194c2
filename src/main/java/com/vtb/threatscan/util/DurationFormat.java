package com.vtb.threatscan.util;

import java.time.Duration;

public final class DurationFormat {

    private DurationFormat() {
    }

    /**
     * "1m 5s" или "42s"
     */
    public static String format(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0s";
        }
        long minutes = duration.toMinutes();
        long seconds = duration.toSecondsPart();
        if (minutes >= 1) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
