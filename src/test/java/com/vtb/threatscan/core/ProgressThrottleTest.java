package com.vtb.threatscan.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ProgressThrottleTest {

    @Test
    void firstFilesAreAlwaysReported() {
        AtomicLong clock = new AtomicLong();
        ProgressThrottle throttle = new ProgressThrottle(100, 3, clock::get);

        assertTrue(throttle.shouldReport(1));
        assertTrue(throttle.shouldReport(2));
        assertTrue(throttle.shouldReport(3));
        assertFalse(throttle.shouldReport(4), "Четвёртый файл в том же интервале не сообщается");
    }

    @Test
    void reportsAgainAfterInterval() {
        AtomicLong clock = new AtomicLong();
        ProgressThrottle throttle = new ProgressThrottle(100, 0, clock::get);

        assertTrue(throttle.shouldReport(500), "Первый вызов всегда сообщается");
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(50));
        assertFalse(throttle.shouldReport(501));
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(60));
        assertTrue(throttle.shouldReport(502));
        assertFalse(throttle.shouldReport(503));
    }
}
