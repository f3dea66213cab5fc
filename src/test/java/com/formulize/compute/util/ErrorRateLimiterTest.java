package com.formulize.compute.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        assertTrue(limiter.log("first", new RuntimeException("a")));
        assertFalse(limiter.log("second", new RuntimeException("b")));
        assertFalse(limiter.log("third", new RuntimeException("c")));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testLogsAgainAfterInterval() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 200);
        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        Thread.sleep(300);
        assertTrue(limiter.log("third", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
