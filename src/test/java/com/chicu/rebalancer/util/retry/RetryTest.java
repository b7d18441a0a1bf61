package com.chicu.rebalancer.util.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Retry Tests")
class RetryTest {

    private final List<Duration> slept = new ArrayList<>();
    private final Sleeper sleeper = slept::add;

    @Test
    @DisplayName("Returns the first successful result and sleeps between failures")
    void testSucceedsAfterFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = Retry.call("receipt", () -> {
            if (calls.incrementAndGet() < 3) throw new IOException("not yet");
            return "ok";
        }, 3, Duration.ofSeconds(5), sleeper);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5)), slept);
    }

    @Test
    @DisplayName("Rethrows the last error once attempts are exhausted")
    void testExhausted() {
        AtomicInteger calls = new AtomicInteger();
        IOException error = assertThrows(IOException.class, () -> Retry.call("receipt", () -> {
            throw new IOException("attempt " + calls.incrementAndGet());
        }, 3, Duration.ofMillis(1), sleeper));

        assertEquals("attempt 3", error.getMessage());
        assertEquals(2, slept.size());
    }

    @Test
    @DisplayName("Interruption is not retried")
    void testInterruptedNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(InterruptedException.class, () -> Retry.call("receipt", () -> {
            calls.incrementAndGet();
            throw new InterruptedException();
        }, 3, Duration.ofMillis(1), sleeper));

        assertEquals(1, calls.get());
        assertTrue(Thread.interrupted());
    }
}
