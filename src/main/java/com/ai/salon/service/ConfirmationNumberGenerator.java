package com.ai.salon.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues {@code SA<micros>} confirmation numbers. Values are strictly increasing within
 * the process even when the clock stalls or two bookings land in the same microsecond.
 */
@Component
public class ConfirmationNumberGenerator {

    static final String PREFIX = "SA";

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public ConfirmationNumberGenerator() {
        this(Clock.systemUTC());
    }

    ConfirmationNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        Instant now = clock.instant();
        long micros = TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(now.getNano());
        long value = last.updateAndGet(prev -> Math.max(prev + 1, micros));
        return PREFIX + value;
    }
}
