package com.studentnotes.notes_api.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * instant() 를 호출할 때마다 step 만큼 앞으로 가는 테스트용 시계
 */
public class SteppingClock extends Clock {

    private final AtomicReference<Instant> current;
    private final Duration step;

    public SteppingClock(Instant start, Duration step) {
        this.current = new AtomicReference<>(start);
        this.step = step;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return current.getAndUpdate(now -> now.plus(step));
    }
}
