package com.sportsarchive.scraper;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Sleeper and clock in one: every sleep advances the clock instead of blocking.
 */
final class FakeTime implements Sleeper, LongSupplier {
    private long now;
    final List<Long> sleeps = new ArrayList<>();

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        now += millis;
    }

    @Override
    public long getAsLong() {
        return now;
    }
}
