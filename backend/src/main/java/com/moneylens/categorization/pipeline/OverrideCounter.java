package com.moneylens.categorization.pipeline;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual corrections since the last retrain. Owned by one pipeline instance.
 */
public class OverrideCounter {

    private final AtomicInteger count = new AtomicInteger();

    public int increment() {
        return count.incrementAndGet();
    }

    public int get() {
        return count.get();
    }

    public void reset() {
        count.set(0);
    }
}
