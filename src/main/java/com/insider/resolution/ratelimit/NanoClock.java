package com.insider.resolution.ratelimit;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic time source and sleeper, replaceable in tests.
 */
public interface NanoClock {

    long nanoTime();

    void sleep(long nanos) throws InterruptedException;

    static NanoClock system() {
        return SystemNanoClock.INSTANCE;
    }

    enum SystemNanoClock implements NanoClock {
        INSTANCE;

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(long nanos) throws InterruptedException {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    }
}
