package com.pulse.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * 비동기 상태가 조건을 만족할 때까지 폴링한다.
 */
public final class Eventually {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Eventually() {
    }

    public static void await(String description, BooleanSupplier condition) {
        await(description, DEFAULT_TIMEOUT, condition);
    }

    public static void await(String description, Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted waiting for: " + description, ex);
            }
        }
    }

    /**
     * 루프에 쌓인 작업이 모두 처리될 때까지 기다린다.
     */
    public static void drain(SessionLoop loop) {
        loop.run(() -> {
        });
    }
}
