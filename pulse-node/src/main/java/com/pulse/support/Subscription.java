package com.pulse.support;

/**
 * 리스너/구독 해제 핸들. 여러 번 닫아도 안전해야 한다.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
