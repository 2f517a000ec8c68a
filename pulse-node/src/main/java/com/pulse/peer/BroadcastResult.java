package com.pulse.peer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * broadcast 결과 요약. errors는 전달에 실패한 피어 ID와 사유다.
 */
public class BroadcastResult {

    private final int delivered;
    private final int attempted;
    private final Map<String, String> errors;

    public BroadcastResult(int delivered, int attempted, Map<String, String> errors) {
        this.delivered = delivered;
        this.attempted = attempted;
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public int getDelivered() {
        return delivered;
    }

    public int getAttempted() {
        return attempted;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public boolean isComplete() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        return "BroadcastResult{delivered=" + delivered + "/" + attempted + ", errors=" + errors.keySet() + "}";
    }
}
