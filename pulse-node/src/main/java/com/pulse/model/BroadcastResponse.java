package com.pulse.model;

import java.util.Map;

/**
 * 브로드캐스트 집계. errors는 전달에 실패한 피어 ID별 사유다.
 */
public class BroadcastResponse {

    private int delivered;
    private int attempted;
    private Map<String, String> errors;

    public int getDelivered() {
        return delivered;
    }

    public void setDelivered(int delivered) {
        this.delivered = delivered;
    }

    public int getAttempted() {
        return attempted;
    }

    public void setAttempted(int attempted) {
        this.attempted = attempted;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public void setErrors(Map<String, String> errors) {
        this.errors = errors;
    }
}
