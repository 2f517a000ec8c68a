package com.pulse.model;

import jakarta.validation.constraints.Size;

/**
 * 방 생성 REST 요청 바디를 표현한다.
 */
public class CreateRoomRequest {

    @Size(max = 100)
    private String name;

    private boolean autoConnect = true;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public void setAutoConnect(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }
}
