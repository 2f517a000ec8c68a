package com.pulse.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 연결된 피어 전체에 보낼 채팅 메시지.
 */
public class ChatRequest {

    @NotBlank
    @Size(max = 4000)
    private String text;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
