package com.pulse.peer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link PeerMessage}와 데이터 채널 텍스트 프레임 사이의 변환.
 */
public class PeerMessageCodec {

    private final ObjectMapper objectMapper;

    public PeerMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(PeerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot encode peer message " + message.getClass().getSimpleName(), ex);
        }
    }

    /**
     * @throws IllegalArgumentException 알 수 없는 type이거나 JSON이 아닌 경우
     */
    public PeerMessage decode(String text) {
        try {
            return objectMapper.readValue(text, PeerMessage.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed peer message: " + ex.getOriginalMessage(), ex);
        }
    }
}
