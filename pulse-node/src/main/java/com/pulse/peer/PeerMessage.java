package com.pulse.peer;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * 데이터 채널로 오가는 애플리케이션 메시지. JSON의 type 필드로 종류를 구분한다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PeerMessage.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = PeerMessage.Pong.class, name = "pong"),
        @JsonSubTypes.Type(value = PeerMessage.Chat.class, name = "chat"),
        @JsonSubTypes.Type(value = PeerMessage.StateUpdate.class, name = "state"),
        @JsonSubTypes.Type(value = PeerMessage.Control.class, name = "control")
})
public abstract class PeerMessage {

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitPing(Ping ping);

        R visitPong(Pong pong);

        R visitChat(Chat chat);

        R visitState(StateUpdate state);

        R visitControl(Control control);
    }

    public static Ping ping() {
        return new Ping(System.currentTimeMillis());
    }

    public static Chat chat(String text) {
        return new Chat(text);
    }

    public static final class Ping extends PeerMessage {

        private long timestamp;

        public Ping() {
        }

        public Ping(long timestamp) {
            this.timestamp = timestamp;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(long timestamp) {
            this.timestamp = timestamp;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPing(this);
        }
    }

    /**
     * ping의 timestamp를 그대로 돌려준다.
     */
    public static final class Pong extends PeerMessage {

        private long timestamp;

        public Pong() {
        }

        public Pong(long timestamp) {
            this.timestamp = timestamp;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(long timestamp) {
            this.timestamp = timestamp;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPong(this);
        }
    }

    public static final class Chat extends PeerMessage {

        private String text;

        public Chat() {
        }

        public Chat(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChat(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Chat && Objects.equals(text, ((Chat) o).text);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(text);
        }
    }

    public static final class StateUpdate extends PeerMessage {

        private JsonNode payload;

        public StateUpdate() {
        }

        public StateUpdate(JsonNode payload) {
            this.payload = payload;
        }

        public JsonNode getPayload() {
            return payload;
        }

        public void setPayload(JsonNode payload) {
            this.payload = payload;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitState(this);
        }
    }

    public static final class Control extends PeerMessage {

        private String action;

        public Control() {
        }

        public Control(String action) {
            this.action = action;
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitControl(this);
        }
    }
}
