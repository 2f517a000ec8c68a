package com.pulse.peer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PeerMessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PeerMessageCodec codec = new PeerMessageCodec(objectMapper);

    @Test
    void encodesTypeDiscriminator() throws Exception {
        JsonNode json = objectMapper.readTree(codec.encode(PeerMessage.chat("hello")));

        assertThat(json.get("type").asText()).isEqualTo("chat");
        assertThat(json.get("text").asText()).isEqualTo("hello");
    }

    @Test
    void decodesPingWithTimestamp() {
        PeerMessage message = codec.decode("{\"type\":\"ping\",\"timestamp\":1700000000000}");

        assertThat(message).isInstanceOf(PeerMessage.Ping.class);
        assertThat(((PeerMessage.Ping) message).getTimestamp()).isEqualTo(1700000000000L);
    }

    @Test
    void decodesStatePayloadAsTree() {
        PeerMessage message = codec.decode("{\"type\":\"state\",\"payload\":{\"volume\":7,\"muted\":false}}");

        JsonNode payload = ((PeerMessage.StateUpdate) message).getPayload();
        assertThat(payload.get("volume").asInt()).isEqualTo(7);
        assertThat(payload.get("muted").asBoolean()).isFalse();
    }

    @Test
    void visitorSeesConcreteKind() {
        PeerMessage message = codec.decode("{\"type\":\"control\",\"action\":\"mute\"}");

        String kind = message.accept(new PeerMessage.Visitor<String>() {
            @Override
            public String visitPing(PeerMessage.Ping ping) {
                return "ping";
            }

            @Override
            public String visitPong(PeerMessage.Pong pong) {
                return "pong";
            }

            @Override
            public String visitChat(PeerMessage.Chat chat) {
                return "chat";
            }

            @Override
            public String visitState(PeerMessage.StateUpdate state) {
                return "state";
            }

            @Override
            public String visitControl(PeerMessage.Control control) {
                return "control:" + control.getAction();
            }
        });

        assertThat(kind).isEqualTo("control:mute");
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"video\",\"frame\":1}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonJson() {
        assertThatThrownBy(() -> codec.decode("not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
