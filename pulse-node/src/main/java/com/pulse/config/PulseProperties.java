package com.pulse.config;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml의 pulse 설정 값을 바인딩하기 위한 POJO.
 */
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {

    private String participantId;
    private Bus bus = new Bus();
    private Relay relay = new Relay();
    private Presence presence = new Presence();
    private Peer peer = new Peer();
    private Signaling signaling = new Signaling();
    private Transport transport = new Transport();

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    /**
     * 설정된 참가자 ID를 반환한다. 비어 있으면 최초 호출 시 UUID를 생성해 고정한다.
     */
    public synchronized String resolveParticipantId() {
        if (participantId == null || participantId.isBlank()) {
            participantId = UUID.randomUUID().toString();
        }
        return participantId;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public Presence getPresence() {
        return presence;
    }

    public void setPresence(Presence presence) {
        this.presence = presence;
    }

    public Peer getPeer() {
        return peer;
    }

    public void setPeer(Peer peer) {
        this.peer = peer;
    }

    public Signaling getSignaling() {
        return signaling;
    }

    public void setSignaling(Signaling signaling) {
        this.signaling = signaling;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    /**
     * pub/sub 버스 연결 방식.
     */
    public static class Bus {
        private String mode = "in-memory";
        private URI relayUrl = URI.create("ws://localhost:8080/bus");
        private Duration subscribeTimeout = Duration.ofSeconds(5);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public URI getRelayUrl() {
            return relayUrl;
        }

        public void setRelayUrl(URI relayUrl) {
            this.relayUrl = relayUrl;
        }

        public Duration getSubscribeTimeout() {
            return subscribeTimeout;
        }

        public void setSubscribeTimeout(Duration subscribeTimeout) {
            this.subscribeTimeout = subscribeTimeout;
        }
    }

    public static class Relay {
        private boolean enabled;
        private String path = "/bus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    /**
     * presence 동기화 대기 시간과 리더 탐색 시 사용하는 타이밍 값.
     */
    public static class Presence {
        private Duration settleDelay = Duration.ofSeconds(2);
        private Duration probeDelay = Duration.ofMillis(200);
        private Duration probeTimeout = Duration.ofSeconds(3);

        public Duration getSettleDelay() {
            return settleDelay;
        }

        public void setSettleDelay(Duration settleDelay) {
            this.settleDelay = settleDelay;
        }

        public Duration getProbeDelay() {
            return probeDelay;
        }

        public void setProbeDelay(Duration probeDelay) {
            this.probeDelay = probeDelay;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }
    }

    /**
     * 피어 연결 수립/재시도 정책.
     */
    public static class Peer {
        private Duration establishTimeout = Duration.ofSeconds(30);
        private Duration negotiationTimeout = Duration.ofSeconds(10);
        private Duration retryBackoff = Duration.ofSeconds(1);
        private int maxRetries = 1;

        public Duration getEstablishTimeout() {
            return establishTimeout;
        }

        public void setEstablishTimeout(Duration establishTimeout) {
            this.establishTimeout = establishTimeout;
        }

        public Duration getNegotiationTimeout() {
            return negotiationTimeout;
        }

        public void setNegotiationTimeout(Duration negotiationTimeout) {
            this.negotiationTimeout = negotiationTimeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    /**
     * 목적지별 송신 채널 풀 설정.
     */
    public static class Signaling {
        private Duration outboundIdleTtl = Duration.ofMinutes(5);
        private int outboundMaxChannels = 64;

        public Duration getOutboundIdleTtl() {
            return outboundIdleTtl;
        }

        public void setOutboundIdleTtl(Duration outboundIdleTtl) {
            this.outboundIdleTtl = outboundIdleTtl;
        }

        public int getOutboundMaxChannels() {
            return outboundMaxChannels;
        }

        public void setOutboundMaxChannels(int outboundMaxChannels) {
            this.outboundMaxChannels = outboundMaxChannels;
        }
    }

    /**
     * ICE 서버(STUN/TURN) 설정.
     */
    public static class Transport {
        private List<String> stunUrls = new ArrayList<>(List.of(
                "stun:stun.l.google.com:19302",
                "stun:stun1.l.google.com:19302"));
        private String turnUrl;
        private String turnUsername;
        private String turnCredential;

        public List<String> getStunUrls() {
            return stunUrls;
        }

        public void setStunUrls(List<String> stunUrls) {
            this.stunUrls = stunUrls == null ? new ArrayList<>() : stunUrls;
        }

        public String getTurnUrl() {
            return turnUrl;
        }

        public void setTurnUrl(String turnUrl) {
            this.turnUrl = turnUrl;
        }

        public String getTurnUsername() {
            return turnUsername;
        }

        public void setTurnUsername(String turnUsername) {
            this.turnUsername = turnUsername;
        }

        public String getTurnCredential() {
            return turnCredential;
        }

        public void setTurnCredential(String turnCredential) {
            this.turnCredential = turnCredential;
        }

        public boolean hasTurnServer() {
            return turnUrl != null && !turnUrl.isBlank();
        }
    }
}
