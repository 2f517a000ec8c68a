package com.pulse.transport.webrtc;

import com.pulse.config.PulseProperties;
import com.pulse.transport.DataChannel;
import com.pulse.transport.IceCandidate;
import com.pulse.transport.IceConnectionState;
import com.pulse.transport.SessionDescription;
import com.pulse.transport.TransportEngine;
import com.pulse.transport.TransportException;
import com.pulse.transport.TransportObserver;
import com.pulse.transport.TransportSession;
import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelInit;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * webrtc-java 네이티브 라이브러리 위에서 동작하는 트랜스포트 엔진.
 * 네이티브 팩토리는 첫 세션을 열 때 만든다.
 */
public class WebRtcTransportEngine implements TransportEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebRtcTransportEngine.class);

    private final PulseProperties.Transport config;
    private PeerConnectionFactory factory;

    public WebRtcTransportEngine(PulseProperties.Transport config) {
        this.config = config;
    }

    @Override
    public TransportSession openSession(String localId, String remoteId, TransportObserver observer) {
        RTCPeerConnection peerConnection;
        try {
            peerConnection = factory().createPeerConnection(rtcConfiguration(), new PeerConnectionObserver() {
                @Override
                public void onIceCandidate(RTCIceCandidate candidate) {
                    observer.onIceCandidate(new IceCandidate(candidate.sdp, candidate.sdpMid, candidate.sdpMLineIndex));
                }

                @Override
                public void onIceConnectionChange(RTCIceConnectionState state) {
                    log.debug("ICE state {} for {} -> {}", state, localId, remoteId);
                    observer.onIceConnectionChange(toIceState(state));
                }

                @Override
                public void onDataChannel(RTCDataChannel channel) {
                    observer.onDataChannel(new WebRtcDataChannel(channel));
                }
            });
        } catch (RuntimeException | UnsatisfiedLinkError ex) {
            throw new TransportException("Failed to create peer connection to " + remoteId, ex);
        }
        if (peerConnection == null) {
            throw new TransportException("Peer connection factory returned no connection for " + remoteId);
        }
        return new WebRtcSession(peerConnection);
    }

    @Override
    public synchronized void close() {
        if (factory != null) {
            factory.dispose();
            factory = null;
        }
    }

    private synchronized PeerConnectionFactory factory() {
        if (factory == null) {
            factory = new PeerConnectionFactory();
            log.info("WebRTC peer connection factory initialized");
        }
        return factory;
    }

    private RTCConfiguration rtcConfiguration() {
        List<RTCIceServer> iceServers = new ArrayList<>();
        if (!config.getStunUrls().isEmpty()) {
            RTCIceServer stun = new RTCIceServer();
            stun.urls.addAll(config.getStunUrls());
            iceServers.add(stun);
        }
        if (config.hasTurnServer()) {
            RTCIceServer turn = new RTCIceServer();
            turn.urls.add(config.getTurnUrl());
            turn.username = config.getTurnUsername();
            turn.password = config.getTurnCredential();
            iceServers.add(turn);
        }
        RTCConfiguration rtcConfiguration = new RTCConfiguration();
        rtcConfiguration.iceServers = iceServers;
        rtcConfiguration.iceTransportPolicy = RTCIceTransportPolicy.ALL;
        return rtcConfiguration;
    }

    static IceConnectionState toIceState(RTCIceConnectionState state) {
        return switch (state) {
            case NEW -> IceConnectionState.NEW;
            case CHECKING -> IceConnectionState.CHECKING;
            case CONNECTED -> IceConnectionState.CONNECTED;
            case COMPLETED -> IceConnectionState.COMPLETED;
            case FAILED -> IceConnectionState.FAILED;
            case DISCONNECTED -> IceConnectionState.DISCONNECTED;
            case CLOSED -> IceConnectionState.CLOSED;
            default -> IceConnectionState.NEW;
        };
    }

    private static final class WebRtcSession implements TransportSession {

        private final RTCPeerConnection peerConnection;

        private WebRtcSession(RTCPeerConnection peerConnection) {
            this.peerConnection = peerConnection;
        }

        @Override
        public DataChannel createDataChannel(String label) {
            RTCDataChannelInit init = new RTCDataChannelInit();
            init.ordered = true;
            return new WebRtcDataChannel(peerConnection.createDataChannel(label, init));
        }

        @Override
        public CompletableFuture<SessionDescription> createOffer() {
            CompletableFuture<SessionDescription> future = new CompletableFuture<>();
            peerConnection.createOffer(new RTCOfferOptions(), descriptionObserver(future));
            return future;
        }

        @Override
        public CompletableFuture<SessionDescription> createAnswer() {
            CompletableFuture<SessionDescription> future = new CompletableFuture<>();
            peerConnection.createAnswer(new RTCAnswerOptions(), descriptionObserver(future));
            return future;
        }

        @Override
        public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
            CompletableFuture<Void> future = new CompletableFuture<>();
            peerConnection.setLocalDescription(toRtc(description), setObserver(future, "local"));
            return future;
        }

        @Override
        public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
            CompletableFuture<Void> future = new CompletableFuture<>();
            peerConnection.setRemoteDescription(toRtc(description), setObserver(future, "remote"));
            return future;
        }

        @Override
        public void addIceCandidate(IceCandidate candidate) {
            peerConnection.addIceCandidate(
                    new RTCIceCandidate(candidate.getSdpMid(), candidate.getSdpMLineIndex(), candidate.getCandidate()));
        }

        @Override
        public IceConnectionState getIceConnectionState() {
            return toIceState(peerConnection.getIceConnectionState());
        }

        @Override
        public void close() {
            peerConnection.close();
        }

        private static RTCSessionDescription toRtc(SessionDescription description) {
            RTCSdpType type = description.getType() == SessionDescription.Type.OFFER ? RTCSdpType.OFFER : RTCSdpType.ANSWER;
            return new RTCSessionDescription(type, description.getSdp());
        }

        private static CreateSessionDescriptionObserver descriptionObserver(CompletableFuture<SessionDescription> future) {
            return new CreateSessionDescriptionObserver() {
                @Override
                public void onSuccess(RTCSessionDescription description) {
                    SessionDescription.Type type = description.sdpType == RTCSdpType.OFFER
                            ? SessionDescription.Type.OFFER
                            : SessionDescription.Type.ANSWER;
                    future.complete(new SessionDescription(type, description.sdp));
                }

                @Override
                public void onFailure(String error) {
                    future.completeExceptionally(new TransportException("Create description failed: " + error));
                }
            };
        }

        private static SetSessionDescriptionObserver setObserver(CompletableFuture<Void> future, String side) {
            return new SetSessionDescriptionObserver() {
                @Override
                public void onSuccess() {
                    future.complete(null);
                }

                @Override
                public void onFailure(String error) {
                    future.completeExceptionally(new TransportException("Set " + side + " description failed: " + error));
                }
            };
        }
    }
}
