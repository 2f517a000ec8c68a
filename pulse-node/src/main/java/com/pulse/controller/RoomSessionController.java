package com.pulse.controller;

import com.pulse.config.PulseProperties;
import com.pulse.model.BroadcastResponse;
import com.pulse.model.ChatRequest;
import com.pulse.model.CreateRoomRequest;
import com.pulse.model.HostResponse;
import com.pulse.model.JoinRoomRequest;
import com.pulse.model.PeerStatusResponse;
import com.pulse.model.RoomSessionResponse;
import com.pulse.model.TransferHostRequest;
import com.pulse.peer.BroadcastResult;
import com.pulse.peer.ConnectionState;
import com.pulse.peer.PeerConnectionManager;
import com.pulse.peer.PeerMessage;
import com.pulse.service.RoomNotFoundException;
import com.pulse.service.RoomService;
import com.pulse.session.RoomConnectionResult;
import com.pulse.session.RoomSession;
import com.pulse.session.RoomSessionService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 이 노드에 설정된 참가자로서 방 세션을 조작하는 REST 컨트롤러.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomSessionController {

    private final RoomSessionService sessionService;
    private final RoomService roomService;
    private final PulseProperties properties;

    public RoomSessionController(RoomSessionService sessionService, RoomService roomService,
            PulseProperties properties) {
        this.sessionService = sessionService;
        this.roomService = roomService;
        this.properties = properties;
    }

    /**
     * 새 방을 만들고 호스트로 참가한다.
     */
    @PostMapping
    public ResponseEntity<RoomSessionResponse> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        RoomConnectionResult result = sessionService.createRoom(participantId(), request.getName(),
                request.isAutoConnect());
        return ResponseEntity.created(URI.create("/api/rooms/" + result.getRoomId())).body(toResponse(result));
    }

    @PostMapping("/{roomId}/join")
    public ResponseEntity<RoomSessionResponse> joinRoom(@PathVariable String roomId,
            @RequestBody(required = false) JoinRoomRequest request) {
        RoomConnectionResult result = sessionService.joinExistingRoom(participantId(), roomId,
                request == null ? null : request.getRole());
        return ResponseEntity.ok(toResponse(result));
    }

    @DeleteMapping("/{roomId}/session")
    public ResponseEntity<Void> leaveRoom(@PathVariable String roomId) {
        if (!sessionService.leaveRoom(participantId(), roomId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{roomId}/host")
    public ResponseEntity<HostResponse> getHost(@PathVariable String roomId) {
        if (!roomService.roomExists(roomId)) {
            throw new RoomNotFoundException(roomId);
        }
        return ResponseEntity.ok(new HostResponse(roomId, sessionService.getCurrentHost(roomId)));
    }

    /**
     * 호스트 권한을 넘긴다. 경합에서 졌거나 대상이 멤버가 아니면 409.
     */
    @PostMapping("/{roomId}/host")
    public ResponseEntity<HostResponse> transferHost(@PathVariable String roomId,
            @Valid @RequestBody TransferHostRequest request) {
        boolean transferred = sessionService.transferHost(participantId(), roomId, request.getNewHostId());
        HostResponse response = new HostResponse(roomId, sessionService.getCurrentHost(roomId));
        return transferred
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @GetMapping("/{roomId}/peers")
    public ResponseEntity<PeerStatusResponse> listPeers(@PathVariable String roomId) {
        return sessionService.getSession(participantId(), roomId)
                .map(session -> ResponseEntity.ok(toPeerStatus(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 피어에게 다이얼한다. wait가 true면 연결이 성립하거나 제한 시간이 지날 때까지 기다린다.
     */
    @PostMapping("/{roomId}/peers/{peerId}/connect")
    public ResponseEntity<Void> connectToPeer(@PathVariable String roomId, @PathVariable String peerId,
            @RequestParam(defaultValue = "false") boolean wait) {
        sessionService.connectToPeer(participantId(), roomId, peerId, wait);
        return wait ? ResponseEntity.ok().build() : ResponseEntity.accepted().build();
    }

    @PostMapping("/{roomId}/broadcast")
    public ResponseEntity<BroadcastResponse> broadcastChat(@PathVariable String roomId,
            @Valid @RequestBody ChatRequest request) {
        BroadcastResult result = sessionService.broadcast(participantId(), roomId, PeerMessage.chat(request.getText()));
        BroadcastResponse response = new BroadcastResponse();
        response.setDelivered(result.getDelivered());
        response.setAttempted(result.getAttempted());
        response.setErrors(result.getErrors());
        return ResponseEntity.ok(response);
    }

    private String participantId() {
        return properties.resolveParticipantId();
    }

    private RoomSessionResponse toResponse(RoomConnectionResult result) {
        RoomSessionResponse response = new RoomSessionResponse();
        response.setRoomId(result.getRoomId());
        response.setParticipantId(result.getParticipantId());
        response.setRole(result.getRole());
        response.setHost(result.isHost());
        response.setAutoConnect(result.isAutoConnect());
        return response;
    }

    private PeerStatusResponse toPeerStatus(RoomSession session) {
        PeerConnectionManager manager = session.getConnectionManager();
        Map<String, String> peers = new LinkedHashMap<>();
        for (Map.Entry<String, ConnectionState> entry : manager.getPeerStates().entrySet()) {
            peers.put(entry.getKey(), entry.getValue().toValue());
        }
        PeerStatusResponse response = new PeerStatusResponse();
        response.setRoomId(session.getRoomId());
        response.setHost(manager.isHost());
        response.setCurrentHostId(manager.getCurrentHostId());
        response.setPeers(peers);
        response.setConnected(manager.getConnectedPeers());
        return response;
    }
}
