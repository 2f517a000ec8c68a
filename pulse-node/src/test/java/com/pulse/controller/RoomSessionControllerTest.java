package com.pulse.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pulse.config.PulseProperties;
import com.pulse.model.ParticipantRole;
import com.pulse.peer.BroadcastResult;
import com.pulse.peer.PeerMessage;
import com.pulse.peer.PeerPermissionException;
import com.pulse.peer.PeerTimeoutException;
import com.pulse.service.RoomService;
import com.pulse.session.RoomConnectionResult;
import com.pulse.session.RoomSessionException;
import com.pulse.session.RoomSessionService;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RoomSessionController.class)
class RoomSessionControllerTest {

    private static final String SELF = "alice";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RoomSessionService sessionService;

    @MockBean
    private RoomService roomService;

    @MockBean
    private PulseProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.resolveParticipantId()).thenReturn(SELF);
    }

    @Test
    void createRoomReturnsCreatedWithLocation() throws Exception {
        when(sessionService.createRoom(SELF, "Study", true))
                .thenReturn(new RoomConnectionResult("r1", SELF, ParticipantRole.HOST, true, true));

        mockMvc.perform(post("/api/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Study\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/rooms/r1"))
                .andExpect(jsonPath("$.roomId").value("r1"))
                .andExpect(jsonPath("$.role").value("host"))
                .andExpect(jsonPath("$.host").value(true));
    }

    @Test
    void overlongRoomNameIsRejected() throws Exception {
        mockMvc.perform(post("/api/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + "x".repeat(101) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void joinPassesRequestedRole() throws Exception {
        when(sessionService.joinExistingRoom(SELF, "r1", ParticipantRole.CLIENT))
                .thenReturn(new RoomConnectionResult("r1", SELF, ParticipantRole.CLIENT, false, false));

        mockMvc.perform(post("/api/rooms/r1/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"client\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.host").value(false))
                .andExpect(jsonPath("$.role").value("client"));
    }

    @Test
    void failedEntryMapsToBadGateway() throws Exception {
        when(sessionService.joinExistingRoom(eq(SELF), eq("r1"), any()))
                .thenThrow(new RoomSessionException("r1", "Failed to enter room r1: bus down"));

        mockMvc.perform(post("/api/rooms/r1/join"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Failed to enter room r1: bus down"));
    }

    @Test
    void leaveReturnsNoContentOrNotFound() throws Exception {
        when(sessionService.leaveRoom(SELF, "r1")).thenReturn(true);

        mockMvc.perform(delete("/api/rooms/r1/session")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/rooms/r2/session")).andExpect(status().isNotFound());
    }

    @Test
    void hostLookupOfUnknownRoomIsNotFound() throws Exception {
        when(roomService.roomExists("r1")).thenReturn(true);
        when(sessionService.getCurrentHost("r1")).thenReturn("bob");

        mockMvc.perform(get("/api/rooms/r1/host"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hostId").value("bob"));
        mockMvc.perform(get("/api/rooms/missing/host"))
                .andExpect(status().isNotFound());
    }

    @Test
    void transferHostStatusReflectsOutcome() throws Exception {
        when(sessionService.transferHost(SELF, "r1", "bob")).thenReturn(true);
        when(sessionService.transferHost(SELF, "r1", "ghost")).thenReturn(false);
        when(sessionService.transferHost(SELF, "r2", "bob"))
                .thenThrow(new PeerPermissionException("Only the host can transfer host of room r2"));

        mockMvc.perform(post("/api/rooms/r1/host")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newHostId\":\"bob\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/rooms/r1/host")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newHostId\":\"ghost\"}"))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/rooms/r2/host")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newHostId\":\"bob\"}"))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/rooms/r1/host")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newHostId\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void peersOfRoomWithoutSessionIsNotFound() throws Exception {
        when(sessionService.getSession(SELF, "r1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/rooms/r1/peers")).andExpect(status().isNotFound());
    }

    @Test
    void connectIsAcceptedOrTimesOut() throws Exception {
        mockMvc.perform(post("/api/rooms/r1/peers/bob/connect")).andExpect(status().isAccepted());
        verify(sessionService).connectToPeer(SELF, "r1", "bob", false);

        doThrow(new PeerTimeoutException("Connection to carol not established within 30s"))
                .when(sessionService).connectToPeer(SELF, "r1", "carol", true);

        mockMvc.perform(post("/api/rooms/r1/peers/carol/connect").param("wait", "true"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void connectOutsideRoomIsConflict() throws Exception {
        doThrow(new IllegalStateException("alice is not in room r9"))
                .when(sessionService).connectToPeer(SELF, "r9", "bob", false);

        mockMvc.perform(post("/api/rooms/r9/peers/bob/connect"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("alice is not in room r9"));
    }

    @Test
    void broadcastReportsPerPeerErrors() throws Exception {
        when(sessionService.broadcast(SELF, "r1", PeerMessage.chat("hi")))
                .thenReturn(new BroadcastResult(1, 2, Map.of("carol", "Data channel not open")));

        mockMvc.perform(post("/api/rooms/r1/broadcast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(1))
                .andExpect(jsonPath("$.attempted").value(2))
                .andExpect(jsonPath("$.errors.carol").value("Data channel not open"));
    }
}
