package com.pulse.global.error;

import com.pulse.bus.BusException;
import com.pulse.bus.BusTimeoutException;
import com.pulse.peer.PeerConnectionFailedException;
import com.pulse.peer.PeerNotReadyException;
import com.pulse.peer.PeerPermissionException;
import com.pulse.peer.PeerTimeoutException;
import com.pulse.service.RoomNotFoundException;
import com.pulse.session.RoomSessionException;
import com.pulse.signaling.SignalingException;
import com.pulse.transport.TransportException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage() == null ? "Bad request" : ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request body");
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(PeerPermissionException.class)
    public ResponseEntity<Map<String, String>> handlePermission(PeerPermissionException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(RoomNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRoomNotFound(RoomNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    /**
     * 세션이 없거나 이미 진행 중인 작업과 겹치는 경우.
     */
    @ExceptionHandler({IllegalStateException.class, PeerNotReadyException.class})
    public ResponseEntity<Map<String, String>> handleConflict(RuntimeException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({PeerTimeoutException.class, BusTimeoutException.class})
    public ResponseEntity<Map<String, String>> handleTimeout(RuntimeException ex) {
        log.warn("Request timed out: {}", ex.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler({RoomSessionException.class, PeerConnectionFailedException.class, SignalingException.class,
            BusException.class, TransportException.class})
    public ResponseEntity<Map<String, String>> handleUpstreamFailure(RuntimeException ex) {
        log.error("Room operation failed", ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
