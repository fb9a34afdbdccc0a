package com.dev.watchsync.web;

import com.dev.watchsync.relay.RelayDestinations;
import com.dev.watchsync.relay.RelayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.Message;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final RelayService relayService;
    private final SimpMessagingTemplate messagingTemplate;

    public ApiExceptionHandler(RelayService relayService, SimpMessagingTemplate messagingTemplate) {
        this.relayService = relayService;
        this.messagingTemplate = messagingTemplate;
    }

    @ExceptionHandler({
            ResourceNotFoundException.class,
            BadRequestException.class,
            ForbiddenOperationException.class
    })
    public ResponseEntity<Map<String, Object>> handleRuntime(RuntimeException ex) {
        HttpStatus status = statusOf(ex);
        return ResponseEntity.status(status).body(body(status, ex.getMessage()));
    }

    @MessageExceptionHandler({
            ResourceNotFoundException.class,
            BadRequestException.class,
            ForbiddenOperationException.class,
            MethodArgumentNotValidException.class
    })
    public void handleMessaging(Exception ex, Message<?> message) {
        HttpStatus status = statusOf(ex);
        String sessionId = SimpMessageHeaderAccessor.getSessionId(message.getHeaders());
        log.warn("Relay message from session {} rejected: {}", sessionId, ex.getMessage());
        if (sessionId == null) {
            return;
        }
        relayService.findMembership(sessionId).ifPresent(member -> messagingTemplate.convertAndSend(
                RelayDestinations.errors(member.roomCode(), member.participantId()),
                body(status, ex.getMessage())));
    }

    private HttpStatus statusOf(Exception ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if (ex instanceof ResourceNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (ex instanceof ForbiddenOperationException) {
            status = HttpStatus.FORBIDDEN;
        }
        return status;
    }

    private Map<String, Object> body(HttpStatus status, String message) {
        return Map.of(
                "timestamp", Instant.now().toString(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "message", message == null ? status.getReasonPhrase() : message
        );
    }
}
