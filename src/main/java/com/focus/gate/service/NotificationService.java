package com.focus.gate.service;

import com.focus.gate.dto.AdmissionVerdict;
import com.focus.gate.dto.SessionEvent;
import com.focus.gate.model.SessionState;
import com.focus.gate.session.SessionEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService implements SessionEventListener {

    static final String BLOCKED_TOPIC = "/topic/blocked";
    static final String SESSION_TOPIC = "/topic/session";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public void broadcastBlocked(AdmissionVerdict verdict) {
        send(BLOCKED_TOPIC, verdict);
    }

    @Override
    public void sessionStarted(String task, Instant endTime, boolean resumed) {
        String event = resumed ? "resumed" : "started";
        send(SESSION_TOPIC, new SessionEvent(event, task, SessionState.ACTIVE, endTime, clock.instant()));
    }

    @Override
    public void sessionEnded(String task, SessionState outcome) {
        String event = switch (outcome) {
            case COMPLETED -> "completed";
            case UNLOCKED -> "unlocked";
            case EMERGENCY_TERMINATED -> "emergency-terminated";
            default -> outcome.name().toLowerCase();
        };
        send(SESSION_TOPIC, new SessionEvent(event, task, outcome, null, clock.instant()));
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("Could not publish to {}: {}", destination, e.getMessage());
        }
    }
}
