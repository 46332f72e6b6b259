package com.safeher.sosdispatch.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * STOMP implementation: each subscriber id maps to /topic/{subscriberId}. The message body
 * is {"event": "&lt;wire name&gt;", "data": {...}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompAlertEventPublisher implements AlertEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publish(String subscriberId, AlertEventType event, Map<String, Object> payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("event", event.getWireName());
        message.put("data", payload);
        messagingTemplate.convertAndSend("/topic/" + subscriberId, message);
        log.debug("[PUBSUB] {} → /topic/{}", event.getWireName(), subscriberId);
    }
}
