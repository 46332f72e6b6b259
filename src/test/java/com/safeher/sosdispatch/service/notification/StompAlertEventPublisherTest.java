package com.safeher.sosdispatch.service.notification;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StompAlertEventPublisherTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private StompAlertEventPublisher publisher;

    @Test
    @SuppressWarnings("unchecked")
    void publish_wrapsEventAndDataOnSubscriberTopic() {
        publisher.publish(AlertEventPublisher.volunteerChannel(20L), AlertEventType.NEW_ALERT, Map.of("alertId", 100L));

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/volunteer_20"), message.capture());
        Map<String, Object> sent = (Map<String, Object>) message.getValue();
        assertThat(sent).containsEntry("event", "new_alert");
        assertThat((Map<String, Object>) sent.get("data")).containsEntry("alertId", 100L);
    }
}
