package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Event Publisher for Kafka (optional)
 *
 * Publishes message lifecycle events for audit and analytics consumers.
 * Publishing never fails the write that triggered it.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    @Value("${kafka.topics.message-events:message-events}")
    private String messageEventsTopic;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          ObjectMapper objectMapper,
                          MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    public void publishMessageCreated(Message message) {
        Map<String, Object> event = messageEvent("MESSAGE_CREATED", message);
        event.put("parentMessageId", message.getParentMessageId());
        publishEvent(String.valueOf(message.getId()), event, "MESSAGE_CREATED");
    }

    public void publishMessageEdited(Message message, Long editorId) {
        Map<String, Object> event = messageEvent("MESSAGE_EDITED", message);
        event.put("editorId", editorId);
        event.put("editedAt", message.getEditedAt() != null ? message.getEditedAt().toString() : null);
        publishEvent(String.valueOf(message.getId()), event, "MESSAGE_EDITED");
    }

    public void publishMessageDeleted(Long messageId, Long actorId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "MESSAGE_DELETED");
        event.put("timestamp", Instant.now().toString());
        event.put("messageId", messageId);
        event.put("actorId", actorId);
        publishEvent(String.valueOf(messageId), event, "MESSAGE_DELETED");
    }

    public void publishUserDeleted(Long userId, String username) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "USER_DELETED");
        event.put("timestamp", Instant.now().toString());
        event.put("userId", userId);
        event.put("username", username);
        publishEvent("user-" + userId, event, "USER_DELETED");
    }

    private Map<String, Object> messageEvent(String eventType, Message message) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("messageId", message.getId());
        event.put("senderId", message.getSender().getId());
        event.put("receiverId", message.getReceiver().getId());
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);
        return event;
    }

    /**
     * Generic event publisher
     */
    private void publishEvent(String key, Map<String, Object> event, String eventType) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(messageEventsTopic, key, payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, messageEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, messageEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (JsonProcessingException e) {
            log.error("Could not serialize event: type={}", eventType, e);
            metricsService.recordError("EVENT_SERIALIZATION_ERROR", "EventPublisher");
        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
