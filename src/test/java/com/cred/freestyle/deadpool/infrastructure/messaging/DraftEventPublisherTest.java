package com.cred.freestyle.deadpool.infrastructure.messaging;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.DraftEvent;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.SeasonTransitionEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DraftEventPublisher.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DraftEventPublisher Unit Tests")
class DraftEventPublisherTest {

    @Mock
    private ObjectProvider<KafkaTemplate<String, String>> templateProvider;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private DeadpoolProperties properties;
    private DraftEventPublisher publisher;

    private final DraftEvent draftEvent = new DraftEvent("alice", 2025, "c1", "Mel Brooks", true,
            Instant.parse("2025-03-01T10:00:00Z"));

    @BeforeEach
    void setUp() {
        properties = new DeadpoolProperties();
        publisher = new DraftEventPublisher(templateProvider, objectMapper, properties);
    }

    @Test
    @DisplayName("publishPickCommitted - Sends JSON keyed by year to the draft topic")
    void publishPickCommitted_Sends() {
        // Given
        when(templateProvider.getIfAvailable()).thenReturn(kafkaTemplate);
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(completed("deadpool-draft-events"));

        // When
        publisher.publishPickCommitted(draftEvent);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("deadpool-draft-events"), eq("2025"), payload.capture());
        assertThat(payload.getValue())
                .contains("\"eventType\":\"PICK_COMMITTED\"")
                .contains("\"playerId\":\"alice\"")
                .contains("\"candidateName\":\"Mel Brooks\"");
    }

    @Test
    @DisplayName("publishSeasonTransition - Keyed by the year pair on the season topic")
    void publishSeasonTransition_Sends() {
        // Given
        when(templateProvider.getIfAvailable()).thenReturn(kafkaTemplate);
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(completed("deadpool-season-events"));

        // When
        publisher.publishSeasonTransition(new SeasonTransitionEvent(2024, 2025, "COMPLETED", 3, 21, 2, 0,
                Instant.parse("2025-01-01T00:05:00Z")));

        // Then
        verify(kafkaTemplate).send(eq("deadpool-season-events"), eq("2024_TO_2025"), anyString());
    }

    @Test
    @DisplayName("Disabled events never touch Kafka")
    void disabled_NoSend() {
        properties.getEvents().setEnabled(false);

        publisher.publishPickCommitted(draftEvent);

        verifyNoInteractions(templateProvider, kafkaTemplate);
    }

    @Test
    @DisplayName("A broker failure is logged, not thrown")
    void kafkaFailure_Swallowed() {
        // Given
        when(templateProvider.getIfAvailable()).thenReturn(kafkaTemplate);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenThrow(new KafkaException("metadata not available"));

        // When / Then
        assertThatCode(() -> publisher.publishPickCommitted(draftEvent)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A failed send future is logged, not thrown")
    void failedFuture_Swallowed() {
        // Given
        when(templateProvider.getIfAvailable()).thenReturn(kafkaTemplate);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("timeout")));

        // When / Then
        assertThatCode(() -> publisher.publishPickCommitted(draftEvent)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Missing template is tolerated")
    void noTemplate_NoSend() {
        when(templateProvider.getIfAvailable()).thenReturn(null);

        assertThatCode(() -> publisher.publishPickCommitted(draftEvent)).doesNotThrowAnyException();
    }

    private static CompletableFuture<SendResult<String, String>> completed(String topic) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, "k", "v"), metadata));
    }
}
