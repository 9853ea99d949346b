package com.cred.freestyle.deadpool.infrastructure.messaging;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.DraftEvent;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.SeasonTransitionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for draft and season events.
 *
 * Publishing is fire-and-forget after the store write has succeeded: a failed send is
 * logged and never undoes the pick or transition it describes.
 *
 * Topic partitioning strategy:
 * - Draft events are keyed by year, so one season's picks stay in order on one partition
 * - Season events are keyed by "{from}_TO_{to}"
 *
 * @author Deadpool Team
 */
@Service
public class DraftEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(DraftEventPublisher.class);

    private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final DeadpoolProperties.Events config;

    public DraftEventPublisher(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
                               ObjectMapper objectMapper,
                               DeadpoolProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getEvents();
    }

    /**
     * Publish a pick committed event.
     *
     * @param event Draft event
     */
    public void publishPickCommitted(DraftEvent event) {
        KafkaTemplate<String, String> template = template();
        if (template == null) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = template.send(
                    config.getDraftTopic(),
                    String.valueOf(event.getYear()),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published pick committed event for player {}, candidate: {}, partition: {}",
                            event.getPlayerId(), event.getCandidateId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish pick committed event for player {}, candidate: {}",
                            event.getPlayerId(), event.getCandidateId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing draft event for player {}", event.getPlayerId(), e);
        } catch (KafkaException | org.springframework.kafka.KafkaException e) {
            logger.error("Kafka rejected pick committed event for player {}", event.getPlayerId(), e);
        }
    }

    /**
     * Publish a season transition completed event.
     *
     * @param event Transition event
     */
    public void publishSeasonTransition(SeasonTransitionEvent event) {
        KafkaTemplate<String, String> template = template();
        if (template == null) {
            return;
        }
        String key = event.getFromYear() + "_TO_" + event.getToYear();
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = template.send(
                    config.getSeasonTopic(),
                    key,
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published season transition event {} with status {}", key, event.getStatus());
                } else {
                    logger.error("Failed to publish season transition event {}", key, ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing season transition event {}", key, e);
        } catch (KafkaException | org.springframework.kafka.KafkaException e) {
            logger.error("Kafka rejected season transition event {}", key, e);
        }
    }

    private KafkaTemplate<String, String> template() {
        if (!config.isEnabled()) {
            logger.debug("Event publishing disabled");
            return null;
        }
        KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
        if (template == null) {
            logger.warn("Event publishing enabled but no KafkaTemplate is configured");
        }
        return template;
    }
}
