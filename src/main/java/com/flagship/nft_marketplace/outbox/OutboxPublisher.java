package com.flagship.nft_marketplace.outbox;

import com.flagship.nft_marketplace.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Background publisher that moves market events from the outbox to Kafka.
 *
 * - Polls outbox_events for unpublished events, oldest first
 * - Sends each one keyed by token id, so all events of a token land on one
 *   partition in order
 * - Marks events as published on acknowledgment, or counts a retry on failure
 * - Events that failed outbox.publisher.max-retries times are left for manual
 *   intervention and no longer polled
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.market-events:market-events}")
    private String marketEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(batchSize, maxRetries);
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    /**
     * Publishes a single event and waits for the broker acknowledgment.
     */
    void publishEvent(OutboxEvent event) {
        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(marketEventsTopic, event.getAggregateId(), event.getPayload());
            SendResult<String, String> result = future.get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, tokenId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Manually triggers publishing.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
