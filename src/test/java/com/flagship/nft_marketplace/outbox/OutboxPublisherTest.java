package com.flagship.nft_marketplace.outbox;

import com.flagship.nft_marketplace.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behavior against a mocked broker: acknowledgments, failures and the retry limit.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "market-events";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "marketEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private static OutboxEvent event(String tokenId, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "MarketItem", tokenId, "MarketItemBought",
            "{\"tokenId\":" + tokenId + "}", Instant.now(), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.getAggregateId(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42, 0, 0L, 1, 1);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Acknowledged events are sent keyed by token id and marked published")
    void testPublish_Acknowledged() {
        OutboxEvent first = event("3", 0);
        OutboxEvent second = event("5", 0);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send(TOPIC, "3", first.getPayload())).thenReturn(acknowledged(first));
        when(kafkaTemplate.send(TOPIC, "5", second.getPayload())).thenReturn(acknowledged(second));

        publisher.triggerPublish();

        verify(outboxService).markPublished(first.getId());
        verify(outboxService).markPublished(second.getId());
        verify(outboxMetrics, times(2)).recordEventPublished("MarketItemBought");
        verify(outboxService, never()).markFailed(eq(first.getId()), anyString());
    }

    @Test
    @DisplayName("A broker failure counts a retry and leaves the event unpublished")
    void testPublish_Failure() {
        OutboxEvent event = event("1", 0);
        when(kafkaTemplate.send(TOPIC, "1", event.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("MarketItemBought");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The failure that reaches the retry limit dead-letters the event")
    void testPublish_DeadLettered() {
        OutboxEvent event = event("1", 2);
        when(kafkaTemplate.send(TOPIC, "1", event.getPayload()))
            .thenThrow(new IllegalStateException("producer closed"));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(event.getId(), "producer closed");
        verify(outboxMetrics).recordEventDeadLettered("MarketItemBought");
    }

    @Test
    @DisplayName("A failing poll is logged and skipped")
    void testPoll_Failure() {
        when(outboxService.findPublishableEvents(100, 3)).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Events past the retry limit count as dead-lettered until published")
    void testEvent_DeadLettered() {
        OutboxEvent fresh = OutboxEvent.create("MarketItem", "0", "MarketItemBought", "{}");
        OutboxEvent exhausted = event("0", 3);

        assertFalse(fresh.isPublished());
        assertEquals(0, fresh.getRetryCount());
        assertFalse(fresh.isDeadLettered(3));
        assertTrue(exhausted.isDeadLettered(3));
        assertFalse(exhausted.isDeadLettered(4));
    }
}
