package com.flagship.content_graph.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.content_graph.event.EventKind;
import com.flagship.content_graph.event.LedgerEvent;
import com.flagship.content_graph.event.LedgerTransaction;
import com.flagship.content_graph.materializer.DispatchOutcome;
import com.flagship.content_graph.materializer.EntityEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for content directory ledger messages.
 *
 * The topic carries one JSON message per event or ledger transaction, in
 * ledger emission order. Messages are dispatched one at a time and the
 * offset is committed only after the dispatch settled (ack-mode=manual).
 *
 * - Unparseable messages are logged and acknowledged
 * - Dropped and skipped outcomes are acknowledged
 * - Fatal conditions and store failures are rethrown unacknowledged; the
 *   container error handler (see {@code KafkaConfig}) then stops the
 *   listener at the offending offset
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerEventConsumer {

    private final EntityEventDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.ledger-events:content-directory-events}",
        groupId = "${spring.kafka.consumer.group-id:content-graph-materializer}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        LedgerMessage message = parse(record.value());
        if (message == null) {
            log.warn("Could not parse ledger message at offset {}, acknowledging to skip: {}",
                    record.offset(), record.value());
            ack.acknowledge();
            return;
        }

        try {
            DispatchOutcome outcome = message.dispatchTo(dispatcher);
            ack.acknowledge();
            log.debug("Settled {} at offset {}: {}", message.kind(), record.offset(), outcome.status());
        } catch (RuntimeException e) {
            log.error("Halting at offset {}, {} could not be materialized: {}",
                    record.offset(), message.kind(), e.getMessage());
            throw e;
        }
    }

    /**
     * Parses a raw message into an event or a ledger transaction.
     *
     * @return null if the payload is not a well-formed ledger message
     */
    LedgerMessage parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("kind")) {
                return null;
            }
            EventKind kind = EventKind.valueOf(node.get("kind").asText());
            if (kind == EventKind.Transaction) {
                LedgerTransaction transaction = objectMapper.treeToValue(node, LedgerTransaction.class);
                return new LedgerMessage(kind, null, transaction);
            }
            if (!node.hasNonNull("blockNumber") || !node.hasNonNull("entityId")) {
                return null;
            }
            if (kind == EventKind.EntityCreated && !node.hasNonNull("classId")) {
                return null;
            }
            LedgerEvent event = objectMapper.treeToValue(node, LedgerEvent.class);
            return new LedgerMessage(kind, event, null);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse ledger message: {}", e.getMessage());
            return null;
        }
    }

    record LedgerMessage(EventKind kind, LedgerEvent event, LedgerTransaction transaction) {

        DispatchOutcome dispatchTo(EntityEventDispatcher dispatcher) {
            return transaction != null
                    ? dispatcher.dispatchTransaction(transaction)
                    : dispatcher.dispatch(event);
        }
    }
}
