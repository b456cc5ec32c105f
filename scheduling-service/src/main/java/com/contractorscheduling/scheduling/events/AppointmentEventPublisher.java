package com.contractorscheduling.scheduling.events;

import com.contractorscheduling.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Relays appointment events to Kafka after the originating transaction commits.
 * A rolled-back booking never reaches the topics. Send failures are logged; the
 * appointment itself is already durable.
 *
 * Topics:
 * - appointment-booked
 * - appointment-cancelled
 * - appointment-status-changed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentBooked(AppointmentBookedEvent event) {
        publishEvent(Constants.TOPIC_APPOINTMENT_BOOKED, keyOf(event.getContractorId()), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentCancelled(AppointmentCancelledEvent event) {
        publishEvent(Constants.TOPIC_APPOINTMENT_CANCELLED, keyOf(event.getContractorId()), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentStatusChanged(AppointmentStatusChangedEvent event) {
        publishEvent(Constants.TOPIC_APPOINTMENT_STATUS_CHANGED, keyOf(event.getContractorId()), event);
    }

    // Keyed by contractor so a consumer sees one contractor's events in order.
    private String keyOf(Long contractorId) {
        return String.valueOf(contractorId);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Event published to topic {}: offset={}",
                            topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event to topic {}", topic, ex);
                }
            });
        } catch (RuntimeException ex) {
            log.error("Kafka send to topic {} rejected before dispatch", topic, ex);
        }
    }
}
