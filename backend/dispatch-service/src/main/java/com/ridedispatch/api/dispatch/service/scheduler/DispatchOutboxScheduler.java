package com.ridedispatch.api.dispatch.service.scheduler;

import com.ridedispatch.api.dispatch.service.entity.DispatchOutbox;
import com.ridedispatch.api.dispatch.service.repository.DispatchOutboxRepository;
import com.ridedispatch.api.shared.outbox.OutboxStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Relays committed ride status changes to the notification topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchOutboxScheduler {

    private final DispatchOutboxRepository dispatchOutboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.outbox.interval-ms:5000}")
    @Transactional
    public void processOutboxEvents() {
        List<DispatchOutbox> pendingEvents = dispatchOutboxRepository
                .findByStatusOrderByCreatedAt(OutboxStatus.PENDING);

        if (!pendingEvents.isEmpty()) {
            log.info("Processing {} dispatch outbox events", pendingEvents.size());
        }

        for (DispatchOutbox event : pendingEvents) {
            try {
                // Keyed by ride so one ride's changes stay ordered on a partition
                kafkaTemplate.send(event.getEventType(), event.getAggregateId().toString(), event.getPayload());

                event.setStatus(OutboxStatus.SENT);
                event.setProcessedAt(ZonedDateTime.now(clock));
                dispatchOutboxRepository.save(event);

                log.debug("Sent dispatch event {} to topic {}", event.getId(), event.getEventType());
            } catch (Exception e) {
                log.error("Failed to send dispatch event {} to topic {}", event.getId(), event.getEventType(), e);

                event.setStatus(OutboxStatus.FAILED);
                event.setProcessedAt(ZonedDateTime.now(clock));
                dispatchOutboxRepository.save(event);
            }
        }
    }
}
