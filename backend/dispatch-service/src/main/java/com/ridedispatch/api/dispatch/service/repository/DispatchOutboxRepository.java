package com.ridedispatch.api.dispatch.service.repository;

import com.ridedispatch.api.dispatch.service.entity.DispatchOutbox;
import com.ridedispatch.api.shared.outbox.OutboxStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DispatchOutboxRepository extends JpaRepository<DispatchOutbox, UUID> {
    List<DispatchOutbox> findByStatusOrderByCreatedAt(OutboxStatus status);
    List<DispatchOutbox> findByAggregateId(UUID aggregateId);
}
