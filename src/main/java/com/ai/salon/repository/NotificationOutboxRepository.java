package com.ai.salon.repository;

import com.ai.salon.entity.NotificationOutbox;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface NotificationOutboxRepository extends JpaRepository<NotificationOutbox, Long> {

    List<NotificationOutbox> findByStatusInAndNextRetryAtLessThanEqualOrderByCreatedAtAsc(
            Collection<NotificationOutbox.Status> statuses,
            Instant now,
            Pageable pageable
    );

    List<NotificationOutbox> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
