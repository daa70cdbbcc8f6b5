package com.tradeadvisor.backend.repository;

import com.tradeadvisor.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByUserIdAndEventTypeOrderByCreatedAtAsc(Long userId, String eventType);
}
