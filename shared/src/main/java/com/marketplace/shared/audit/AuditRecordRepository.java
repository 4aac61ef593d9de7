package com.marketplace.shared.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, String> {

    List<AuditRecord> findByEntityIdOrderByOccurredAtDesc(String entityId);

    Optional<AuditRecord> findFirstByEntityIdAndActionInOrderByOccurredAtDesc(String entityId, Collection<String> actions);
}
