package com.scifund.core.repository;

import com.scifund.core.domain.LedgerEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger events.
 * Append-only; callers never update or delete rows.
 */
@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    Optional<LedgerEvent> findTopByOrderByIdDesc();

    List<LedgerEvent> findByResourceTypeAndResourceIdOrderByIdAsc(String resourceType, String resourceId);

    List<LedgerEvent> findTop50ByOrderByIdDesc();

    List<LedgerEvent> findAllByOrderByIdAsc();
}
