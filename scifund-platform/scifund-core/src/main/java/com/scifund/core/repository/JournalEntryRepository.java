package com.scifund.core.repository;

import com.scifund.core.domain.JournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, UUID> {

    List<JournalEntry> findByReferenceStartingWithOrderByRecordedAtAsc(String referencePrefix);

    boolean existsByIdempotencyKey(String idempotencyKey);
}
