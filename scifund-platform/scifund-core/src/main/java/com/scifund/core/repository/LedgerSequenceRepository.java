package com.scifund.core.repository;

import com.scifund.core.domain.LedgerSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LedgerSequenceRepository extends JpaRepository<LedgerSequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LedgerSequence s WHERE s.name = :name")
    Optional<LedgerSequence> findByNameForUpdate(@Param("name") String name);
}
