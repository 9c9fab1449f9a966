package com.scifund.core.repository;

import com.scifund.core.domain.Researcher;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ResearcherRepository extends JpaRepository<Researcher, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Researcher r WHERE r.principalId = :principalId")
    Optional<Researcher> findByIdForUpdate(@Param("principalId") String principalId);
}
