package com.scifund.core.repository;

import com.scifund.core.domain.VerifierGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VerifierGrantRepository extends JpaRepository<VerifierGrant, String> {

    boolean existsByPrincipalIdAndEnabledTrue(String principalId);

    List<VerifierGrant> findByEnabledTrueOrderByPrincipalIdAsc();
}
