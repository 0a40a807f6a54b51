package com.solusoft.ai.healthsim.features.pharmacy.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthorization;

public interface PriorAuthorizationRepository extends ListCrudRepository<PriorAuthorization, Long> {

    Optional<PriorAuthorization> findByPaNumber(String paNumber);

    // pa_number is PA + yyyyMMdd + 9 digit sequence
    @Query("SELECT COALESCE(MAX(CAST(SUBSTR(pa_number, 11) AS INTEGER)), 0) FROM prior_authorizations")
    long maxPaSequence();

    @Query("SELECT * FROM prior_authorizations WHERE member_id = :memberId AND status = 'APPROVED'")
    List<PriorAuthorization> findApprovedByMember(@Param("memberId") String memberId);
}
