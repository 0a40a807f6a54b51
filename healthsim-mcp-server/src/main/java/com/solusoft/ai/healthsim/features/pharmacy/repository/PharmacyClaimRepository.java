package com.solusoft.ai.healthsim.features.pharmacy.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;

public interface PharmacyClaimRepository extends ListCrudRepository<PharmacyClaimRecord, Long> {

    // Dates are stored as ISO-8601 text
    @Query("""
        SELECT * FROM pharmacy_claims
        WHERE pharmacy_npi = :npi AND rx_number = :rx AND fill_number = :fill
          AND service_date = :date AND status = 'PAID'
    """)
    Optional<PharmacyClaimRecord> findPaid(@Param("npi") String pharmacyNpi, @Param("rx") String rxNumber,
            @Param("fill") int fillNumber, @Param("date") String serviceDate);

    @Query("SELECT * FROM pharmacy_claims WHERE member_id = :memberId AND status = 'PAID' ORDER BY service_date")
    List<PharmacyClaimRecord> findPaidByMember(@Param("memberId") String memberId);

    // authorization_number is RX + yyyyMMdd + 9 digit sequence
    @Query("SELECT COALESCE(MAX(CAST(SUBSTR(authorization_number, 11) AS INTEGER)), 0) FROM pharmacy_claims")
    long maxAuthorizationSequence();

    @Modifying
    @Query("UPDATE pharmacy_claims SET status = 'REVERSED' WHERE authorization_number = :auth AND status = 'PAID'")
    int markReversed(@Param("auth") String authorizationNumber);
}
