package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Builder;
import lombok.With;

/**
 * An approved prior authorization on file. Claims quote {@code paNumber} in the PA field.
 */
@Table("prior_authorizations")
@Builder
public record PriorAuthorization(
    @Id @With
    Long id,

    String paNumber,
    String memberId,
    String ndc,
    String gpi,
    String drugName,
    String status,
    LocalDate effectiveDate,
    LocalDate expirationDate,
    LocalDateTime createdAt
) {

    /** True when this approval covers the drug (by NDC or GPI) for the member on the given date. */
    public boolean covers(String memberId, String ndc, String gpi, LocalDate date) {
        return PriorAuthStatus.APPROVED.name().equals(status)
                && this.memberId.equals(memberId)
                && (this.ndc.equals(ndc) || (gpi != null && gpi.equals(this.gpi)))
                && !date.isBefore(effectiveDate)
                && !date.isAfter(expirationDate);
    }
}
