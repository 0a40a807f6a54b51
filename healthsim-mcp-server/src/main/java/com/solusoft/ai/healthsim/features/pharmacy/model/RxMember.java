package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.solusoft.ai.healthsim.common.model.Demographics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pharmacy benefit member as seen on the card: BIN/PCN/group routing plus the pharmacy accumulators.
 * The accumulators are updated in place by adjudication and reversal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RxMember {

    private String memberId;
    private String cardholderId;
    private String personCode;
    private String bin;
    private String pcn;
    private String groupNumber;
    private Demographics demographics;
    private int age;
    private BigDecimal deductibleMet;
    private BigDecimal deductibleLimit;
    private BigDecimal oopMet;
    private BigDecimal oopLimit;
    private LocalDate effectiveDate;
    private LocalDate terminationDate;

    @JsonIgnore
    public BigDecimal getDeductibleRemaining() {
        return deductibleLimit.subtract(deductibleMet).max(BigDecimal.ZERO);
    }

    @JsonIgnore
    public BigDecimal getOopRemaining() {
        return oopLimit.subtract(oopMet).max(BigDecimal.ZERO);
    }

    public boolean isCoveredOn(LocalDate date) {
        return !date.isBefore(effectiveDate) && (terminationDate == null || !date.isAfter(terminationDate));
    }
}
