package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.regex.Pattern;

import com.solusoft.ai.healthsim.common.generator.DemographicsGenerator;
import com.solusoft.ai.healthsim.common.generator.GenerationContext;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates pharmacy benefit members with BIN/PCN/group routing and partially met accumulators.
 */
@Slf4j
public class RxMemberGenerator {

    public static final BigDecimal DEFAULT_DEDUCTIBLE = new BigDecimal("250.00");
    public static final BigDecimal DEFAULT_OOP_LIMIT = new BigDecimal("3000.00");

    private static final AgeRange DEFAULT_AGES = AgeRange.of(18, 85);
    private static final Pattern BIN = Pattern.compile("\\d{6}");
    private static final Pattern PCN = Pattern.compile("[A-Za-z0-9]{1,10}");

    private final GenerationContext context;
    private final DemographicsGenerator demographics;
    private BigDecimal deductibleLimit = DEFAULT_DEDUCTIBLE;
    private BigDecimal oopLimit = DEFAULT_OOP_LIMIT;

    public RxMemberGenerator(long seed) {
        this(seed, Clock.systemDefaultZone());
    }

    public RxMemberGenerator(long seed, Clock clock) {
        this.context = new GenerationContext(seed, clock);
        this.demographics = new DemographicsGenerator(context);
    }

    public RxMemberGenerator withLimits(BigDecimal deductibleLimit, BigDecimal oopLimit) {
        this.deductibleLimit = deductibleLimit;
        this.oopLimit = oopLimit;
        return this;
    }

    public RxMember generate(String bin, String pcn, String groupNumber) {
        return generate(bin, pcn, groupNumber, null, null);
    }

    public RxMember generate(String bin, String pcn, String groupNumber, AgeRange ageRange, Gender gender) {
        validateRouting(bin, pcn, groupNumber);
        Demographics person = demographics.generate(ageRange == null ? DEFAULT_AGES : ageRange, gender);
        LocalDate today = context.today();

        // Accumulators start partially met; the deductible is satisfied for about a quarter of members.
        BigDecimal deductibleMet = context.chance(0.25)
                ? deductibleLimit
                : deductibleLimit.multiply(BigDecimal.valueOf(context.nextDouble())).setScale(2, RoundingMode.HALF_UP);
        BigDecimal oopMet = deductibleMet.add(
                BigDecimal.valueOf(context.between(0.0, 400.0)).setScale(2, RoundingMode.HALF_UP)).min(oopLimit);

        String memberId = context.nextId("RXM");
        RxMember member = RxMember.builder()
                .memberId(memberId)
                .cardholderId(memberId.substring(3) + context.digits(2))
                .personCode("01")
                .bin(bin)
                .pcn(pcn)
                .groupNumber(groupNumber)
                .demographics(person)
                .age(person.ageOn(today))
                .deductibleMet(deductibleMet)
                .deductibleLimit(deductibleLimit)
                .oopMet(oopMet)
                .oopLimit(oopLimit)
                .effectiveDate(today.withDayOfYear(1))
                .terminationDate(today.withDayOfYear(1).plusYears(1).minusDays(1))
                .build();
        log.debug("Generated rx member {} (seed {})", memberId, context.seed());
        return member;
    }

    private static void validateRouting(String bin, String pcn, String groupNumber) {
        if (bin == null || !BIN.matcher(bin).matches()) {
            throw new InvalidRequestException("BIN must be 6 digits: " + bin);
        }
        if (pcn == null || !PCN.matcher(pcn).matches()) {
            throw new InvalidRequestException("PCN must be 1-10 alphanumeric characters: " + pcn);
        }
        if (groupNumber == null || groupNumber.isBlank() || groupNumber.length() > 15) {
            throw new InvalidRequestException("Group number must be 1-15 characters: " + groupNumber);
        }
    }
}
