package com.solusoft.ai.healthsim.features.members.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.solusoft.ai.healthsim.common.generator.DemographicsGenerator;
import com.solusoft.ai.healthsim.common.generator.GenerationContext;
import com.solusoft.ai.healthsim.common.generator.NpiGenerator;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.members.model.Accumulator;
import com.solusoft.ai.healthsim.features.members.model.BenefitResult;
import com.solusoft.ai.healthsim.features.members.model.ClaimLine;
import com.solusoft.ai.healthsim.features.members.model.ClaimStatus;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.MemberConstraints;
import com.solusoft.ai.healthsim.features.members.model.MemberStatus;
import com.solusoft.ai.healthsim.features.members.model.Plan;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.Provider;
import com.solusoft.ai.healthsim.features.members.model.Relationship;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates health-plan members, families and their professional claims history.
 * Not thread-safe: one instance per seeded run.
 */
@Slf4j
public class MemberGenerator {

    static final AgeRange SUBSCRIBER_AGES = AgeRange.of(18, 64);

    private static final List<String[]> PROCEDURES = List.of(
            new String[] {"99213", "150.00"},
            new String[] {"99214", "210.00"},
            new String[] {"99203", "180.00"},
            new String[] {"99283", "450.00"},
            new String[] {"99285", "950.00"},
            new String[] {"80053", "45.00"},
            new String[] {"85025", "30.00"},
            new String[] {"36415", "15.00"},
            new String[] {"71046", "120.00"},
            new String[] {"93000", "85.00"},
            new String[] {"97110", "95.00"},
            new String[] {"73721", "1200.00"});

    private static final List<String> OFFICE_VISITS = List.of("99213", "99214", "99203");
    private static final List<String> ER_VISITS = List.of("99283", "99285");

    private static final List<String> DIAGNOSES = List.of(
            "Z0000", "I10", "E119", "J069", "M5450", "E785", "R059", "K219", "F329", "M1711");

    private static final List<String> PRACTICES = List.of(
            "SPRINGFIELD FAMILY MEDICINE", "RIVERSIDE INTERNAL MEDICINE", "LAKEVIEW PRIMARY CARE",
            "NORTHSIDE URGENT CARE", "VALLEY ORTHOPEDIC GROUP", "ST MARYS EMERGENCY PHYSICIANS");

    private static final List<String> DENIAL_REASONS = List.of("50", "96", "197", "204");

    private final GenerationContext context;
    private final DemographicsGenerator demographics;
    private final NpiGenerator npis;
    private final BenefitCalculator benefitCalculator = new BenefitCalculator();

    public MemberGenerator(long seed) {
        this(seed, Clock.systemDefaultZone());
    }

    public MemberGenerator(long seed, Clock clock) {
        this.context = new GenerationContext(seed, clock);
        this.demographics = new DemographicsGenerator(context);
        this.npis = new NpiGenerator(context);
    }

    public Member generateMember() {
        return generateMember(MemberConstraints.none());
    }

    public Member generateMember(MemberConstraints constraints) {
        Plan plan = constraints.planCode() != null
                ? PlanCatalog.get(constraints.planCode())
                : context.pick(PlanCatalog.all());
        MemberStatus status = constraints.status() != null ? constraints.status()
                : context.chance(0.9) ? MemberStatus.ACTIVE : MemberStatus.TERMED;
        AgeRange ages = constraints.ageRange() != null ? constraints.ageRange() : SUBSCRIBER_AGES;
        Demographics person = demographics.generate(ages, constraints.gender());

        LocalDate today = context.today();
        LocalDate coverageStart = coverageStart(today);
        LocalDate coverageEnd = status == MemberStatus.TERMED ? coverageEnd(coverageStart, today) : null;
        String memberId = context.nextId("MEM");
        String subscriberId = context.nextId("SUB");
        String groupId = "GRP" + context.between(10000, 99999);

        return new Member(memberId, subscriberId, person, person.ageOn(today), plan.code(), groupId, status,
                Relationship.SELF, coverageStart, coverageEnd, accumulators(plan, true), new ArrayList<>());
    }

    /**
     * Subscriber first, then the spouse, then children. Dependents share the subscriber's
     * id, group, plan, status, coverage dates and family name.
     */
    public List<Member> generateFamily(String planCode, boolean spouse, int children) {
        if (children < 0) {
            throw new InvalidRequestException("children must be >= 0, was " + children);
        }
        Member subscriber = generateMember(new MemberConstraints(planCode, AgeRange.of(26, 64), MemberStatus.ACTIVE, null));
        Plan plan = PlanCatalog.get(subscriber.planCode());
        Demographics head = subscriber.demographics();
        List<Member> family = new ArrayList<>();
        family.add(subscriber);

        if (spouse) {
            Gender gender = head.gender() == Gender.M ? Gender.F : Gender.M;
            AgeRange ages = AgeRange.of(Math.max(18, subscriber.age() - 5), Math.min(AgeRange.MAX_AGE, subscriber.age() + 5));
            family.add(dependent(subscriber, plan, demographics.generate(ages, gender, head.lastName()), Relationship.SPOUSE));
        }
        AgeRange childAges = AgeRange.of(0, Math.max(0, Math.min(25, subscriber.age() - 18)));
        for (int i = 0; i < children; i++) {
            family.add(dependent(subscriber, plan, demographics.generate(childAges, null, head.lastName()), Relationship.CHILD));
        }
        return family;
    }

    public Member generateMemberWithClaims(String planCode, int claimCount, LocalDate start, LocalDate end) {
        Member member = generateMember(new MemberConstraints(planCode, null, MemberStatus.ACTIVE, null));
        // claims history drives the accumulators, so start the year fresh
        member.accumulators().putAll(accumulators(PlanCatalog.get(member.planCode()), false));
        generateClaims(member, claimCount, start, end);
        return member;
    }

    /**
     * Adds {@code claimCount} claims with service dates in {@code [start, end]} to the member,
     * in date order, adjudicating each against the member's accumulators.
     */
    public List<ProfessionalClaim> generateClaims(Member member, int claimCount, LocalDate start, LocalDate end) {
        if (claimCount < 0) {
            throw new InvalidRequestException("claimCount must be >= 0, was " + claimCount);
        }
        if (start.isAfter(end)) {
            throw new InvalidRequestException("Claim date range start " + start + " is after end " + end);
        }
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < claimCount; i++) {
            dates.add(context.dateBetween(start, end));
        }
        dates.sort(Comparator.naturalOrder());
        List<ProfessionalClaim> claims = new ArrayList<>();
        for (LocalDate serviceDate : dates) {
            claims.add(generateClaim(member, serviceDate));
        }
        member.claims().addAll(claims);
        log.debug("Generated {} claims for member {}", claims.size(), member.memberId());
        return claims;
    }

    public List<Member> generateMemberBatch(int count) {
        if (count < 0) {
            throw new InvalidRequestException("count must be >= 0, was " + count);
        }
        List<Member> members = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            members.add(generateMember());
        }
        return members;
    }

    public List<Member> generatePopulation(int count, boolean withClaims, int minClaims, int maxClaims) {
        return generatePopulation(null, count, withClaims, minClaims, maxClaims);
    }

    /**
     * Population on one plan, or on randomly chosen plans when {@code planCode} is null.
     * With claims, each member gets between {@code minClaims} and {@code maxClaims} claims from the last 12 months.
     */
    public List<Member> generatePopulation(String planCode, int count, boolean withClaims, int minClaims, int maxClaims) {
        if (count < 0) {
            throw new InvalidRequestException("count must be >= 0, was " + count);
        }
        if (!withClaims) {
            List<Member> members = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                members.add(generateMember(MemberConstraints.plan(planCode)));
            }
            return members;
        }
        if (minClaims < 0 || minClaims > maxClaims) {
            throw new InvalidRequestException("Invalid claims per member range [" + minClaims + ", " + maxClaims + "]");
        }
        LocalDate end = context.today();
        LocalDate start = end.minusMonths(12);
        List<Member> members = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String plan = planCode != null ? planCode : context.pick(PlanCatalog.codes());
            members.add(generateMemberWithClaims(plan, context.between(minClaims, maxClaims), start, end));
        }
        return members;
    }

    public List<Plan> listPlans() {
        return PlanCatalog.all();
    }

    /**
     * Builds one claim for the member and, when paid, runs it through the member's benefits.
     */
    ProfessionalClaim generateClaim(Member member, LocalDate serviceDate) {
        Plan plan = PlanCatalog.get(member.planCode());
        Provider provider = provider();
        List<String> diagnoses = context.sample(DIAGNOSES, context.between(1, 3));

        List<ClaimLine> lines = new ArrayList<>();
        int lineCount = context.between(1, 3);
        boolean emergency = context.chance(0.1);
        String visit = emergency ? context.pick(ER_VISITS) : context.pick(OFFICE_VISITS);
        lines.add(line(1, visit));
        for (int i = 2; i <= lineCount; i++) {
            String[] procedure = context.pick(PROCEDURES.subList(5, PROCEDURES.size()));
            lines.add(line(i, procedure[0]));
        }
        BigDecimal totalCharge = lines.stream().map(ClaimLine::charge).reduce(BigDecimal.ZERO, BigDecimal::add);

        double roll = context.nextDouble();
        ClaimStatus status = roll < 0.9 ? ClaimStatus.PAID : roll < 0.95 ? ClaimStatus.DENIED : ClaimStatus.PENDING;
        String claimId = context.nextId("CLM");
        if (status != ClaimStatus.PAID) {
            String denial = status == ClaimStatus.DENIED ? context.pick(DENIAL_REASONS) : null;
            BigDecimal zero = BigDecimal.ZERO.setScale(2);
            List<ClaimLine> unpaid = new ArrayList<>();
            for (ClaimLine line : lines) {
                unpaid.add(ClaimLine.unadjudicated(line.lineNumber(), line.cptCode(), line.units(), line.charge(),
                        status == ClaimStatus.DENIED ? zero : line.allowed()));
            }
            BigDecimal allowed = unpaid.stream().map(ClaimLine::allowed).reduce(BigDecimal.ZERO, BigDecimal::add);
            return new ProfessionalClaim(claimId, member.memberId(), member.subscriberId(), member.groupId(),
                    member.demographics(), member.relationship(), provider, serviceDate, diagnoses, unpaid, status,
                    totalCharge, allowed, zero, zero, zero, zero, zero, denial);
        }

        BenefitResult result = benefitCalculator.adjudicate(lines, plan, member.accumulators());
        return new ProfessionalClaim(claimId, member.memberId(), member.subscriberId(), member.groupId(),
                member.demographics(), member.relationship(), provider, serviceDate, diagnoses, result.lines(),
                ClaimStatus.PAID, totalCharge, result.allowed(), result.paid(), result.patientResponsibility(),
                result.deductible(), result.copay(), result.coinsurance(), null);
    }

    private ClaimLine line(int number, String cptCode) {
        String[] procedure = PROCEDURES.stream().filter(p -> p[0].equals(cptCode)).findFirst().orElseThrow();
        int units = cptCode.startsWith("97") ? context.between(1, 4) : 1;
        BigDecimal charge = new BigDecimal(procedure[1]).multiply(BigDecimal.valueOf(units));
        BigDecimal allowed = charge.multiply(BigDecimal.valueOf(context.between(55, 75)))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
        return ClaimLine.unadjudicated(number, cptCode, units, charge, allowed);
    }

    private Provider provider() {
        return new Provider(npis.generate(), context.pick(PRACTICES), context.digits(9), demographics.address());
    }

    private Member dependent(Member subscriber, Plan plan, Demographics person, Relationship relationship) {
        return new Member(context.nextId("MEM"), subscriber.subscriberId(), person, person.ageOn(context.today()),
                plan.code(), subscriber.groupId(), subscriber.status(), relationship, subscriber.coverageStart(),
                subscriber.coverageEnd(), accumulators(plan, true), new ArrayList<>());
    }

    private Map<String, Accumulator> accumulators(Plan plan, boolean randomUsage) {
        BigDecimal deductibleUsed = BigDecimal.ZERO.setScale(2);
        BigDecimal oopUsed = BigDecimal.ZERO.setScale(2);
        if (randomUsage) {
            deductibleUsed = fraction(plan.deductibleIndividual(), context.nextDouble());
            BigDecimal headroom = plan.oopMaxIndividual().subtract(deductibleUsed);
            oopUsed = deductibleUsed.add(fraction(headroom, context.nextDouble() * 0.3));
        }
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        accumulators.put(Accumulator.DEDUCTIBLE,
                new Accumulator(Accumulator.DEDUCTIBLE, plan.deductibleIndividual(), deductibleUsed));
        accumulators.put(Accumulator.OUT_OF_POCKET,
                new Accumulator(Accumulator.OUT_OF_POCKET, plan.oopMaxIndividual(), oopUsed));
        return accumulators;
    }

    private static BigDecimal fraction(BigDecimal amount, double share) {
        return amount.multiply(BigDecimal.valueOf(share)).setScale(2, RoundingMode.DOWN);
    }

    private LocalDate coverageStart(LocalDate today) {
        LocalDate start = context.dateBetween(today.minusYears(3), today.minusDays(30));
        return start.withDayOfMonth(1);
    }

    private LocalDate coverageEnd(LocalDate start, LocalDate today) {
        LocalDate earliest = start.plusMonths(1).minusDays(1);
        LocalDate latest = today.isAfter(earliest) ? today : earliest;
        return context.dateBetween(earliest, latest);
    }
}
