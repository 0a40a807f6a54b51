package com.solusoft.ai.healthsim.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.solusoft.ai.healthsim.features.members.format.EligibilityFormatter;
import com.solusoft.ai.healthsim.features.members.format.EnrollmentFormatter;
import com.solusoft.ai.healthsim.features.members.format.ProfessionalClaimFormatter;
import com.solusoft.ai.healthsim.features.members.format.RemittanceFormatter;
import com.solusoft.ai.healthsim.features.members.format.ServiceReviewFormatter;
import com.solusoft.ai.healthsim.features.members.format.X12Writer;
import com.solusoft.ai.healthsim.features.members.service.ServiceReviewService;
import com.solusoft.ai.healthsim.features.patients.format.FhirBundleExporter;
import com.solusoft.ai.healthsim.features.patients.format.Hl7v2MessageBuilder;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpScriptFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpTelecomFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.repository.PharmacyClaimRepository;
import com.solusoft.ai.healthsim.features.pharmacy.repository.PriorAuthorizationRepository;
import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationEngine;
import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationSettings;
import com.solusoft.ai.healthsim.features.pharmacy.service.ClaimHistory;
import com.solusoft.ai.healthsim.features.pharmacy.service.DurValidator;
import com.solusoft.ai.healthsim.features.pharmacy.service.Formulary;
import com.solusoft.ai.healthsim.features.pharmacy.service.FormularyGenerator;
import com.solusoft.ai.healthsim.features.pharmacy.service.InMemoryClaimHistory;
import com.solusoft.ai.healthsim.features.pharmacy.service.InMemoryPriorAuthorizationLedger;
import com.solusoft.ai.healthsim.features.pharmacy.service.JdbcClaimHistory;
import com.solusoft.ai.healthsim.features.pharmacy.service.JdbcPriorAuthorizationLedger;
import com.solusoft.ai.healthsim.features.pharmacy.service.PriorAuthorizationLedger;
import com.solusoft.ai.healthsim.features.pharmacy.service.PriorAuthorizationService;
import com.solusoft.ai.healthsim.features.pharmacy.service.RxMemberRegistry;

import ca.uhn.fhir.context.FhirContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the format writers and pharmacy services from {@link HealthSimProperties}.
 * Generators are not beans: tools create one per call with the caller's seed.
 */
@Configuration
@Slf4j
public class HealthSimConfig {

    private static final String MEMORY_STORE = "memory";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // --- PatientSim ---

    @Bean
    public FhirContext fhirContext() {
        // Expensive to build; one per application
        return FhirContext.forR4();
    }

    @Bean
    public FhirBundleExporter fhirBundleExporter(FhirContext fhirContext) {
        return new FhirBundleExporter(fhirContext);
    }

    @Bean
    public Hl7v2MessageBuilder hl7v2MessageBuilder(HealthSimProperties properties, Clock clock) {
        HealthSimProperties.Hl7 hl7 = properties.getHl7();
        return new Hl7v2MessageBuilder(hl7.getSendingApplication(), hl7.getSendingFacility(),
                hl7.getReceivingApplication(), hl7.getReceivingFacility(), hl7.getProcessingId(), clock);
    }

    // --- MemberSim ---

    @Bean
    public X12Writer x12Writer(HealthSimProperties properties, Clock clock) {
        HealthSimProperties.X12 x12 = properties.getX12();
        return new X12Writer(x12.getSenderId(), x12.getReceiverId(), x12.getUsageIndicator(), clock);
    }

    @Bean
    public EnrollmentFormatter enrollmentFormatter(X12Writer writer, HealthSimProperties properties) {
        return new EnrollmentFormatter(writer, properties.getX12().getPayerName(), properties.getX12().getPayerId());
    }

    @Bean
    public ProfessionalClaimFormatter professionalClaimFormatter(X12Writer writer, HealthSimProperties properties) {
        return new ProfessionalClaimFormatter(writer, properties.getX12().getPayerName(), properties.getX12().getPayerId());
    }

    @Bean
    public RemittanceFormatter remittanceFormatter(X12Writer writer, HealthSimProperties properties) {
        return new RemittanceFormatter(writer, properties.getX12().getPayerName(), properties.getX12().getPayerId());
    }

    @Bean
    public EligibilityFormatter eligibilityFormatter(X12Writer writer, HealthSimProperties properties) {
        return new EligibilityFormatter(writer, properties.getX12().getPayerName(), properties.getX12().getPayerId());
    }

    @Bean
    public ServiceReviewFormatter serviceReviewFormatter(X12Writer writer, HealthSimProperties properties) {
        return new ServiceReviewFormatter(writer, properties.getX12().getPayerName(), properties.getX12().getPayerId());
    }

    @Bean
    public ServiceReviewService serviceReviewService(Clock clock) {
        return new ServiceReviewService(clock);
    }

    // --- RxMemberSim ---

    @Bean
    public Formulary formulary(HealthSimProperties properties) {
        Formulary formulary = new FormularyGenerator().generate(properties.getPharmacy().getFormulary());
        log.info("Loaded formulary {} with {} drugs", formulary.formularyId(), formulary.size());
        return formulary;
    }

    @Bean
    public DurValidator durValidator(Formulary formulary) {
        return new DurValidator(formulary);
    }

    @Bean
    public ClaimHistory claimHistory(HealthSimProperties properties, PharmacyClaimRepository repository) {
        if (MEMORY_STORE.equalsIgnoreCase(properties.getPharmacy().getClaimStore())) {
            return new InMemoryClaimHistory();
        }
        return new JdbcClaimHistory(repository);
    }

    @Bean
    public PriorAuthorizationLedger priorAuthorizationLedger(HealthSimProperties properties,
                                                             PriorAuthorizationRepository repository) {
        if (MEMORY_STORE.equalsIgnoreCase(properties.getPharmacy().getClaimStore())) {
            return new InMemoryPriorAuthorizationLedger();
        }
        return new JdbcPriorAuthorizationLedger(repository);
    }

    @Bean
    public AdjudicationEngine adjudicationEngine(Formulary formulary, DurValidator durValidator,
                                                 ClaimHistory claimHistory, PriorAuthorizationLedger ledger,
                                                 HealthSimProperties properties, Clock clock) {
        HealthSimProperties.Pharmacy pharmacy = properties.getPharmacy();
        return new AdjudicationEngine(formulary, durValidator, claimHistory, ledger,
                new AdjudicationSettings(pharmacy.getRefillThresholdPercent(), pharmacy.getDurRejectSeverity(), clock));
    }

    @Bean
    public PriorAuthorizationService priorAuthorizationService(Formulary formulary, PriorAuthorizationLedger ledger,
                                                               Clock clock) {
        return new PriorAuthorizationService(formulary, ledger, clock);
    }

    @Bean
    public RxMemberRegistry rxMemberRegistry(ClaimHistory claimHistory, HealthSimProperties properties) {
        return new RxMemberRegistry(claimHistory, properties.getPharmacy().getMemberCapacity());
    }

    @Bean
    public NcpdpTelecomFormatter ncpdpTelecomFormatter(HealthSimProperties properties) {
        return new NcpdpTelecomFormatter(properties.getPharmacy().getSoftwareVendorId());
    }

    @Bean
    public NcpdpScriptFormatter ncpdpScriptFormatter(HealthSimProperties properties, Clock clock) {
        return new NcpdpScriptFormatter(properties.getX12().getPayerId(), clock);
    }
}
