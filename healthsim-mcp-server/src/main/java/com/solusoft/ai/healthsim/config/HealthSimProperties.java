package com.solusoft.ai.healthsim.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * Settings under {@code healthsim.*}: generation defaults plus envelope identities for each wire format.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "healthsim")
public class HealthSimProperties {

    private Generation generation = new Generation();
    private X12 x12 = new X12();
    private Hl7 hl7 = new Hl7();
    private Pharmacy pharmacy = new Pharmacy();

    @Data
    public static class Generation {
        // null means a fresh seed per call
        private Long defaultSeed;
        private int maxBatchSize = 500;
    }

    @Data
    public static class X12 {
        private String senderId = "HEALTHSIM";
        private String receiverId = "RECEIVER";
        private String usageIndicator = "T";
        private String payerName = "HEALTHSIM HEALTH PLAN";
        private String payerId = "HSPAYER01";
    }

    @Data
    public static class Hl7 {
        private String sendingApplication = "HEALTHSIM";
        private String sendingFacility = "HEALTHSIM_FAC";
        private String receivingApplication = "RECEIVER";
        private String receivingFacility = "RECEIVER_FAC";
        private String processingId = "T";
    }

    @Data
    public static class Pharmacy {
        private String defaultBin = "610014";
        private String defaultPcn = "RXTEST";
        private String defaultGroup = "GRP001";
        private String formulary = "commercial";
        private int refillThresholdPercent = 75;
        private int durRejectSeverity = 2;
        private BigDecimal deductibleLimit = new BigDecimal("250.00");
        private BigDecimal oopLimit = new BigDecimal("3000.00");
        private String claimStore = "jdbc";
        private int memberCapacity = 10_000;
        private String pharmacyNpi = "1234567893";
        private BigDecimal dispensingFee = new BigDecimal("2.00");
        private String softwareVendorId = "HEALTHSIM1";
    }
}
