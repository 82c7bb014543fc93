package com.fraudplatform.analysis;

import com.fraudplatform.common.model.ClaimRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Builder for claim rows used by the agent tests.
 */
public final class ClaimFixtures {

    private ClaimFixtures() {}

    public static Builder claim(String pharmacyNumber) {
        return new Builder(pharmacyNumber);
    }

    /** {@code count} copies of the claim produced by {@code customise}. */
    public static List<ClaimRecord> times(int count, String pharmacyNumber, UnaryOperator<Builder> customise) {
        List<ClaimRecord> claims = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            claims.add(customise.apply(claim(pharmacyNumber).patient("PT-" + i)).build());
        }
        return claims;
    }

    public static final class Builder {
        private final String pharmacyNumber;
        private String patientId = "PT-1";
        private String productNdc = "00001-0001";
        private String coverageType = "Well Covered";
        private Integer occ;
        private Double copay = 10.0;
        private Double oop = 10.0;
        private Double copayFee = 0.0;
        private Double original = 50.0;
        private LocalDate submitted = LocalDate.of(2024, 1, 15);
        private String networkFlag = "Y";
        private String networkType = "Chain";
        private String paRejection;
        private String cobRejection;
        private String paStatusCode;
        private String paStatusDesc;

        private Builder(String pharmacyNumber) {
            this.pharmacyNumber = pharmacyNumber;
        }

        public Builder patient(String id)           { this.patientId = id; return this; }
        public Builder product(String ndc)          { this.productNdc = ndc; return this; }
        public Builder coverage(String type)        { this.coverageType = type; return this; }
        public Builder occ(Integer code)            { this.occ = code; return this; }
        public Builder copay(Double amount)         { this.copay = amount; return this; }
        public Builder oop(Double amount)           { this.oop = amount; return this; }
        public Builder copayFee(Double amount)      { this.copayFee = amount; return this; }
        public Builder original(Double amount)      { this.original = amount; return this; }
        public Builder submitted(LocalDate date)    { this.submitted = date; return this; }
        public Builder network(String flag)         { this.networkFlag = flag; return this; }
        public Builder networkType(String type)     { this.networkType = type; return this; }
        public Builder paRejection(String code)     { this.paRejection = code; return this; }
        public Builder cobRejection(String code)    { this.cobRejection = code; return this; }
        public Builder paStatusCode(String code)    { this.paStatusCode = code; return this; }
        public Builder paStatusDesc(String desc)    { this.paStatusDesc = desc; return this; }

        public ClaimRecord build() {
            return new ClaimRecord(pharmacyNumber, "Pharmacy " + pharmacyNumber, "Austin", "TX",
                patientId, productNdc, "Product " + productNdc, coverageType, occ,
                copay, oop, copayFee, original, submitted,
                networkFlag, networkType, paRejection, null, cobRejection, null,
                paStatusCode, paStatusDesc);
        }
    }
}
