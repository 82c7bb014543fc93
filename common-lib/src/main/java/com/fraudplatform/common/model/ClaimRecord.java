package com.fraudplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Set;

/**
 * One pharmacy claim row from the copay detail extract.
 *
 * <p>Column names follow the source table ({@code dbo.rpt_copay_detail_bc_ext}) so the
 * same record binds to both the CSV export and JSON request bodies. Every field except
 * {@code pharmacyNumber} is optional; numeric helpers treat a missing value as 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimRecord(
    @JsonProperty("pharmacy_number") String pharmacyNumber,
    @JsonProperty("pharmacy_name") String pharmacyName,
    @JsonProperty("pharmacy_city") String pharmacyCity,
    @JsonProperty("pharmacy_state") String pharmacyState,
    @JsonProperty("patient_id") String patientId,
    @JsonProperty("product_ndc") String productNdc,
    @JsonProperty("product_name") String productName,
    @JsonProperty("coverage_type") String coverageType,
    @JsonProperty("occ") Integer occ,
    @JsonProperty("copay_cost") Double copayCost,
    @JsonProperty("oop_cost") Double oopCost,
    @JsonProperty("copay_fee_cost") Double copayFeeCost,
    @JsonProperty("original_cost") Double originalCost,
    @JsonProperty("date_submitted") LocalDate dateSubmitted,
    @JsonProperty("is_network_pharmacy") String isNetworkPharmacy,
    @JsonProperty("network_pharmacy_group_type") String networkPharmacyGroupType,
    @JsonProperty("pa_rejection_code_1") String paRejectionCode1,
    @JsonProperty("pa_rejection_code_2") String paRejectionCode2,
    @JsonProperty("claim_cob_primary_reject_code1") String cobPrimaryRejectCode1,
    @JsonProperty("claim_cob_primary_reject_code2") String cobPrimaryRejectCode2,
    @JsonProperty("latest_pa_status_code") String latestPaStatusCode,
    @JsonProperty("latest_pa_status_desc") String latestPaStatusDesc
) {
    public static final String UNKNOWN = "Unknown";

    /** Coverage types treated as uninsured spend. */
    public static final Set<String> CASH_COVERAGE_TYPES = Set.of("Cash", "Not Covered");

    public static final double HIGH_COPAY_THRESHOLD = 200.0;
    public static final double HIGH_OOP_THRESHOLD   = 500.0;

    public String coverage() {
        return coverageType == null ? "" : coverageType.strip();
    }

    public boolean isCashOrNotCovered() {
        return CASH_COVERAGE_TYPES.contains(coverage());
    }

    /** copay above $200 or out-of-pocket above $500. */
    public boolean isHighCost() {
        return copay() > HIGH_COPAY_THRESHOLD || oop() > HIGH_OOP_THRESHOLD;
    }

    public double copay()    { return copayCost    == null ? 0.0 : copayCost; }
    public double oop()      { return oopCost      == null ? 0.0 : oopCost; }
    public double copayFee() { return copayFeeCost == null ? 0.0 : copayFeeCost; }
    public double original() { return originalCost == null ? 0.0 : originalCost; }

    public String nameOrUnknown()  { return isBlank(pharmacyName)  ? UNKNOWN : pharmacyName; }
    public String cityOrUnknown()  { return isBlank(pharmacyCity)  ? UNKNOWN : pharmacyCity; }
    public String stateOrUnknown() { return isBlank(pharmacyState) ? UNKNOWN : pharmacyState; }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
